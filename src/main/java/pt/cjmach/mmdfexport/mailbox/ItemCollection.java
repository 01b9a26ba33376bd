/*
 *  Copyright 2022-2025 Carlos Machado
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package pt.cjmach.mmdfexport.mailbox;

/**
 * Positional view over the items of one folder. Positions are 1-based and only
 * valid until the collection is sorted again or closed.
 *
 * @author cmachado
 */
public interface ItemCollection extends AutoCloseable {

    /**
     * Sorts the collection. Handles fetched before the call are invalidated.
     *
     * @param field the property to sort by.
     * @param descending {@code true} for descending order.
     * @throws MailboxException
     */
    void sort(SortField field, boolean descending) throws MailboxException;

    int count() throws MailboxException;

    /**
     * Fetches the item at the given position.
     *
     * @param position 1-based position, in {@code [1, count()]}.
     * @return a new item handle, owned by the caller.
     * @throws MailboxException if the item cannot be loaded.
     */
    MailItem fetch(int position) throws MailboxException;

    @Override
    void close();
}
