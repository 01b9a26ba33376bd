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

import java.util.Date;

/**
 * Handle to one item fetched from an {@link ItemCollection}. A handle is only
 * valid for the iteration that fetched it and must be closed before the next
 * item is fetched.
 *
 * @author cmachado
 */
public interface MailItem extends AutoCloseable {

    String getSubject() throws MailboxException;

    /**
     * @return the message class of the item, e.g. {@code IPM.Note}.
     * @throws MailboxException
     */
    String getMessageClass() throws MailboxException;

    Date getCreationTime() throws MailboxException;

    /**
     * Returns the native object backing this item. A failure here means the
     * item store itself is no longer readable.
     *
     * @return the native backing object.
     * @throws MailboxException
     */
    MapiObject getMapiObject() throws MailboxException;

    @Override
    void close();
}
