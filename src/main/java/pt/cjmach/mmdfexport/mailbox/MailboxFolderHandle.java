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
 * Native handle to a folder of the mailbox. Every read may fail
 * independently of the others.
 *
 * @author cmachado
 */
public interface MailboxFolderHandle {

    String getEntryId() throws MailboxException;

    String getName() throws MailboxException;

    /**
     * @return the full path of the folder, e.g. {@code \\Outlook\Inbox}.
     * @throws MailboxException
     */
    String getFolderPath() throws MailboxException;

    /**
     * @return the container class of the folder, e.g. {@code IPF.Note}.
     * @throws MailboxException
     */
    String getContainerClass() throws MailboxException;

    int getDefaultItemType() throws MailboxException;

    String getDefaultMessageClass() throws MailboxException;

    StoreInfo getStore() throws MailboxException;

    int getSubFolderCount() throws MailboxException;

    /**
     * @param position 1-based position, in {@code [1, getSubFolderCount()]}.
     * @return the sub folder at the given position.
     * @throws MailboxException
     */
    MailboxFolderHandle getSubFolder(int position) throws MailboxException;

    /**
     * Opens the item collection of this folder. The caller must close it.
     *
     * @return the item collection.
     * @throws MailboxException
     */
    ItemCollection getItems() throws MailboxException;
}
