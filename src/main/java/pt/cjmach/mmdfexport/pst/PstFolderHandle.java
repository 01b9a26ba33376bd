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
package pt.cjmach.mmdfexport.pst;

import com.pff.PSTFolder;
import java.util.Collections;
import java.util.List;
import pt.cjmach.mmdfexport.mailbox.ItemCollection;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MailboxFolderHandle;
import pt.cjmach.mmdfexport.mailbox.StoreInfo;

/**
 * Folder of a PST file.
 *
 * @author cmachado
 */
class PstFolderHandle implements MailboxFolderHandle {

    static final String PATH_SEPARATOR = "\\"; // NOI18N

    private final PstMailboxSession session;
    private final PSTFolder folder;
    private final String path;
    private List<PSTFolder> subFolders;

    PstFolderHandle(PstMailboxSession session, PSTFolder folder, String path) {
        this.session = session;
        this.folder = folder;
        this.path = path;
    }

    @Override
    public String getEntryId() throws MailboxException {
        session.checkAccess();
        return PstReads.read("entry id of folder " + path, () -> Long.toString(folder.getDescriptorNodeId()));
    }

    @Override
    public String getName() throws MailboxException {
        session.checkAccess();
        return PstReads.read("name of folder " + path, folder::getDisplayName);
    }

    @Override
    public String getFolderPath() throws MailboxException {
        return path;
    }

    @Override
    public String getContainerClass() throws MailboxException {
        session.checkAccess();
        return PstReads.read("container class of folder " + path, folder::getContainerClass);
    }

    @Override
    public int getDefaultItemType() throws MailboxException {
        return PstItemType.fromContainerClass(getContainerClass()).getItemType();
    }

    @Override
    public String getDefaultMessageClass() throws MailboxException {
        return PstItemType.fromContainerClass(getContainerClass()).getMessageClass();
    }

    @Override
    public StoreInfo getStore() throws MailboxException {
        return session.getStoreInfo();
    }

    @Override
    public int getSubFolderCount() throws MailboxException {
        return subFolders().size();
    }

    @Override
    public MailboxFolderHandle getSubFolder(int position) throws MailboxException {
        List<PSTFolder> list = subFolders();
        if (position < 1 || position > list.size()) {
            throw new MailboxException(String.format("Sub folder position %d out of range [1, %d].", position, list.size()));
        }
        PSTFolder subFolder = list.get(position - 1);
        String name = PstReads.read("name of sub folder " + position + " of " + path, subFolder::getDisplayName);
        return new PstFolderHandle(session, subFolder, path + PATH_SEPARATOR + name);
    }

    @Override
    public ItemCollection getItems() throws MailboxException {
        session.checkAccess();
        return new PstItemCollection(session, folder);
    }

    private List<PSTFolder> subFolders() throws MailboxException {
        session.checkAccess();
        if (subFolders == null) {
            subFolders = PstReads.<List<PSTFolder>>read("sub folders of " + path,
                    () -> folder.hasSubfolders() ? folder.getSubFolders() : Collections.<PSTFolder>emptyList());
        }
        return subFolders;
    }
}
