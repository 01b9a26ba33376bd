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

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the folder hierarchy of a mailbox and builds the in-memory
 * {@link MailFolder} tree, aggregating item counts on the way up.
 * <p>
 * Failing to read a single property of a folder is not fatal: the property
 * keeps its default value and the walk goes on. A sub folder that cannot be
 * fetched is skipped, together with everything below it.
 *
 * @author cmachado
 */
public class FolderTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FolderTreeBuilder.class);

    /**
     * Builds the folder tree rooted at {@code root}.
     *
     * @param root handle of the root folder.
     * @return the built tree.
     */
    public FolderTree build(MailboxFolderHandle root) {
        List<MailFolder> folders = new ArrayList<>();
        MailFolder rootFolder = build(root, null, folders);
        return new FolderTree(rootFolder, folders);
    }

    /**
     * Builds the node for {@code handle} and its descendants, appending every
     * node created to {@code folders}.
     *
     * @param handle
     * @param parent
     * @param folders
     * @return the node built for {@code handle}.
     */
    MailFolder build(MailboxFolderHandle handle, MailFolder parent, List<MailFolder> folders) {
        MailFolder folder = new MailFolder(handle, parent);
        folders.add(folder);
        readProperties(handle, folder);

        int subFolderCount = 0;
        try {
            subFolderCount = handle.getSubFolderCount();
        } catch (MailboxException ex) {
            logger.warn("Failed to get sub folders of {}.", folder.getPath(), ex);
        }
        folder.setNumFolders(subFolderCount);
        for (int i = 1; i <= subFolderCount; i++) {
            MailboxFolderHandle subFolder;
            try {
                subFolder = handle.getSubFolder(i);
            } catch (MailboxException ex) {
                logger.warn("Failed to get sub folder {} of {}.", i, folder.getPath(), ex);
                continue;
            }
            folder.addChild(build(subFolder, folder, folders));
        }

        try (ItemCollection items = handle.getItems()) {
            folder.setNumItems(items.count());
        } catch (MailboxException ex) {
            logger.debug("Failed to count items of {}.", folder.getPath(), ex);
        }
        return folder;
    }

    private void readProperties(MailboxFolderHandle handle, MailFolder folder) {
        try {
            folder.setName(StringUtils.defaultString(handle.getName()));
        } catch (MailboxException ex) {
            logger.debug("Failed to get folder name.", ex);
        }
        try {
            folder.setPath(StringUtils.defaultString(handle.getFolderPath()));
        } catch (MailboxException ex) {
            logger.debug("Failed to get path of folder {}.", folder.getName(), ex);
        }
        try {
            folder.setEntryId(StringUtils.defaultString(handle.getEntryId()));
        } catch (MailboxException ex) {
            logger.debug("Failed to get entry id of folder {}.", folder.getName(), ex);
        }
        try {
            folder.setContainerClass(StringUtils.defaultString(handle.getContainerClass()));
        } catch (MailboxException ex) {
            logger.debug("Failed to get container class of folder {}.", folder.getName(), ex);
        }
        try {
            folder.setDefaultItemType(handle.getDefaultItemType());
        } catch (MailboxException ex) {
            logger.debug("Failed to get default item type of folder {}.", folder.getName(), ex);
        }
        try {
            folder.setDefaultMessageClass(StringUtils.defaultString(handle.getDefaultMessageClass()));
        } catch (MailboxException ex) {
            logger.debug("Failed to get default message class of folder {}.", folder.getName(), ex);
        }
        try {
            StoreInfo store = handle.getStore();
            if (store != null) {
                folder.setStore(StringUtils.defaultString(store.getDisplayName()), StringUtils.defaultString(store.getFilePath()));
            }
        } catch (MailboxException ex) {
            logger.debug("Failed to get store of folder {}.", folder.getName(), ex);
        }
    }
}
