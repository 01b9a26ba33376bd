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

import java.util.Collections;
import java.util.List;

/**
 * Result of a {@link FolderTreeBuilder} pass: the root node and every node
 * reachable from it, in depth-first order with the root first.
 */
public final class FolderTree {

    private final MailFolder root;
    private final List<MailFolder> folders;

    FolderTree(MailFolder root, List<MailFolder> folders) {
        this.root = root;
        this.folders = Collections.unmodifiableList(folders);
    }

    public MailFolder getRoot() {
        return root;
    }

    public List<MailFolder> getFolders() {
        return folders;
    }

    /**
     * Finds the first folder, in depth-first order, whose display name is
     * {@code name}. If no display name matches, the full folder path is tried.
     *
     * @param name display name or full path of the folder.
     * @return the folder found.
     * @throws FolderNotFoundException if no folder matches.
     */
    public MailFolder findFolder(String name) throws FolderNotFoundException {
        for (MailFolder folder : folders) {
            if (folder.getName().equals(name)) {
                return folder;
            }
        }
        for (MailFolder folder : folders) {
            if (folder.getPath().equals(name)) {
                return folder;
            }
        }
        throw new FolderNotFoundException(name);
    }
}
