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
 * Thrown when the folder requested for export does not exist in the mailbox.
 */
public class FolderNotFoundException extends MailboxException {

    private static final long serialVersionUID = 1L;

    private final String folderName;

    public FolderNotFoundException(String folderName) {
        super(String.format("Folder %s not found", folderName));
        this.folderName = folderName;
    }

    public String getFolderName() {
        return folderName;
    }
}
