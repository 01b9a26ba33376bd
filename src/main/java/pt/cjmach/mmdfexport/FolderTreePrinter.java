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
package pt.cjmach.mmdfexport;

import java.io.PrintStream;
import org.apache.commons.lang3.StringUtils;
import pt.cjmach.mmdfexport.mailbox.MailFolder;

/**
 * Prints a folder tree in a human readable form.
 *
 * @author cmachado
 */
public class FolderTreePrinter {

    private static final String INDENT = "  "; // NOI18N

    private final PrintStream out;

    public FolderTreePrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints one {@code [total] name} line per folder, indented by depth.
     *
     * @param root root of the tree to print.
     * @param skipEmptyFolders do not print folders without items, including
     * items of sub folders.
     */
    public void printTree(MailFolder root, boolean skipEmptyFolders) {
        printTree(root, 0, skipEmptyFolders);
    }

    private void printTree(MailFolder folder, int depth, boolean skipEmptyFolders) {
        if (skipEmptyFolders && folder.getTotalItems() == 0) {
            return;
        }
        out.println(StringUtils.repeat(INDENT, depth) + "[" + folder.getTotalItems() + "] " + folder.getName());
        for (MailFolder child : folder.getChildren()) {
            printTree(child, depth + 1, skipEmptyFolders);
        }
    }
}
