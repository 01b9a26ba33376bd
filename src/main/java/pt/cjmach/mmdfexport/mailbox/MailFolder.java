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
import java.util.Collections;
import java.util.List;

/**
 * In-memory node of the folder tree. Built once by
 * {@link FolderTreeBuilder} and not modified afterwards.
 *
 * @author cmachado
 */
public class MailFolder {

    private final MailboxFolderHandle handle;
    private final MailFolder parent;
    private final List<MailFolder> children = new ArrayList<>();

    private String entryId = "";
    private String name = "";
    private String path = "";
    private String containerClass = "";
    private int defaultItemType;
    private String defaultMessageClass = "";
    private String store = "";
    private String storePath = "";
    private int numFolders;
    private int numItems;
    private int totalItems;

    public MailFolder(MailboxFolderHandle handle, MailFolder parent) {
        this.handle = handle;
        this.parent = parent;
    }

    public MailboxFolderHandle getHandle() {
        return handle;
    }

    /**
     * @return the parent folder, or {@code null} for the root of the tree.
     */
    public MailFolder getParent() {
        return parent;
    }

    public List<MailFolder> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(MailFolder child) {
        children.add(child);
        totalItems += child.getTotalItems();
    }

    public String getEntryId() {
        return entryId;
    }

    void setEntryId(String entryId) {
        this.entryId = entryId;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public String getPath() {
        return path;
    }

    void setPath(String path) {
        this.path = path;
    }

    public String getContainerClass() {
        return containerClass;
    }

    void setContainerClass(String containerClass) {
        this.containerClass = containerClass;
    }

    public int getDefaultItemType() {
        return defaultItemType;
    }

    void setDefaultItemType(int defaultItemType) {
        this.defaultItemType = defaultItemType;
    }

    public String getDefaultMessageClass() {
        return defaultMessageClass;
    }

    void setDefaultMessageClass(String defaultMessageClass) {
        this.defaultMessageClass = defaultMessageClass;
    }

    public String getStore() {
        return store;
    }

    public String getStorePath() {
        return storePath;
    }

    void setStore(String store, String storePath) {
        this.store = store;
        this.storePath = storePath;
    }

    /**
     * @return the number of sub folders reported by the mailbox, including
     * those that could not be read.
     */
    public int getNumFolders() {
        return numFolders;
    }

    void setNumFolders(int numFolders) {
        this.numFolders = numFolders;
    }

    /**
     * @return the number of items stored directly in this folder.
     */
    public int getNumItems() {
        return numItems;
    }

    void setNumItems(int numItems) {
        this.totalItems += numItems - this.numItems;
        this.numItems = numItems;
    }

    /**
     * @return the number of items in this folder and all its descendants.
     */
    public int getTotalItems() {
        return totalItems;
    }

    @Override
    public String toString() {
        return name + " " + path + " (" + totalItems + ")";
    }
}
