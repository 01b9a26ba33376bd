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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory folder handle. Individual properties and sub folders can be made
 * unreadable.
 */
public class FakeFolderHandle implements MailboxFolderHandle {

    private final String name;
    private final String path;
    private final FakeMessage[] messages;
    private final List<FakeFolderHandle> children = new ArrayList<>();
    private final Set<String> failing = new HashSet<>();
    private final Set<Integer> failingChildren = new HashSet<>();
    private FakeItemCollection lastItems;

    public FakeFolderHandle(String name, String path, FakeMessage... messages) {
        this.name = name;
        this.path = path;
        this.messages = messages;
    }

    public static FakeFolderHandle root() {
        return new FakeFolderHandle("", "\\");
    }

    /**
     * Adds a sub folder named {@code childName} and returns it.
     */
    public FakeFolderHandle add(String childName, FakeMessage... childMessages) {
        String childPath = path.endsWith("\\") ? path + childName : path + "\\" + childName;
        FakeFolderHandle child = new FakeFolderHandle(childName, childPath, childMessages);
        children.add(child);
        return child;
    }

    /**
     * Makes the given property ({@code name}, {@code path}, {@code entryId},
     * {@code containerClass}, {@code store}, {@code subFolderCount} or
     * {@code items}) unreadable.
     */
    public FakeFolderHandle failing(String property) {
        failing.add(property);
        return this;
    }

    public FakeFolderHandle failingChild(int position) {
        failingChildren.add(position);
        return this;
    }

    public FakeItemCollection getLastItems() {
        return lastItems;
    }

    private void check(String property) throws MailboxException {
        if (failing.contains(property)) {
            throw new MailboxException("Property " + property + " unreadable");
        }
    }

    @Override
    public String getEntryId() throws MailboxException {
        check("entryId");
        return "EID-" + path;
    }

    @Override
    public String getName() throws MailboxException {
        check("name");
        return name;
    }

    @Override
    public String getFolderPath() throws MailboxException {
        check("path");
        return path;
    }

    @Override
    public String getContainerClass() throws MailboxException {
        check("containerClass");
        return "IPF.Note";
    }

    @Override
    public int getDefaultItemType() throws MailboxException {
        return 0;
    }

    @Override
    public String getDefaultMessageClass() throws MailboxException {
        return "IPM.Note";
    }

    @Override
    public StoreInfo getStore() throws MailboxException {
        check("store");
        return new StoreInfo("Test Store", "/tmp/test.pst");
    }

    @Override
    public int getSubFolderCount() throws MailboxException {
        check("subFolderCount");
        return children.size();
    }

    @Override
    public MailboxFolderHandle getSubFolder(int position) throws MailboxException {
        if (failingChildren.contains(position)) {
            throw new MailboxException("Sub folder " + position + " unreadable");
        }
        if (position < 1 || position > children.size()) {
            throw new MailboxException("Sub folder position out of range: " + position);
        }
        return children.get(position - 1);
    }

    @Override
    public ItemCollection getItems() throws MailboxException {
        check("items");
        lastItems = new FakeItemCollection(messages);
        return lastItems;
    }
}
