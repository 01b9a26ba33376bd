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
import com.pff.PSTMessage;
import com.pff.PSTObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.mailbox.ItemCollection;
import pt.cjmach.mmdfexport.mailbox.MailItem;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.SortField;

/**
 * Items of a PST folder. The first call that needs the order of the items
 * reads the descriptor id and times of every child once; items are then
 * loaded one at a time by descriptor id when first used.
 *
 * @author cmachado
 */
class PstItemCollection implements ItemCollection {

    private static final Logger logger = LoggerFactory.getLogger(PstItemCollection.class);

    private final PstMailboxSession session;
    private final PSTFolder folder;
    private List<Entry> entries;
    private boolean closed;

    PstItemCollection(PstMailboxSession session, PSTFolder folder) {
        this.session = session;
        this.folder = folder;
    }

    @Override
    public void sort(SortField field, boolean descending) throws MailboxException {
        if (field != SortField.CREATION_TIME) {
            throw new IllegalArgumentException("Unsupported sort field: " + field);
        }
        Comparator<Entry> comparator = Comparator.comparing(Entry::getCreationTime,
                Comparator.nullsFirst(Comparator.<Date>naturalOrder()));
        entries().sort(descending ? comparator.reversed() : comparator);
    }

    @Override
    public int count() throws MailboxException {
        checkOpen();
        if (entries == null) {
            return PstReads.read("item count of folder " + folder.getDescriptorNodeId(), folder::getContentCount);
        }
        return entries.size();
    }

    @Override
    public MailItem fetch(int position) throws MailboxException {
        List<Entry> list = entries();
        if (position < 1 || position > list.size()) {
            throw new MailboxException(String.format("Item position %d out of range [1, %d].", position, list.size()));
        }
        Entry entry = list.get(position - 1);
        return new PstMailItem(session, entry.descriptorNodeId, entry.creationTime);
    }

    @Override
    public void close() {
        closed = true;
        entries = null;
    }

    private void checkOpen() {
        session.checkAccess();
        if (closed) {
            throw new IllegalStateException("Item collection is closed.");
        }
    }

    private List<Entry> entries() throws MailboxException {
        checkOpen();
        if (entries == null) {
            entries = readEntries();
        }
        return entries;
    }

    private List<Entry> readEntries() throws MailboxException {
        return PstReads.read("items of folder " + folder.getDescriptorNodeId(), () -> {
            List<Entry> result = new ArrayList<>(Math.max(0, folder.getContentCount()));
            folder.moveChildCursorTo(0);
            PSTObject child = folder.getNextChild();
            while (child != null) {
                if (child instanceof PSTMessage) {
                    result.add(new Entry(child.getDescriptorNodeId(), ((PSTMessage) child).getCreationTime()));
                } else {
                    logger.debug("Ignoring child {} of kind {} in folder {}.", child.getDescriptorNodeId(),
                            child.getClass().getSimpleName(), folder.getDisplayName());
                }
                try {
                    child = folder.getNextChild();
                } catch (IndexOutOfBoundsException ex) {
                    // thrown by java-libpst on some damaged folders; keep what was read.
                    logger.error("Index out of bounds when trying to get next child on folder {} ({}).",
                            folder.getDisplayName(), folder.getDescriptorNodeId());
                    break;
                }
            }
            return result;
        });
    }

    private static final class Entry {

        final long descriptorNodeId;
        final Date creationTime;

        Entry(long descriptorNodeId, Date creationTime) {
            this.descriptorNodeId = descriptorNodeId;
            this.creationTime = creationTime;
        }

        Date getCreationTime() {
            return creationTime;
        }
    }
}
