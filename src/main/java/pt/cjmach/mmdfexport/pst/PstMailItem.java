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

import com.pff.PSTMessage;
import java.util.Date;
import pt.cjmach.mmdfexport.mailbox.MailItem;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MapiObject;

/**
 * Mail item of a PST file. The handle holds the descriptor id and creation
 * time read from the folder index; the message itself is loaded on first use.
 *
 * @author cmachado
 */
class PstMailItem implements MailItem {

    private final PstMailboxSession session;
    private final long descriptorNodeId;
    private final Date creationTime;
    private PSTMessage message;
    private boolean released;

    PstMailItem(PstMailboxSession session, long descriptorNodeId, Date creationTime) {
        this.session = session;
        this.descriptorNodeId = descriptorNodeId;
        this.creationTime = creationTime;
    }

    @Override
    public String getSubject() throws MailboxException {
        PSTMessage loaded = message();
        return PstReads.read("subject of item " + descriptorNodeId, loaded::getSubject);
    }

    @Override
    public String getMessageClass() throws MailboxException {
        PSTMessage loaded = message();
        return PstReads.read("message class of item " + descriptorNodeId, loaded::getMessageClass);
    }

    @Override
    public Date getCreationTime() throws MailboxException {
        checkOpen();
        return creationTime;
    }

    @Override
    public MapiObject getMapiObject() throws MailboxException {
        return new PstMapiObject(message());
    }

    private PSTMessage message() throws MailboxException {
        checkOpen();
        if (message == null) {
            message = session.loadMessage(descriptorNodeId);
        }
        return message;
    }

    private void checkOpen() throws MailboxException {
        session.checkAccess();
        if (released) {
            throw new MailboxException("Item already released.");
        }
    }

    @Override
    public void close() {
        released = true;
        message = null;
    }
}
