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

import com.pff.PSTException;
import com.pff.PSTFile;
import com.pff.PSTFolder;
import com.pff.PSTMessage;
import com.pff.PSTObject;
import java.io.File;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MailboxFolderHandle;
import pt.cjmach.mmdfexport.mailbox.MailboxSession;
import pt.cjmach.mmdfexport.mailbox.StoreInfo;

/**
 * Mailbox session over an Outlook OST/PST file, read with java-libpst.
 * <p>
 * The session, and every handle obtained from it, may only be used by the
 * thread that opened it.
 *
 * @author cmachado
 */
public class PstMailboxSession implements MailboxSession {

    private static final Logger logger = LoggerFactory.getLogger(PstMailboxSession.class);

    private final PSTFile pstFile;
    private final File file;
    private final Thread owner;
    private final PstMimeConverter converter;
    private StoreInfo storeInfo;
    private boolean closed;

    PstMailboxSession(PSTFile pstFile, File file) {
        this.pstFile = pstFile;
        this.file = file;
        this.owner = Thread.currentThread();
        this.converter = new PstMimeConverter();
    }

    /**
     * Opens an Outlook OST/PST file.
     *
     * @param file the OST/PST file.
     * @return a new session, bound to the calling thread.
     * @throws java.io.FileNotFoundException if the file doesn't exist or is
     * not a regular file.
     * @throws PSTException if the file is not a valid OST/PST file.
     * @throws IOException
     */
    public static PstMailboxSession open(File file) throws PSTException, IOException {
        PSTFile pstFile = new PSTFile(file); // throws FileNotFoundException is file doesn't exist.
        logger.info("Opened {}", file.getAbsolutePath());
        return new PstMailboxSession(pstFile, file);
    }

    @Override
    public String getDescription() {
        checkAccess();
        String storeName;
        try {
            storeName = getStoreInfo().getDisplayName();
        } catch (MailboxException ex) {
            logger.warn("Failed to get message store name.", ex);
            storeName = "";
        }
        return String.format("Name: java-libpst, File: %s, Type: %s, Store: %s", file.getAbsolutePath(),
                pstFile.getPSTFileType() == PSTFile.PST_TYPE_ANSI ? "ANSI" : "Unicode", storeName);
    }

    @Override
    public MailboxFolderHandle getRootFolder() throws MailboxException {
        checkAccess();
        PSTFolder root = PstReads.read("root folder of " + file.getAbsolutePath(), pstFile::getRootFolder);
        return new PstFolderHandle(this, root, PstFolderHandle.PATH_SEPARATOR);
    }

    @Override
    public PstMimeConverter getConverter() {
        return converter;
    }

    /**
     * Loads a message by descriptor id.
     *
     * @param descriptorNodeId descriptor id of the message.
     * @return the loaded message.
     * @throws MailboxException if the item can't be loaded or is not a
     * message.
     */
    PSTMessage loadMessage(long descriptorNodeId) throws MailboxException {
        checkAccess();
        PSTObject child = PstReads.read("item " + descriptorNodeId,
                () -> PSTObject.detectAndLoadPSTObject(pstFile, descriptorNodeId));
        if (!(child instanceof PSTMessage)) {
            throw new MailboxException(String.format("Unexpected item kind %s for descriptor %d.",
                    child == null ? null : child.getClass().getSimpleName(), descriptorNodeId));
        }
        return (PSTMessage) child;
    }

    StoreInfo getStoreInfo() throws MailboxException {
        checkAccess();
        if (storeInfo == null) {
            String storeName = PstReads.read("message store of " + file.getAbsolutePath(),
                    () -> pstFile.getMessageStore().getDisplayName());
            storeInfo = new StoreInfo(storeName, file.getAbsolutePath());
        }
        return storeInfo;
    }

    /**
     * @throws IllegalStateException if the session is closed or the calling
     * thread is not the thread that opened the session.
     */
    void checkAccess() {
        if (closed) {
            throw new IllegalStateException("Session is closed.");
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException(String.format("Session owned by thread %s used from thread %s.",
                    owner.getName(), Thread.currentThread().getName()));
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        checkAccess();
        closed = true;
        try {
            pstFile.close();
        } catch (IOException ex) {
            logger.warn("Failed to close {}.", file.getAbsolutePath(), ex);
        }
    }
}
