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
import java.io.IOException;
import pt.cjmach.mmdfexport.mailbox.MailboxException;

/**
 * Runs java-libpst reads and reports every failure as a
 * {@link MailboxException}. Besides {@link PSTException} and
 * {@link IOException}, java-libpst throws {@link NullPointerException},
 * {@link IndexOutOfBoundsException} and other unchecked exceptions when a
 * PST structure is damaged.
 *
 * @author cmachado
 */
final class PstReads {

    /**
     * A read from a PST file.
     *
     * @param <T> type of the value read.
     */
    @FunctionalInterface
    interface PstRead<T> {

        T read() throws PSTException, IOException;
    }

    private PstReads() {
    }

    /**
     * @param what description of the value read, used in the exception
     * message.
     * @param read the read to run.
     * @return the value read.
     * @throws MailboxException if the read fails for any reason.
     */
    static <T> T read(String what, PstRead<T> read) throws MailboxException {
        try {
            return read.read();
        } catch (PSTException | IOException | RuntimeException ex) {
            throw new MailboxException("Failed to read " + what, ex);
        }
    }
}
