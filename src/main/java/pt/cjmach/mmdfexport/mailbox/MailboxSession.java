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

import pt.cjmach.mmdfexport.convert.MessageConverter;

/**
 * A logged on mailbox. Implementations are bound to the thread that opened
 * them and must be closed by the same thread.
 *
 * @author cmachado
 */
public interface MailboxSession extends AutoCloseable {

    /**
     * @return a single descriptive line about the mailbox provider, logged
     * when the session starts.
     */
    String getDescription();

    MailboxFolderHandle getRootFolder() throws MailboxException;

    /**
     * @return the converter that turns items of this mailbox into MIME.
     */
    MessageConverter getConverter();

    @Override
    void close();
}
