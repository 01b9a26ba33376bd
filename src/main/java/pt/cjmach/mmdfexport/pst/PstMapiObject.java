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
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MapiObject;

/**
 * Native object of a PST item: the {@link PSTMessage} itself.
 */
class PstMapiObject implements MapiObject {

    private PSTMessage message;

    PstMapiObject(PSTMessage message) {
        this.message = message;
    }

    @Override
    public <T> T unwrap(Class<T> type) throws MailboxException {
        if (message == null) {
            throw new MailboxException("MAPI object already released.");
        }
        if (!type.isInstance(message)) {
            throw new MailboxException(String.format("%s does not implement %s.",
                    message.getClass().getSimpleName(), type.getName()));
        }
        return type.cast(message);
    }

    @Override
    public void close() {
        message = null;
    }
}
