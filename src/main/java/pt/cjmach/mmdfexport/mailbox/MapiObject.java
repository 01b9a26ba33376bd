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
 * Opaque native object backing a mail item. The converter asks it for the
 * concrete message interface it knows how to convert.
 */
public interface MapiObject extends AutoCloseable {

    /**
     * Returns this object as an instance of the given type.
     *
     * @param <T> the requested type.
     * @param type the requested type.
     * @return this object, or its delegate, viewed as {@code type}.
     * @throws MailboxException if the object does not support {@code type}.
     */
    <T> T unwrap(Class<T> type) throws MailboxException;

    /**
     * Releases the native object.
     */
    @Override
    void close();
}
