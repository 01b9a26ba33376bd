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
package pt.cjmach.mmdfexport.convert;

import java.io.OutputStream;
import pt.cjmach.mmdfexport.mailbox.MapiObject;

/**
 * Converts the native object of a mail item to an RFC 822 / MIME byte
 * stream.
 *
 * @author cmachado
 */
public interface MessageConverter {

    /**
     * Name of the custom header added to each converted message to allow to
     * easily trace back the original message from the mailbox.
     */
    String DESCRIPTOR_ID_HEADER = "X-Outlook-Descriptor-Id"; // NOI18N
    String DELIVERY_TIME_HEADER = "X-PST-Delivery-Time"; // NOI18N

    /**
     * When enabled, address entries that are not SMTP addresses (e.g.
     * Exchange {@code EX} entries) are resolved to their SMTP address before
     * they are written to the message headers.
     *
     * @param resolveAddresses
     */
    void setResolveAddresses(boolean resolveAddresses);

    /**
     * Writes the MIME representation of the given message to
     * {@code output}. The stream is not closed.
     *
     * @param message the native message object.
     * @param output the target stream.
     * @throws ConversionException if the message cannot be converted.
     */
    void writeMime(MapiObject message, OutputStream output) throws ConversionException;
}
