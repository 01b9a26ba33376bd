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
package pt.cjmach.mmdfexport;

import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.convert.ConversionException;
import pt.cjmach.mmdfexport.convert.MessageConverter;
import pt.cjmach.mmdfexport.mailbox.MailItem;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MapiObject;

/**
 * Turns one mail item into its MIME bytes and creation time. Failures are
 * never thrown; they are reported through the returned
 * {@link ExtractionResult}.
 *
 * @author cmachado
 */
public class MessageExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MessageExtractor.class);

    /**
     * Message class prefix of meeting responses. Items of this family are not
     * exported.
     */
    public static final String MEETING_RESPONSE_PREFIX = "IPM.Schedule.Meeting.Resp."; // NOI18N

    private final MessageConverter converter;
    private final ConversionBuffer buffer;

    /**
     * @param converter the converter of the mailbox session.
     * @param buffer buffer reused for every extracted item.
     */
    public MessageExtractor(MessageConverter converter, ConversionBuffer buffer) {
        if (converter == null) {
            throw new IllegalArgumentException("converter is null.");
        }
        if (buffer == null) {
            throw new IllegalArgumentException("buffer is null.");
        }
        this.converter = converter;
        this.buffer = buffer;
    }

    public ConversionBuffer getBuffer() {
        return buffer;
    }

    /**
     * Extracts the given item. The item is not closed.
     * <p>
     * Unchecked exceptions thrown while reading a damaged item or converting
     * it skip the item; only an unreadable native object stops the export.
     *
     * @param item the item to extract.
     * @return the outcome of the extraction.
     */
    public ExtractionResult extract(MailItem item) {
        buffer.reset();

        String messageClass = null;
        try {
            messageClass = item.getMessageClass();
        } catch (MailboxException ex) {
            logger.debug("Failed to get message class.", ex);
        } catch (RuntimeException ex) {
            return ExtractionResult.skipped(ex);
        }
        if (messageClass != null && messageClass.startsWith(MEETING_RESPONSE_PREFIX)) {
            return ExtractionResult.empty();
        }

        Date timestamp = null;
        try {
            timestamp = item.getCreationTime();
        } catch (MailboxException ex) {
            logger.debug("Failed to get creation time.", ex);
        } catch (RuntimeException ex) {
            return ExtractionResult.skipped(ex);
        }

        MapiObject mapiObject;
        try {
            mapiObject = item.getMapiObject();
        } catch (MailboxException | RuntimeException ex) {
            logger.error("Failed to get MAPI object.", ex);
            return ExtractionResult.stop(ex);
        }

        try (MapiObject message = mapiObject) {
            converter.writeMime(message, buffer);
        } catch (ConversionException | RuntimeException ex) {
            return ExtractionResult.skipped(ex);
        }

        int size = buffer.position();
        if (size <= 0) {
            logger.warn("Converter wrote no data for message of class {}.", messageClass);
            return ExtractionResult.empty();
        }
        // the buffer is reused by the next item, so hand out a copy.
        return ExtractionResult.payload(buffer.toByteArray(), timestamp);
    }
}
