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

/**
 * Outcome of extracting one mail item.
 *
 * @author cmachado
 */
public final class ExtractionResult {

    /**
     * Closed set of extraction outcomes.
     */
    public enum Kind {
        /**
         * The item was converted; the payload is ready to be archived.
         */
        PAYLOAD,
        /**
         * The item was deliberately left out; nothing to archive.
         */
        EMPTY,
        /**
         * The item could not be converted; the export continues with the next
         * item.
         */
        SKIPPED,
        /**
         * The item store is unreadable; the export must stop.
         */
        STOP
    }

    private static final ExtractionResult EMPTY = new ExtractionResult(Kind.EMPTY, null, null, null);

    private final Kind kind;
    private final byte[] payload;
    private final Date timestamp;
    private final Exception cause;

    private ExtractionResult(Kind kind, byte[] payload, Date timestamp, Exception cause) {
        this.kind = kind;
        this.payload = payload;
        this.timestamp = timestamp;
        this.cause = cause;
    }

    public static ExtractionResult payload(byte[] payload, Date timestamp) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("payload is empty.");
        }
        return new ExtractionResult(Kind.PAYLOAD, payload, timestamp, null);
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    public static ExtractionResult skipped(Exception cause) {
        return new ExtractionResult(Kind.SKIPPED, null, null, cause);
    }

    public static ExtractionResult stop(Exception cause) {
        return new ExtractionResult(Kind.STOP, null, null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the converted message bytes, only set for {@link Kind#PAYLOAD}.
     */
    public byte[] getPayload() {
        return payload;
    }

    /**
     * @return the creation time of the item, or {@code null} if it could not
     * be read.
     */
    public Date getTimestamp() {
        return timestamp;
    }

    /**
     * @return the failure, set for {@link Kind#SKIPPED} and
     * {@link Kind#STOP}.
     */
    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return cause == null ? kind.name() : kind + ": " + cause.getMessage();
    }
}
