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

import java.io.ByteArrayOutputStream;

/**
 * Growable byte buffer the converter writes each message into. One buffer
 * is allocated per export and reset before every message, so its backing
 * array is reused across iterations. Callers must copy the content out
 * (see {@link #toByteArray()}) before the next reset.
 *
 * @author cmachado
 */
public class ConversionBuffer extends ByteArrayOutputStream {

    static final int INITIAL_CAPACITY = 64 * 1024;

    /**
     * Backing arrays larger than this are dropped by {@link #trim()}.
     */
    static final int RETAINED_CAPACITY = 4 * 1024 * 1024;

    public ConversionBuffer() {
        super(INITIAL_CAPACITY);
    }

    /**
     * @return the number of bytes written since the last reset.
     */
    public synchronized int position() {
        return count;
    }

    /**
     * @return the length of the backing array.
     */
    public synchronized int capacity() {
        return buf.length;
    }

    /**
     * Resets the buffer and, if the backing array grew beyond
     * {@link #RETAINED_CAPACITY}, replaces it by a new array of the initial
     * capacity.
     */
    public synchronized void trim() {
        count = 0;
        if (buf.length > RETAINED_CAPACITY) {
            buf = new byte[INITIAL_CAPACITY];
        }
    }
}
