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
package pt.cjmach.mmdfexport.archive;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * MMDF message framing. Every message is written between two postmarks,
 * where a postmark is four {@code 0x01} bytes followed by a line feed.
 * <p>
 * The payload is not escaped: a message body that contains the postmark
 * verbatim cannot be framed unambiguously.
 *
 * @author cmachado
 */
public final class MmdfFraming {

    private static final byte[] POSTMARK = {0x01, 0x01, 0x01, 0x01, '\n'};

    private MmdfFraming() {
    }

    /**
     * @return a copy of the postmark byte sequence.
     */
    public static byte[] postmark() {
        return POSTMARK.clone();
    }

    /**
     * Writes {@code payload} surrounded by postmarks.
     *
     * @param output
     * @param payload
     * @throws IOException
     */
    public static void writeFrame(OutputStream output, byte[] payload) throws IOException {
        output.write(POSTMARK);
        output.write(payload);
        output.write(POSTMARK);
    }

    /**
     * Splits a sequence of concatenated frames back into their payloads.
     *
     * @param data decompressed archive content.
     * @return the payloads, in the order they were written.
     * @throws IOException if {@code data} is not a sequence of complete
     * frames.
     */
    public static List<byte[]> splitFrames(byte[] data) throws IOException {
        List<byte[]> frames = new ArrayList<>();
        int pos = 0;
        while (pos < data.length) {
            if (!startsWithPostmark(data, pos)) {
                throw new IOException("Expected postmark at offset " + pos);
            }
            int start = pos + POSTMARK.length;
            int end = indexOfPostmark(data, start);
            if (end < 0) {
                throw new IOException("Unterminated frame at offset " + pos);
            }
            frames.add(Arrays.copyOfRange(data, start, end));
            pos = end + POSTMARK.length;
        }
        return frames;
    }

    static int indexOfPostmark(byte[] data, int from) {
        for (int i = from; i <= data.length - POSTMARK.length; i++) {
            if (startsWithPostmark(data, i)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean startsWithPostmark(byte[] data, int offset) {
        if (data.length - offset < POSTMARK.length) {
            return false;
        }
        for (int i = 0; i < POSTMARK.length; i++) {
            if (data[offset + i] != POSTMARK[i]) {
                return false;
            }
        }
        return true;
    }
}
