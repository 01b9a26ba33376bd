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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author cmachado
 */
public class MmdfFramingTest {

    @Test
    public void testWriteFrame() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        MmdfFraming.writeFrame(output, "Subject: x\r\n\r\nhi\r\n".getBytes(StandardCharsets.US_ASCII));
        byte[] expected = "\u0001\u0001\u0001\u0001\nSubject: x\r\n\r\nhi\r\n\u0001\u0001\u0001\u0001\n"
                .getBytes(StandardCharsets.US_ASCII);
        assertArrayEquals(expected, output.toByteArray());
    }

    @Test
    public void testPostmarkIsCopy() {
        byte[] postmark = MmdfFraming.postmark();
        postmark[0] = 'X';
        assertEquals(0x01, MmdfFraming.postmark()[0]);
        assertEquals(5, MmdfFraming.postmark().length);
    }

    @Test
    public void testSplitFrames() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        MmdfFraming.writeFrame(output, "first".getBytes(StandardCharsets.US_ASCII));
        MmdfFraming.writeFrame(output, "second\n".getBytes(StandardCharsets.US_ASCII));

        List<byte[]> frames = MmdfFraming.splitFrames(output.toByteArray());
        assertEquals(2, frames.size());
        assertEquals("first", new String(frames.get(0), StandardCharsets.US_ASCII));
        assertEquals("second\n", new String(frames.get(1), StandardCharsets.US_ASCII));
        assertTrue(MmdfFraming.splitFrames(new byte[0]).isEmpty());
    }

    @Test
    public void testSplitFramesMalformed() {
        byte[] garbage = "not a frame".getBytes(StandardCharsets.US_ASCII);
        assertThrows(IOException.class, () -> MmdfFraming.splitFrames(garbage));

        byte[] unterminated = "\u0001\u0001\u0001\u0001\nno end".getBytes(StandardCharsets.US_ASCII);
        assertThrows(IOException.class, () -> MmdfFraming.splitFrames(unterminated));
    }

    @Test
    public void testIndexOfPostmark() {
        byte[] data = "ab\u0001\u0001\u0001\u0001\ncd".getBytes(StandardCharsets.US_ASCII);
        assertEquals(2, MmdfFraming.indexOfPostmark(data, 0));
        assertEquals(-1, MmdfFraming.indexOfPostmark(data, 3));
    }
}
