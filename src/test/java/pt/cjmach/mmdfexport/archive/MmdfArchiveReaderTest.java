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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Set;
import java.util.zip.GZIPOutputStream;
import javax.mail.MessagingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author cmachado
 */
public class MmdfArchiveReaderTest {
    @TempDir
    Path outputDirectory;

    MmdfArchiveReader instance;

    @BeforeEach
    public void setUp() {
        instance = new MmdfArchiveReader();
    }

    private static byte[] message(long descriptorId, String subject) {
        String text = "X-Outlook-Descriptor-Id: " + descriptorId + "\r\n"
                + "Subject: " + subject + "\r\n"
                + "\r\n"
                + "Hello.\r\n";
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    public void testExtractDescriptorIds() throws IOException, MessagingException {
        try (MonthlyArchiveWriter writer = new MonthlyArchiveWriter(outputDirectory, "Inbox", "mmdf.gz", ZoneOffset.UTC)) {
            writer.submit(message(2097252, "one"), Date.from(Instant.parse("2023-01-05T10:00:00Z")));
            writer.submit(message(2097284, "two"), Date.from(Instant.parse("2023-02-05T10:00:00Z")));
            writer.submit("Subject: no id\r\n\r\nx\r\n".getBytes(StandardCharsets.US_ASCII),
                    Date.from(Instant.parse("2023-02-06T10:00:00Z")));
        }
        Files.write(outputDirectory.resolve("ignored.txt"), new byte[]{1, 2, 3});

        Set<Long> ids = instance.extractDescriptorIds(outputDirectory, "mmdf.gz");
        assertEquals(Set.of(2097252L, 2097284L), ids);
    }

    @Test
    public void testExtractDescriptorIdsInexistentDirectory() {
        Path missing = outputDirectory.resolve("missing");
        assertThrows(IllegalArgumentException.class, () -> instance.extractDescriptorIds(missing, "mmdf.gz"));
    }

    @Test
    public void testReadFramesMalformed() throws IOException {
        Path archive = outputDirectory.resolve("Broken_202301.mmdf.gz");
        try (OutputStream output = new GZIPOutputStream(Files.newOutputStream(archive))) {
            output.write("plain text".getBytes(StandardCharsets.US_ASCII));
        }
        assertThrows(IOException.class, () -> instance.readFrames(archive));
    }
}
