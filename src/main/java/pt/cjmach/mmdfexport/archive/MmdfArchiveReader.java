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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.zip.GZIPInputStream;
import javax.mail.MessagingException;
import javax.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.convert.MessageConverter;

/**
 * Reads back archives written by {@link MonthlyArchiveWriter}. Archives are
 * read sequentially, from the start.
 *
 * @author cmachado
 */
public class MmdfArchiveReader {

    private static final Logger logger = LoggerFactory.getLogger(MmdfArchiveReader.class);

    /**
     * Decompresses an archive and returns the payload of every frame.
     *
     * @param archive path of the archive.
     * @return the payloads in the order they were written.
     * @throws IOException if the archive cannot be read or is malformed.
     */
    public List<byte[]> readFrames(Path archive) throws IOException {
        try (InputStream input = new GZIPInputStream(Files.newInputStream(archive))) {
            return MmdfFraming.splitFrames(input.readAllBytes());
        }
    }

    /**
     * Extracts the descriptor id header value from each message found in the
     * archives of {@code directory}. This method can be used to check that an
     * export wrote the expected messages, by comparing the returned ids with
     * the ones found in the mailbox.
     *
     * @param directory directory containing the archives.
     * @param extension archive file extension, without the leading dot.
     * @return a set with all the ids found.
     * @throws IOException
     * @throws MessagingException
     */
    public Set<Long> extractDescriptorIds(Path directory, String extension) throws IOException, MessagingException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException(String.format("Inexistent directory: %s", directory.toAbsolutePath()));
        }
        Set<Long> result = new TreeSet<>();
        try (DirectoryStream<Path> archives = Files.newDirectoryStream(directory, "*." + extension)) {
            for (Path archive : archives) {
                for (byte[] frame : readFrames(archive)) {
                    MimeMessage msg = new MimeMessage(null, new ByteArrayInputStream(frame));
                    String[] headerValues = msg.getHeader(MessageConverter.DESCRIPTOR_ID_HEADER);
                    if (headerValues != null && headerValues.length > 0) {
                        result.add(Long.parseLong(headerValues[0].trim()));
                    } else {
                        logger.warn("Message without {} header in {}.", MessageConverter.DESCRIPTOR_ID_HEADER, archive);
                    }
                }
            }
        }
        return result;
    }
}
