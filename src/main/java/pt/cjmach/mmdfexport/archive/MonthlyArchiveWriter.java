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

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes framed messages of one folder into gzip compressed MMDF archives,
 * one archive per calendar month. At most one archive is open at any time:
 * when a message of a different month is submitted, the open archive is
 * closed before the next one is created.
 * <p>
 * Messages are expected in creation time order. If they are not, a month
 * seen earlier gets its archive recreated and the previous content of that
 * archive is lost.
 *
 * @author cmachado
 */
public class MonthlyArchiveWriter implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(MonthlyArchiveWriter.class);

    /**
     * Default archive file extension.
     */
    public static final String DEFAULT_EXTENSION = "mmdf.gz"; // NOI18N

    /**
     * Month used for messages without a creation time when no archive is open.
     */
    public static final YearMonth UNKNOWN_MONTH = YearMonth.of(1, 1);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path directory;
    private final String folderName;
    private final String extension;
    private final ZoneId zone;
    private final List<Path> archives = new ArrayList<>();
    private ArchiveListener listener = new ArchiveListener() { };

    private OutputStream output;
    private Path currentPath;
    private YearMonth currentMonth;
    private int currentFrames;

    /**
     * @param directory existing directory where archives are created.
     * @param folderName name of the exported folder, used as file name
     * prefix.
     * @param extension archive file extension, without the leading dot.
     * @param zone time zone used to find the month of a timestamp.
     */
    public MonthlyArchiveWriter(Path directory, String folderName, String extension, ZoneId zone) {
        if (directory == null) {
            throw new IllegalArgumentException("directory is null.");
        }
        if (extension == null || extension.isEmpty()) {
            throw new IllegalArgumentException("extension is empty.");
        }
        this.directory = directory;
        this.folderName = folderName;
        this.extension = extension;
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
    }

    public void setListener(ArchiveListener listener) {
        this.listener = listener == null ? new ArchiveListener() { } : listener;
    }

    /**
     * Writes one framed message to the archive of the month of
     * {@code timestamp}, rotating archives if needed. A message without
     * timestamp goes to the open archive, or to the archive of
     * {@link #UNKNOWN_MONTH} if none is open.
     *
     * @param payload the message bytes.
     * @param timestamp creation time of the message, may be {@code null}.
     * @throws IOException if the archive cannot be created or written.
     */
    public void submit(byte[] payload, Date timestamp) throws IOException {
        YearMonth month = monthOf(timestamp);
        if (output != null && month != null && !month.equals(currentMonth)) {
            finish();
        }
        if (output == null) {
            open(month == null ? UNKNOWN_MONTH : month);
        }
        MmdfFraming.writeFrame(output, payload);
        currentFrames++;
    }

    /**
     * Flushes and closes the open archive. Does nothing if no archive is open.
     *
     * @throws IOException
     */
    public void finish() throws IOException {
        if (output == null) {
            return;
        }
        Path path = currentPath;
        YearMonth month = currentMonth;
        int frames = currentFrames;
        try {
            output.close();
        } finally {
            output = null;
            currentPath = null;
            currentMonth = null;
            currentFrames = 0;
        }
        logger.info("Closed file {} ({} messages)", path, frames);
        listener.archiveClosed(path, month, frames);
    }

    @Override
    public void close() throws IOException {
        finish();
    }

    /**
     * @return the month of the open archive, or {@code null} if none is open.
     */
    public YearMonth getCurrentMonth() {
        return currentMonth;
    }

    /**
     * @return the paths of every archive opened by this writer, in the order
     * they were opened.
     */
    public List<Path> getArchives() {
        return Collections.unmodifiableList(archives);
    }

    Path resolve(YearMonth month) {
        return directory.resolve(ArchiveNames.fileName(folderName, month, extension));
    }

    private YearMonth monthOf(Date timestamp) {
        if (timestamp == null) {
            return null;
        }
        return YearMonth.from(timestamp.toInstant().atZone(zone));
    }

    private void open(YearMonth month) throws IOException {
        Path path = resolve(month);
        OutputStream fileOutput;
        try {
            fileOutput = Files.newOutputStream(path, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            logger.error("Failed to open file {}.", path, ex);
            throw ex;
        }
        try {
            output = new GZIPOutputStream(new BufferedOutputStream(fileOutput, BUFFER_SIZE), BUFFER_SIZE);
        } catch (IOException ex) {
            fileOutput.close();
            throw ex;
        }
        currentPath = path;
        currentMonth = month;
        currentFrames = 0;
        archives.add(path);
        logger.info("Opening file {}", path);
        listener.archiveOpened(path, month);
    }
}
