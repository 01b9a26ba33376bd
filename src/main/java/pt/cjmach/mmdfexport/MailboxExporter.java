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

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.YearMonth;
import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.archive.ArchiveListener;
import pt.cjmach.mmdfexport.archive.MonthlyArchiveWriter;
import pt.cjmach.mmdfexport.convert.MessageConverter;
import pt.cjmach.mmdfexport.mailbox.ItemCollection;
import pt.cjmach.mmdfexport.mailbox.MailFolder;
import pt.cjmach.mmdfexport.mailbox.MailItem;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.SortField;

/**
 * Exports the messages of one mailbox folder to monthly MMDF archives.
 * <p>
 * Items are visited in ascending creation time order. An item that cannot be
 * converted is skipped; an item whose native object cannot be read stops the
 * export, keeping everything written so far.
 *
 * @author cmachado
 */
public class MailboxExporter {

    private static final Logger logger = LoggerFactory.getLogger(MailboxExporter.class);

    private final DateRangeResolver resolver;

    public MailboxExporter() {
        this(new DateRangeResolver());
    }

    public MailboxExporter(DateRangeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Exports the messages of {@code folder}.
     *
     * @param folder the folder to export.
     * @param converter converter of the mailbox session.
     * @param options export settings.
     * @return the export summary.
     * @throws MailboxException if the item collection of the folder cannot be
     * opened, sorted or counted.
     * @throws IOException if the target directory or an archive cannot be
     * created or written.
     */
    public ExportResult export(MailFolder folder, MessageConverter converter, ExportOptions options) throws MailboxException, IOException {
        if (folder == null) {
            throw new IllegalArgumentException("folder is null.");
        }
        File outputDirectory = options.getTargetDirectory();
        if (outputDirectory.exists() && !outputDirectory.isDirectory()) {
            throw new IllegalArgumentException(String.format("Not a directory: %s.", outputDirectory.getAbsolutePath()));
        }
        if (!outputDirectory.exists() && !outputDirectory.mkdirs()) {
            throw new IOException("Failed to create output directory " + outputDirectory.getAbsolutePath());
        }
        converter.setResolveAddresses(options.isUseAddressBook());

        StopWatch watch = StopWatch.createStarted();
        try (ItemCollection items = folder.getHandle().getItems()) {
            items.sort(SortField.CREATION_TIME, false);
            int total = items.count();

            ExportWindow window = ExportWindow.resolve(items, total, options.getStartBound(), options.getEndBound(),
                    options.getMaxCount(), resolver);
            if (options.getStartDate() != null) {
                logger.info("Starting from {} for {}", window.getStart(), options.getStartDate().format(ExportOptions.DATE_FORMAT));
            }
            if (options.getEndDate() != null) {
                logger.info("Stopping by {} for {}", window.getEnd(), options.getEndDate().format(ExportOptions.DATE_FORMAT));
            }
            logger.info("Folder {}: total {} items, from: {}, to: {}, count: {}",
                    folder.getName(), total, window.getStart(), window.getEnd(), window.size());

            ConversionBuffer buffer = new ConversionBuffer();
            MessageExtractor extractor = new MessageExtractor(converter, buffer);
            MonthlyArchiveWriter writer = new MonthlyArchiveWriter(outputDirectory.toPath(), folder.getName(),
                    options.getExtension(), options.getZone());
            writer.setListener(new ArchiveListener() {
                @Override
                public void archiveClosed(Path path, YearMonth month, int frameCount) {
                    buffer.trim();
                }
            });

            Progress progress = exportRange(items, total, window, extractor, writer, options.getFetchRetries());
            watch.stop();
            return new ExportResult(window, progress.saved, progress.skipped, progress.filtered,
                    progress.stopped, writer.getArchives(), watch.getTime());
        }
    }

    /**
     * Runs the export loop over {@code window}. The writer is always finished
     * before this method returns or throws.
     *
     * @param items sorted item collection.
     * @param total number of items in the collection.
     * @param window range of indexes to export.
     * @param extractor
     * @param writer
     * @param fetchRetries how many times a failing fetch is retried before
     * the export stops.
     * @return counters of the run.
     * @throws IOException if an archive cannot be written.
     */
    Progress exportRange(ItemCollection items, int total, ExportWindow window, MessageExtractor extractor,
            MonthlyArchiveWriter writer, int fetchRetries) throws IOException {
        Progress progress = new Progress();
        Exception failure = null;
        try {
            exportItems(items, total, window, extractor, writer, fetchRetries, progress);
        } catch (IOException | RuntimeException ex) {
            failure = ex;
            logger.error("Export aborted after {} emails.", progress.saved, ex);
            throw ex;
        } finally {
            try {
                writer.finish();
            } catch (IOException closeEx) {
                if (failure == null) {
                    throw closeEx;
                }
                failure.addSuppressed(closeEx);
            } finally {
                logger.info("{} emails saved", progress.saved);
            }
        }
        return progress;
    }

    private void exportItems(ItemCollection items, int total, ExportWindow window, MessageExtractor extractor,
            MonthlyArchiveWriter writer, int fetchRetries, Progress progress) throws IOException {
        int failedFetches = 0;
        int i = window.getStart();
        while (i < window.getEnd() && i < total) {
            int position = i + 1;
            if (Thread.currentThread().isInterrupted()) {
                logger.info("Interrupted at {}", position);
                progress.stopped = true;
                return;
            }

            MailItem item;
            try {
                item = items.fetch(position);
            } catch (MailboxException | RuntimeException ex) {
                failedFetches++;
                logger.warn("Failed to get Item {}: {}", position, ex.toString());
                if (failedFetches > fetchRetries) {
                    logger.error("Giving up on item {} after {} attempts.", position, failedFetches);
                    logger.info("Stopped at {}", position);
                    progress.stopped = true;
                    return;
                }
                continue;
            }
            failedFetches = 0;

            ExtractionResult result;
            try (MailItem current = item) {
                result = extractor.extract(current);
                if (result.getCause() != null) {
                    logFailure(current, i, result.getCause());
                }
            }

            switch (result.getKind()) {
                case STOP:
                    logger.info("Stopped at {}", position);
                    progress.stopped = true;
                    return;
                case SKIPPED:
                    progress.skipped++;
                    break;
                case EMPTY:
                    progress.filtered++;
                    break;
                case PAYLOAD:
                    writer.submit(result.getPayload(), result.getTimestamp());
                    progress.saved++;
                    break;
                default:
                    throw new IllegalStateException("Unexpected extraction result: " + result.getKind());
            }
            i++;
        }
    }

    private void logFailure(MailItem item, int index, Exception cause) {
        String subject = null;
        String messageClass = null;
        try {
            subject = item.getSubject();
        } catch (MailboxException | RuntimeException ex) {
            logger.debug("Failed to get subject of item {}.", index, ex);
        }
        try {
            messageClass = item.getMessageClass();
        } catch (MailboxException | RuntimeException ex) {
            logger.debug("Failed to get message class of item {}.", index, ex);
        }
        logger.error("Failed to extract data for {} {} ({}).", index, subject, messageClass, cause);
    }

    static final class Progress {

        int saved;
        int skipped;
        int filtered;
        boolean stopped;
    }
}
