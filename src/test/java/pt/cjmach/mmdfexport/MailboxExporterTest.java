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
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pt.cjmach.mmdfexport.archive.MmdfArchiveReader;
import pt.cjmach.mmdfexport.mailbox.FakeConverter;
import pt.cjmach.mmdfexport.mailbox.FakeFolderHandle;
import pt.cjmach.mmdfexport.mailbox.FakeMessage;
import pt.cjmach.mmdfexport.mailbox.FolderTreeBuilder;
import pt.cjmach.mmdfexport.mailbox.MailFolder;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author cmachado
 */
public class MailboxExporterTest {
    @TempDir
    Path outputDirectory;

    MailboxExporter instance;
    FakeConverter converter;
    ExportOptions options;

    @BeforeEach
    public void setUp() {
        instance = new MailboxExporter();
        converter = new FakeConverter();
        options = new ExportOptions();
        options.setTargetDirectory(outputDirectory.toFile());
        options.setZone(ZoneOffset.UTC);
    }

    @AfterEach
    public void tearDown() {
        instance = null;
        converter = null;
        options = null;
    }

    private static FakeMessage[] inboxMessages() {
        return new FakeMessage[]{
            FakeMessage.note("a", "2023-01-05T10:00:00Z"),
            FakeMessage.note("b", "2023-01-20T10:00:00Z"),
            FakeMessage.note("c", "2023-02-02T10:00:00Z")
        };
    }

    private static MailFolder inbox(FakeFolderHandle root, FakeMessage... messages) {
        root.add("Inbox", messages);
        return new FolderTreeBuilder().build(root).getFolders().get(1);
    }

    private List<String> subjects(String fileName) throws IOException {
        List<String> result = new ArrayList<>();
        for (byte[] frame : new MmdfArchiveReader().readFrames(outputDirectory.resolve(fileName))) {
            String text = new String(frame, StandardCharsets.UTF_8);
            result.add(text.substring("Subject: ".length(), text.indexOf("\r\n")));
        }
        return result;
    }

    @Test
    public void testExportAll() throws MailboxException, IOException {
        FakeFolderHandle root = FakeFolderHandle.root();
        MailFolder folder = inbox(root, inboxMessages());
        options.setUseAddressBook(true);

        ExportResult result = instance.export(folder, converter, options);

        assertEquals(3, result.getSavedCount());
        assertEquals(0, result.getSkippedCount());
        assertEquals(0, result.getFilteredCount());
        assertFalse(result.isStoppedEarly());
        assertEquals(2, result.getArchives().size());
        assertEquals(List.of("a", "b"), subjects("Inbox_202301.mmdf.gz"));
        assertEquals(List.of("c"), subjects("Inbox_202302.mmdf.gz"));
        assertTrue(converter.isResolveAddresses());

        FakeFolderHandle handle = (FakeFolderHandle) folder.getHandle();
        assertTrue(handle.getLastItems().isClosed());
        assertEquals(0, handle.getLastItems().getOpenHandles());
    }

    @Test
    public void testExportSortsByCreationTime() throws MailboxException, IOException {
        FakeMessage[] messages = inboxMessages();
        FakeMessage[] shuffled = {messages[2], messages[0], messages[1]};
        MailFolder folder = inbox(FakeFolderHandle.root(), shuffled);

        instance.export(folder, converter, options);
        assertEquals(List.of("a", "b"), subjects("Inbox_202301.mmdf.gz"));
        assertEquals(List.of("c"), subjects("Inbox_202302.mmdf.gz"));
    }

    @Test
    public void testExportFromStartDate() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        options.setStartDate(LocalDate.of(2023, 1, 15));

        ExportResult result = instance.export(folder, converter, options);

        assertEquals(1, result.getWindow().getStart());
        assertEquals(2, result.getSavedCount());
        assertEquals(List.of("b"), subjects("Inbox_202301.mmdf.gz"));
        assertEquals(List.of("c"), subjects("Inbox_202302.mmdf.gz"));
    }

    @Test
    public void testExportUntilEndDate() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        options.setEndDate(LocalDate.of(2023, 2, 1));

        ExportResult result = instance.export(folder, converter, options);

        assertEquals(2, result.getWindow().getEnd());
        assertEquals(2, result.getSavedCount());
        assertEquals(1, result.getArchives().size());
        assertFalse(new File(outputDirectory.toFile(), "Inbox_202302.mmdf.gz").exists());
    }

    @Test
    public void testExportCountBound() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        options.setMaxCount(2);

        ExportResult result = instance.export(folder, converter, options);
        assertEquals(2, result.getSavedCount());
        assertEquals(List.of("a", "b"), subjects("Inbox_202301.mmdf.gz"));

        options.setMaxCount(0);
        FileUtils.cleanDirectory(outputDirectory.toFile());
        result = instance.export(folder, converter, options);
        assertEquals(0, result.getSavedCount());
        assertTrue(result.getArchives().isEmpty());
    }

    @Test
    public void testHardStopKeepsWrittenArchives() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-20T10:00:00Z").unreadableObject(),
                FakeMessage.note("c", "2023-02-02T10:00:00Z"));

        ExportResult result = instance.export(folder, converter, options);

        assertTrue(result.isStoppedEarly());
        assertEquals(1, result.getSavedCount());
        assertEquals(List.of("a"), subjects("Inbox_202301.mmdf.gz"));
        assertFalse(new File(outputDirectory.toFile(), "Inbox_202302.mmdf.gz").exists());
    }

    @Test
    public void testSoftFailureSkipsItem() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-20T10:00:00Z").brokenConversion(),
                FakeMessage.note("c", "2023-02-02T10:00:00Z"));

        ExportResult result = instance.export(folder, converter, options);

        assertFalse(result.isStoppedEarly());
        assertEquals(2, result.getSavedCount());
        assertEquals(1, result.getSkippedCount());
        assertEquals(List.of("a"), subjects("Inbox_202301.mmdf.gz"));
        assertEquals(List.of("c"), subjects("Inbox_202302.mmdf.gz"));
    }

    @Test
    public void testMeetingResponseIsFiltered() throws MailboxException, IOException {
        FakeMessage response = new FakeMessage("Accepted", "IPM.Schedule.Meeting.Resp.Pos",
                java.util.Date.from(java.time.Instant.parse("2023-01-10T10:00:00Z")), "Subject: Accepted\r\n\r\n");
        FakeMessage[] messages = inboxMessages();
        MailFolder folder = inbox(FakeFolderHandle.root(), messages[0], response, messages[1], messages[2]);

        ExportResult result = instance.export(folder, converter, options);

        assertEquals(3, result.getSavedCount());
        assertEquals(1, result.getFilteredCount());
        assertEquals(List.of("a", "b"), subjects("Inbox_202301.mmdf.gz"));
    }

    @Test
    public void testFetchIsRetried() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-20T10:00:00Z").failingFetches(2),
                FakeMessage.note("c", "2023-02-02T10:00:00Z"));

        ExportResult result = instance.export(folder, converter, options);

        assertFalse(result.isStoppedEarly());
        assertEquals(3, result.getSavedCount());
    }

    @Test
    public void testFetchRetriesAreBounded() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-20T10:00:00Z").failingFetches(100),
                FakeMessage.note("c", "2023-02-02T10:00:00Z"));
        options.setFetchRetries(3);

        ExportResult result = instance.export(folder, converter, options);

        assertTrue(result.isStoppedEarly());
        assertEquals(1, result.getSavedCount());
        FakeFolderHandle handle = (FakeFolderHandle) folder.getHandle();
        assertEquals(5, handle.getLastItems().getFetchCount());
        assertEquals(List.of("a"), subjects("Inbox_202301.mmdf.gz"));
    }

    @Test
    public void testDamagedItemIsSkipped() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-10T10:00:00Z").damaged(),
                FakeMessage.note("c", "2023-01-20T10:00:00Z").crashingConversion());

        ExportResult result = instance.export(folder, converter, options);

        assertFalse(result.isStoppedEarly());
        assertEquals(1, result.getSavedCount());
        assertEquals(2, result.getSkippedCount());
        assertEquals(List.of("a"), subjects("Inbox_202301.mmdf.gz"));
    }

    @Test
    public void testUncheckedFetchFailureIsRetried() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-20T10:00:00Z").crashingFetches(1),
                FakeMessage.note("c", "2023-02-02T10:00:00Z").crashingFetches(100));

        ExportResult result = instance.export(folder, converter, options);

        assertTrue(result.isStoppedEarly());
        assertEquals(2, result.getSavedCount());
        assertEquals(List.of("a", "b"), subjects("Inbox_202301.mmdf.gz"));
    }

    @Test
    public void testUnexpectedFailureKeepsWrittenArchive() {
        MailFolder folder = inbox(FakeFolderHandle.root(),
                FakeMessage.note("a", "2023-01-05T10:00:00Z"),
                FakeMessage.note("b", "2023-01-10T10:00:00Z").crashingRelease(),
                FakeMessage.note("c", "2023-01-20T10:00:00Z"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> instance.export(folder, converter, options));
        assertEquals("release failed", ex.getMessage());

        // the archive was finished, so it is a complete gzip stream.
        assertDoesNotThrow(() -> assertEquals(List.of("a"), subjects("Inbox_202301.mmdf.gz")));
        FakeFolderHandle handle = (FakeFolderHandle) folder.getHandle();
        assertTrue(handle.getLastItems().isClosed());
    }

    @Test
    public void testInterruptStopsBeforeNextItem() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        Thread.currentThread().interrupt();
        try {
            ExportResult result = instance.export(folder, converter, options);
            assertTrue(result.isStoppedEarly());
            assertEquals(0, result.getSavedCount());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testExportCreatesOutputDirectory() throws MailboxException, IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        File nested = new File(outputDirectory.toFile(), "nested/out");
        options.setTargetDirectory(nested);

        instance.export(folder, converter, options);
        assertTrue(new File(nested, "Inbox_202301.mmdf.gz").isFile());
    }

    @Test
    public void testExportOutputDirectoryIllegal() throws IOException {
        MailFolder folder = inbox(FakeFolderHandle.root(), inboxMessages());
        File file = new File(outputDirectory.toFile(), "textfile.txt");
        FileUtils.writeStringToFile(file, "text", StandardCharsets.UTF_8);
        options.setTargetDirectory(file);

        IllegalArgumentException iae = assertThrows(IllegalArgumentException.class,
                () -> instance.export(folder, converter, options));
        assertTrue(iae.getMessage().startsWith("Not a directory"));
    }

    @Test
    public void testUnreadableItemCollection() {
        FakeFolderHandle root = FakeFolderHandle.root();
        MailFolder folder = inbox(root, inboxMessages());
        ((FakeFolderHandle) folder.getHandle()).failing("items");

        assertThrows(MailboxException.class, () -> instance.export(folder, converter, options));
    }
}
