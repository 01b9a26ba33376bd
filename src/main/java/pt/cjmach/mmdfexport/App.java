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

import com.pff.PSTException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.mailbox.FolderNotFoundException;
import pt.cjmach.mmdfexport.mailbox.FolderTree;
import pt.cjmach.mmdfexport.mailbox.FolderTreeBuilder;
import pt.cjmach.mmdfexport.mailbox.MailFolder;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import pt.cjmach.mmdfexport.mailbox.MailboxSession;
import pt.cjmach.mmdfexport.pst.PstMailboxSession;

/**
 * Command line entry point. The only argument is the OST/PST file; every
 * other setting is read from the {@code mmdfexport.*} system properties (see
 * {@link ExportOptions}).
 *
 * @author cmachado
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;

    public App(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new App(System.out).run(args));
    }

    int run(String[] args) {
        if (args.length != 1) {
            out.println("Usage: java -D" + ExportOptions.FOLDER + "=<folder> [-D...] -jar mmdfexport.jar <file.pst>");
            return EXIT_USAGE;
        }
        ExportOptions options;
        try {
            options = ExportOptions.fromSystemProperties();
        } catch (IllegalArgumentException ex) {
            logger.error("Invalid option: {}", ex.getMessage());
            return EXIT_USAGE;
        }
        try (PstMailboxSession session = PstMailboxSession.open(new File(args[0]))) {
            session.getConverter().setCharset(options.getCharset());
            session.getConverter().setBodyEncoding(options.getBodyEncoding());
            execute(session, options);
            return EXIT_OK;
        } catch (FolderNotFoundException ex) {
            logger.error(ex.getMessage());
            return EXIT_FAILURE;
        } catch (PSTException | MailboxException | IOException ex) {
            logger.error("Export failed.", ex);
            return EXIT_FAILURE;
        }
    }

    /**
     * Lists and/or exports the folders of an open session.
     *
     * @param session the logged on mailbox.
     * @param options export settings.
     * @return the export summary, or {@code null} if no folder was requested.
     * @throws FolderNotFoundException if the requested folder does not exist.
     * @throws MailboxException
     * @throws IOException
     */
    public ExportResult execute(MailboxSession session, ExportOptions options) throws MailboxException, IOException {
        logger.info(session.getDescription());

        FolderTree tree = new FolderTreeBuilder().build(session.getRootFolder());
        if (options.isListFolders()) {
            int i = 0;
            for (MailFolder folder : tree.getFolders()) {
                logger.info("{}: {} {} ({})", i++, folder.getName(), folder.getPath(), folder.getTotalItems());
            }
            new FolderTreePrinter(out).printTree(tree.getRoot(), options.isSkipEmptyFolders());
        }

        if (options.getFolderName().isEmpty()) {
            return null;
        }
        MailFolder folder = tree.findFolder(options.getFolderName());
        ExportResult result = new MailboxExporter().export(folder, session.getConverter(), options);
        logger.info("Export of {} finished: {}", folder.getPath(), result);
        return result;
    }
}
