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
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import pt.cjmach.mmdfexport.archive.MonthlyArchiveWriter;

/**
 * Settings of one export run.
 * <p>
 * Options can be loaded from a {@link Properties} object (by default the
 * system properties), using the {@code mmdfexport.} prefixed keys declared
 * in this class.
 *
 * @author cmachado
 */
public class ExportOptions {

    public static final String PREFIX = "mmdfexport."; // NOI18N
    public static final String FOLDER = PREFIX + "folder"; // NOI18N
    public static final String DIRECTORY = PREFIX + "dir"; // NOI18N
    public static final String COUNT = PREFIX + "count"; // NOI18N
    public static final String START_DATE = PREFIX + "startdate"; // NOI18N
    public static final String END_DATE = PREFIX + "enddate"; // NOI18N
    public static final String ADDRESS_BOOK = PREFIX + "ab"; // NOI18N
    public static final String LIST = PREFIX + "list"; // NOI18N
    public static final String SKIP_EMPTY = PREFIX + "skipEmpty"; // NOI18N
    public static final String EXTENSION = PREFIX + "extension"; // NOI18N
    public static final String ZONE = PREFIX + "zone"; // NOI18N
    public static final String FETCH_RETRIES = PREFIX + "fetchRetries"; // NOI18N
    public static final String CHARSET = PREFIX + "charset"; // NOI18N
    public static final String BODY_ENCODING = PREFIX + "bodyEncoding"; // NOI18N

    public static final int DEFAULT_COUNT = 1000;
    public static final int DEFAULT_FETCH_RETRIES = 3;
    public static final String DEFAULT_BODY_ENCODING = "quoted-printable"; // NOI18N

    /**
     * Content transfer encodings accepted for text bodies.
     */
    public static final List<String> BODY_ENCODINGS = Collections.unmodifiableList(
            Arrays.asList("7bit", "8bit", "binary", "quoted-printable", "base64")); // NOI18N

    /**
     * Format of the start and end dates, e.g. {@code 20060102}.
     */
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private String folderName = "";
    private File targetDirectory = new File(".");
    private int maxCount = DEFAULT_COUNT;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean useAddressBook;
    private boolean listFolders;
    private boolean skipEmptyFolders;
    private String extension = MonthlyArchiveWriter.DEFAULT_EXTENSION;
    private ZoneId zone = ZoneId.systemDefault();
    private int fetchRetries = DEFAULT_FETCH_RETRIES;
    private Charset charset = StandardCharsets.UTF_8;
    private String bodyEncoding = DEFAULT_BODY_ENCODING;

    public ExportOptions() {
    }

    /**
     * Loads options from the system properties.
     *
     * @return the loaded options.
     * @throws IllegalArgumentException if a property has an invalid value.
     */
    public static ExportOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Loads options from {@code props}. Missing keys keep their default
     * value.
     *
     * @param props
     * @return the loaded options.
     * @throws IllegalArgumentException if a property has an invalid value.
     */
    public static ExportOptions fromProperties(Properties props) {
        ExportOptions options = new ExportOptions();
        options.setFolderName(props.getProperty(FOLDER, ""));
        options.setTargetDirectory(new File(props.getProperty(DIRECTORY, ".")));
        options.setMaxCount(parseInt(props, COUNT, DEFAULT_COUNT));
        options.setStartDate(parseDate(props.getProperty(START_DATE)));
        options.setEndDate(parseDate(props.getProperty(END_DATE)));
        options.setUseAddressBook(Boolean.parseBoolean(props.getProperty(ADDRESS_BOOK, "false")));
        options.setListFolders(Boolean.parseBoolean(props.getProperty(LIST, "false")));
        options.setSkipEmptyFolders(Boolean.parseBoolean(props.getProperty(SKIP_EMPTY, "false")));
        options.setExtension(props.getProperty(EXTENSION, MonthlyArchiveWriter.DEFAULT_EXTENSION));
        String zoneId = props.getProperty(ZONE);
        if (StringUtils.isNotBlank(zoneId)) {
            try {
                options.setZone(ZoneId.of(zoneId.trim()));
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException(String.format("Invalid %s: %s", ZONE, zoneId), ex);
            }
        }
        options.setFetchRetries(parseInt(props, FETCH_RETRIES, DEFAULT_FETCH_RETRIES));
        String charsetName = props.getProperty(CHARSET);
        if (StringUtils.isNotBlank(charsetName)) {
            try {
                options.setCharset(Charset.forName(charsetName.trim()));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                throw new IllegalArgumentException(String.format("Invalid %s: %s", CHARSET, charsetName), ex);
            }
        }
        options.setBodyEncoding(props.getProperty(BODY_ENCODING, DEFAULT_BODY_ENCODING));
        return options;
    }

    /**
     * Parses a date in the {@link #DATE_FORMAT} format.
     *
     * @param value the text to parse, may be blank.
     * @return the date, or {@code null} if {@code value} is blank.
     * @throws IllegalArgumentException if {@code value} is not a valid date.
     */
    public static LocalDate parseDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DATE_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(String.format("Invalid date (expected yyyyMMdd): %s", value), ex);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(String.format("Invalid %s: %s", key, value), ex);
        }
    }

    /**
     * @return the first instant of the start date, or {@code null} if no start
     * date is set.
     */
    public Date getStartBound() {
        return startOfDay(startDate);
    }

    /**
     * @return the first instant of the end date, or {@code null} if no end
     * date is set.
     */
    public Date getEndBound() {
        return startOfDay(endDate);
    }

    private Date startOfDay(LocalDate date) {
        if (date == null) {
            return null;
        }
        return Date.from(date.atStartOfDay(zone).toInstant());
    }

    public String getFolderName() {
        return folderName;
    }

    public void setFolderName(String folderName) {
        this.folderName = StringUtils.defaultString(folderName);
    }

    public File getTargetDirectory() {
        return targetDirectory;
    }

    public void setTargetDirectory(File targetDirectory) {
        if (targetDirectory == null) {
            throw new IllegalArgumentException("targetDirectory is null.");
        }
        this.targetDirectory = targetDirectory;
    }

    public int getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(int maxCount) {
        if (maxCount < 0) {
            throw new IllegalArgumentException("count is negative: " + maxCount);
        }
        this.maxCount = maxCount;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public boolean isUseAddressBook() {
        return useAddressBook;
    }

    public void setUseAddressBook(boolean useAddressBook) {
        this.useAddressBook = useAddressBook;
    }

    public boolean isListFolders() {
        return listFolders;
    }

    public void setListFolders(boolean listFolders) {
        this.listFolders = listFolders;
    }

    /**
     * @return {@code true} if folders without items are left out of the
     * folder tree printed when listing.
     */
    public boolean isSkipEmptyFolders() {
        return skipEmptyFolders;
    }

    public void setSkipEmptyFolders(boolean skipEmptyFolders) {
        this.skipEmptyFolders = skipEmptyFolders;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        if (StringUtils.isBlank(extension)) {
            throw new IllegalArgumentException("extension is empty.");
        }
        this.extension = StringUtils.removeStart(extension.trim(), ".");
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("zone is null.");
        }
        this.zone = zone;
    }

    /**
     * @return how many times fetching the same item is retried before the
     * export stops.
     */
    public int getFetchRetries() {
        return fetchRetries;
    }

    public void setFetchRetries(int fetchRetries) {
        if (fetchRetries < 0) {
            throw new IllegalArgumentException("fetchRetries is negative: " + fetchRetries);
        }
        this.fetchRetries = fetchRetries;
    }

    /**
     * @return the charset used to decode the transport headers stored in the
     * mailbox.
     */
    public Charset getCharset() {
        return charset;
    }

    public void setCharset(Charset charset) {
        if (charset == null) {
            throw new IllegalArgumentException("charset is null.");
        }
        this.charset = charset;
    }

    /**
     * @return the content transfer encoding of text bodies.
     */
    public String getBodyEncoding() {
        return bodyEncoding;
    }

    public void setBodyEncoding(String bodyEncoding) {
        String encoding = StringUtils.lowerCase(StringUtils.trimToEmpty(bodyEncoding));
        if (!BODY_ENCODINGS.contains(encoding)) {
            throw new IllegalArgumentException(String.format("Invalid %s: %s (expected one of %s)",
                    BODY_ENCODING, bodyEncoding, BODY_ENCODINGS));
        }
        this.bodyEncoding = encoding;
    }
}
