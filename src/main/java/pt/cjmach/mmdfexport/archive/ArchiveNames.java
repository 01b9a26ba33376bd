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

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds archive file names of the form {@code <folder>_<yyyyMM>.<extension>}.
 */
public final class ArchiveNames {

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");
    private static final String ILLEGAL_CHARS = "\\/:*?\"<>|";

    private ArchiveNames() {
    }

    public static String fileName(String folderName, YearMonth month, String extension) {
        return normalize(folderName) + "_" + MONTH_FORMAT.format(month) + "." + extension;
    }

    /**
     * Replaces characters that are not allowed in file names on common file
     * systems, and control characters, by an underscore.
     *
     * @param name
     * @return the normalized name, or {@code "_"} if {@code name} is blank.
     */
    public static String normalize(String name) {
        if (StringUtils.isBlank(name)) {
            return "_";
        }
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 0x20 || ILLEGAL_CHARS.indexOf(c) >= 0) {
                builder.append('_');
            } else {
                builder.append(c);
            }
        }
        return builder.toString().trim();
    }
}
