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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Summary of an export run.
 */
public class ExportResult {

    private final ExportWindow window;
    private final int savedCount;
    private final int skippedCount;
    private final int filteredCount;
    private final boolean stoppedEarly;
    private final List<Path> archives;
    private final long duration;

    public ExportResult(ExportWindow window, int savedCount, int skippedCount, int filteredCount,
            boolean stoppedEarly, List<Path> archives, long duration) {
        this.window = window;
        this.savedCount = savedCount;
        this.skippedCount = skippedCount;
        this.filteredCount = filteredCount;
        this.stoppedEarly = stoppedEarly;
        this.archives = Collections.unmodifiableList(archives);
        this.duration = duration;
    }

    public ExportWindow getWindow() {
        return window;
    }

    /**
     * @return number of messages written to the archives.
     */
    public int getSavedCount() {
        return savedCount;
    }

    /**
     * @return number of items that could not be converted.
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    /**
     * @return number of items left out on purpose, e.g. meeting responses.
     */
    public int getFilteredCount() {
        return filteredCount;
    }

    /**
     * @return {@code true} if the export stopped before the end of the window
     * because the item store became unreadable or the thread was interrupted.
     */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    /**
     * @return the archives written, in the order they were created.
     */
    public List<Path> getArchives() {
        return archives;
    }

    /**
     * @return duration of the export in milliseconds.
     */
    public long getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return String.format("saved=%d, skipped=%d, filtered=%d, stoppedEarly=%s, archives=%d, duration=%dms",
                savedCount, skippedCount, filteredCount, stoppedEarly, archives.size(), duration);
    }
}
