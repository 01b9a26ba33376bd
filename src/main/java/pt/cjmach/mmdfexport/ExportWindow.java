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

import java.util.Date;
import pt.cjmach.mmdfexport.mailbox.ItemCollection;

/**
 * Half-open range {@code [start, end)} of 0-based item indexes selected for
 * export.
 */
public final class ExportWindow {

    private final int start;
    private final int end;

    public ExportWindow(int start, int end) {
        if (start < 0) {
            throw new IllegalArgumentException("start is negative.");
        }
        this.start = start;
        this.end = Math.max(start, end);
    }

    /**
     * Computes the export window of a sorted collection.
     *
     * @param items collection sorted by ascending creation time.
     * @param total number of items in the collection.
     * @param startBound items created up to this instant are left out; may be
     * {@code null}.
     * @param endBound items created after this instant are left out; may be
     * {@code null}.
     * @param maxCount maximum number of items in the window.
     * @param resolver resolver used to locate both bounds.
     * @return the window.
     */
    public static ExportWindow resolve(ItemCollection items, int total, Date startBound, Date endBound,
            int maxCount, DateRangeResolver resolver) {
        int start = 0;
        if (startBound != null) {
            start = resolver.findFirstItemAfter(items, total, startBound);
        }
        int end = (int) Math.min(Integer.MAX_VALUE, (long) start + maxCount);
        if (endBound != null) {
            end = Math.min(end, resolver.findFirstItemAfter(items, total, endBound));
        }
        return new ExportWindow(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int size() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
