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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.cjmach.mmdfexport.mailbox.ItemCollection;
import pt.cjmach.mmdfexport.mailbox.MailItem;
import pt.cjmach.mmdfexport.mailbox.MailboxException;

/**
 * Locates date boundaries in an item collection sorted in ascending creation
 * time order, using a binary search so that only a logarithmic number of
 * items has to be loaded.
 *
 * @author cmachado
 */
public class DateRangeResolver {

    private static final Logger logger = LoggerFactory.getLogger(DateRangeResolver.class);

    /**
     * Returns the index of the first item whose creation time is strictly
     * after {@code target}.
     * <p>
     * The collection must already be sorted by ascending creation time. An
     * item whose creation time cannot be read is considered to be before
     * {@code target}.
     *
     * @param items the sorted collection.
     * @param count number of items in the collection.
     * @param target the instant to search for.
     * @return a 0-based index in {@code [0, count]}; {@code count} if no item
     * is after {@code target}.
     */
    public int findFirstItemAfter(ItemCollection items, int count, Date target) {
        if (target == null) {
            throw new IllegalArgumentException("target is null.");
        }
        int low = 0;
        int high = count;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (isAfter(items, mid, target)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        if (low < count) {
            logger.debug("Found item: {}", low);
        }
        return low;
    }

    private boolean isAfter(ItemCollection items, int index, Date target) {
        try (MailItem item = items.fetch(index + 1)) {
            Date creationTime = item.getCreationTime();
            logger.trace("Item {} created at {}", index, creationTime);
            return creationTime != null && creationTime.after(target);
        } catch (MailboxException | RuntimeException ex) {
            logger.warn("Failed to read creation time of item {}.", index + 1, ex);
            return false;
        }
    }
}
