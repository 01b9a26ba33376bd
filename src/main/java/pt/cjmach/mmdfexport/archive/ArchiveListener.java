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

import java.nio.file.Path;
import java.time.YearMonth;

/**
 * Receives notifications when a {@link MonthlyArchiveWriter} opens or closes an
 * archive file.
 */
public interface ArchiveListener {

    default void archiveOpened(Path path, YearMonth month) {
    }

    default void archiveClosed(Path path, YearMonth month, int frameCount) {
    }
}
