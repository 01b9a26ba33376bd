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
package pt.cjmach.mmdfexport.pst;

import com.pff.PSTException;
import java.io.File;
import java.io.FileNotFoundException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author cmachado
 */
public class PstMailboxSessionTest {

    @Test
    public void testOpenInputFileNotFound() {
        File inputFile = new File("/file/not/found.pst");
        FileNotFoundException ex = assertThrows(FileNotFoundException.class, () -> PstMailboxSession.open(inputFile));
        assertEquals(FileNotFoundException.class, ex.getClass());
    }

    @Test
    public void testOpenInputFileIllegal() {
        File inputFile = new File("."); // invalid file
        FileNotFoundException ex = assertThrows(FileNotFoundException.class, () -> PstMailboxSession.open(inputFile));
        assertEquals(FileNotFoundException.class, ex.getClass());
    }

    @Test
    public void testOpenNotPstFile() {
        File inputFile = new File("src/test/resources/pt/cjmach/mmdfexport/textfile.txt");
        assertTrue(inputFile.isFile());
        assertThrows(PSTException.class, () -> PstMailboxSession.open(inputFile));
    }
}
