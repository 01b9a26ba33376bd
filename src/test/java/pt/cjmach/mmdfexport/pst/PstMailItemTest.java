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

import com.pff.PSTMessage;
import java.io.File;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pt.cjmach.mmdfexport.ConversionBuffer;
import pt.cjmach.mmdfexport.ExtractionResult;
import pt.cjmach.mmdfexport.MessageExtractor;
import pt.cjmach.mmdfexport.mailbox.MailboxException;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author cmachado
 */
public class PstMailItemTest {

    private static final long DESCRIPTOR_ID = 2097188L;

    private int loads;
    private PstMailboxSession session;

    @BeforeEach
    public void setUp() {
        loads = 0;
        // no PST file behind the session: every message load fails.
        session = new PstMailboxSession(null, new File("broken.pst")) {
            @Override
            PSTMessage loadMessage(long descriptorNodeId) throws MailboxException {
                loads++;
                throw new MailboxException("Failed to read item " + descriptorNodeId,
                        new NullPointerException());
            }
        };
    }

    @Test
    public void testCreationTimeReadsNoMessage() throws MailboxException {
        Date created = new Date(1672531200000L);
        PstMailItem instance = new PstMailItem(session, DESCRIPTOR_ID, created);
        assertEquals(created, instance.getCreationTime());
        assertEquals(0, loads);
    }

    @Test
    public void testLoadFailureIsReported() {
        PstMailItem instance = new PstMailItem(session, DESCRIPTOR_ID, new Date());
        MailboxException ex = assertThrows(MailboxException.class, instance::getMapiObject);
        assertEquals("Failed to read item " + DESCRIPTOR_ID, ex.getMessage());
        assertThrows(MailboxException.class, instance::getSubject);
    }

    @Test
    public void testLoadFailureStopsExtraction() {
        PstMailItem instance = new PstMailItem(session, DESCRIPTOR_ID, new Date());
        MessageExtractor extractor = new MessageExtractor(session.getConverter(), new ConversionBuffer());
        ExtractionResult result = extractor.extract(instance);
        assertEquals(ExtractionResult.Kind.STOP, result.getKind());
        assertTrue(result.getCause() instanceof MailboxException);
        assertTrue(loads > 0);
    }

    @Test
    public void testReleasedItem() {
        PstMailItem instance = new PstMailItem(session, DESCRIPTOR_ID, new Date());
        instance.close();
        MailboxException ex = assertThrows(MailboxException.class, instance::getCreationTime);
        assertEquals("Item already released.", ex.getMessage());
        assertThrows(MailboxException.class, instance::getMapiObject);
        assertEquals(0, loads);
    }
}
