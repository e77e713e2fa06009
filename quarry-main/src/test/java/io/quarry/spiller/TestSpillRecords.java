/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quarry.spiller;

import com.google.common.collect.ImmutableList;
import io.airlift.slice.Slice;
import io.quarry.spi.QuarryException;
import org.testng.annotations.Test;

import java.util.Iterator;

import static io.airlift.slice.Slices.utf8Slice;
import static io.quarry.spi.StandardErrorCode.CORRUPT_SPILL_DATA;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.fail;

public class TestSpillRecords
{
    @Test
    public void testEmptyUnit()
    {
        Slice data = SpillRecords.writeRecords(ImmutableList.of());
        assertEquals(data.length(), 0);
        assertFalse(SpillRecords.readRecords(data.getInput()).hasNext());
    }

    @Test
    public void testSerializedSize()
    {
        Slice record = utf8Slice("record");
        assertEquals(SpillRecords.serializedSize(record), SpillRecords.writeRecords(ImmutableList.of(record)).length());
    }

    @Test
    public void testTruncatedRecord()
    {
        Slice data = SpillRecords.writeRecords(ImmutableList.of(utf8Slice("first"), utf8Slice("second")));
        Iterator<Slice> records = SpillRecords.readRecords(data.slice(0, data.length() - 1).getInput());
        assertEquals(records.next(), utf8Slice("first"));
        try {
            records.next();
            fail("expected exception");
        }
        catch (QuarryException e) {
            assertEquals(e.getErrorCode(), CORRUPT_SPILL_DATA.toErrorCode());
        }
    }

    @Test
    public void testTruncatedLength()
    {
        Slice data = SpillRecords.writeRecords(ImmutableList.of(utf8Slice("first")));
        try {
            SpillRecords.readRecords(data.slice(0, 2).getInput()).next();
            fail("expected exception");
        }
        catch (QuarryException e) {
            assertEquals(e.getErrorCode(), CORRUPT_SPILL_DATA.toErrorCode());
        }
    }
}
