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

import com.google.common.collect.AbstractIterator;
import io.airlift.slice.DynamicSliceOutput;
import io.airlift.slice.Slice;
import io.airlift.slice.SliceInput;
import io.airlift.slice.SliceOutput;
import io.quarry.spi.QuarryException;

import java.util.Iterator;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.slice.SizeOf.SIZE_OF_INT;
import static io.quarry.spi.StandardErrorCode.CORRUPT_SPILL_DATA;
import static java.util.Objects.requireNonNull;

/**
 * Length-prefixed record framing used inside spilled units.
 */
public final class SpillRecords
{
    private SpillRecords() {}

    public static Slice writeRecords(Iterable<Slice> records)
    {
        requireNonNull(records, "records is null");
        SliceOutput output = new DynamicSliceOutput(64);
        for (Slice record : records) {
            writeRecord(output, record);
        }
        return output.slice();
    }

    public static void writeRecord(SliceOutput output, Slice record)
    {
        checkArgument(record.length() >= 0, "record length is negative");
        output.writeInt(record.length());
        output.writeBytes(record);
    }

    public static long serializedSize(Slice record)
    {
        return SIZE_OF_INT + (long) record.length();
    }

    public static Iterator<Slice> readRecords(SliceInput input)
    {
        requireNonNull(input, "input is null");
        return new AbstractIterator<Slice>()
        {
            @Override
            protected Slice computeNext()
            {
                if (!input.isReadable()) {
                    return endOfData();
                }
                try {
                    int length = input.readInt();
                    if (length < 0) {
                        throw new QuarryException(CORRUPT_SPILL_DATA, "Negative record length in spilled unit: " + length);
                    }
                    return input.readSlice(length);
                }
                catch (IndexOutOfBoundsException e) {
                    throw new QuarryException(CORRUPT_SPILL_DATA, "Spilled unit ends in the middle of a record", e);
                }
            }
        };
    }
}
