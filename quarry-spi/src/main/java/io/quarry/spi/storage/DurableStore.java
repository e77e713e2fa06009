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
package io.quarry.spi.storage;

import io.airlift.slice.Slice;

import java.io.IOException;
import java.io.InputStream;

/**
 * Byte-addressable durable store backing spilled units and evicted cache entries.
 * <p>
 * Each unit is written as a whole: after {@link #write} returns, a {@link #read} of the
 * same unit id returns exactly the bytes written, and a failed write leaves no readable unit.
 * Implementations are not expected to retry; callers bound their own retries.
 */
public interface DurableStore
{
    void write(String unitId, Slice data)
            throws IOException;

    Slice read(String unitId)
            throws IOException;

    /**
     * Opens the unit for a sequential read without materializing it in memory.
     */
    InputStream openStream(String unitId)
            throws IOException;

    /**
     * Deletes the unit. Deleting a unit that does not exist is a no-op.
     */
    void delete(String unitId)
            throws IOException;
}
