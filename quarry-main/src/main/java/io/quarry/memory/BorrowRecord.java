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
package io.quarry.memory;

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Bytes one pool is holding in the other pool's region.
 */
@NotThreadSafe
final class BorrowRecord
{
    enum Direction
    {
        STORAGE_FROM_EXECUTION,
        EXECUTION_FROM_STORAGE,
    }

    private final Direction direction;
    private long bytes;

    BorrowRecord(Direction direction)
    {
        this.direction = requireNonNull(direction, "direction is null");
    }

    long getBytes()
    {
        return bytes;
    }

    void borrow(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        this.bytes += bytes;
    }

    void repay(long bytes)
    {
        checkArgument(bytes >= 0, "bytes is negative");
        checkState(this.bytes >= bytes, "%s: tried to repay %s bytes, but only %s are borrowed", direction, bytes, this.bytes);
        this.bytes -= bytes;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("direction", direction)
                .add("bytes", bytes)
                .toString();
    }
}
