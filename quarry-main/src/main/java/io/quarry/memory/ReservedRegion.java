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

import io.airlift.units.DataSize;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.units.DataSize.succinctBytes;

/**
 * Memory kept back for the runtime itself. It is subtracted from total worker memory
 * before the execution and storage pools are sized, and is never handed out.
 */
public final class ReservedRegion
{
    private final long sizeBytes;

    public ReservedRegion(long sizeBytes)
    {
        checkArgument(sizeBytes >= 0, "sizeBytes is negative");
        this.sizeBytes = sizeBytes;
    }

    public long getSizeBytes()
    {
        return sizeBytes;
    }

    public long getUsableBytes(long totalWorkerBytes)
    {
        checkArgument(
                totalWorkerBytes > sizeBytes,
                "total worker memory %s must be larger than the reserved region %s",
                succinctBytes(totalWorkerBytes),
                succinctBytes(sizeBytes));
        return totalWorkerBytes - sizeBytes;
    }

    public static ReservedRegion of(DataSize size)
    {
        return new ReservedRegion(size.toBytes());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("sizeBytes", sizeBytes)
                .toString();
    }
}
