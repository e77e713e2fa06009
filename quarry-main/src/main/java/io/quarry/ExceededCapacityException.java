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
package io.quarry;

import io.airlift.units.DataSize;
import io.quarry.spi.QuarryException;

import static io.airlift.units.DataSize.succinctBytes;
import static io.quarry.spi.StandardErrorCode.EXCEEDED_MEMORY_CAPACITY;
import static java.lang.String.format;

public class ExceededCapacityException
        extends QuarryException
{
    public static ExceededCapacityException exceededSaltFanOut(Object key, long keyBytes, DataSize threshold, int maxSaltFanOut)
    {
        return new ExceededCapacityException(format(
                "Key %s holds %s, which cannot be split under %s with at most %s salts",
                key,
                succinctBytes(keyBytes),
                threshold,
                maxSaltFanOut));
    }

    public static ExceededCapacityException exceededSkewAttempts(int attempts, DataSize threshold)
    {
        return new ExceededCapacityException(format("Salted partitions still exceed %s after %s attempts", threshold, attempts));
    }

    private ExceededCapacityException(String message)
    {
        super(EXCEEDED_MEMORY_CAPACITY, message);
    }
}
