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
package io.quarry.testing;

import io.airlift.units.Duration;
import io.quarry.spiller.DurableStoreClient;
import io.quarry.util.RetryDriver;

import static io.quarry.util.RetryDriver.retry;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

public final class TestingDurableStoreClient
{
    public static final RetryDriver NO_BACKOFF_RETRY = retry()
            .maxAttempts(3)
            .exponentialBackoff(new Duration(0, MILLISECONDS), new Duration(0, MILLISECONDS));

    private TestingDurableStoreClient() {}

    public static DurableStoreClient createClient(TestingDurableStore store)
    {
        return new DurableStoreClient(store, NO_BACKOFF_RETRY);
    }
}
