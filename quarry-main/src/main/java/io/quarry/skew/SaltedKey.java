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
package io.quarry.skew;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class SaltedKey<K>
{
    private final K key;
    private final int salt;

    public SaltedKey(K key, int salt)
    {
        this.key = requireNonNull(key, "key is null");
        checkArgument(salt >= 0, "salt is negative");
        this.salt = salt;
    }

    public K getKey()
    {
        return key;
    }

    public int getSalt()
    {
        return salt;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        SaltedKey<?> other = (SaltedKey<?>) obj;
        return salt == other.salt &&
                Objects.equals(key, other.key);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(key, salt);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("key", key)
                .add("salt", salt)
                .toString();
    }
}
