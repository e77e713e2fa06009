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
package io.quarry.spi;

import static io.quarry.spi.ErrorType.EXTERNAL;
import static io.quarry.spi.ErrorType.INSUFFICIENT_RESOURCES;
import static io.quarry.spi.ErrorType.INTERNAL_ERROR;

/**
 * Failures a worker reports to the coordinator as task failures.
 * Starvation (a short grant) and cache drops are not errors and have no code here.
 */
public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    GENERIC_INTERNAL_ERROR(0x0001_0000, INTERNAL_ERROR),
    CORRUPT_SPILL_DATA(0x0001_0001, INTERNAL_ERROR),
    UNIT_NOT_FOUND(0x0001_0002, INTERNAL_ERROR),

    EXCEEDED_MEMORY_CAPACITY(0x0002_0000, INSUFFICIENT_RESOURCES),
    EXECUTION_MEMORY_UNAVAILABLE(0x0002_0001, INSUFFICIENT_RESOURCES, true),
    OUT_OF_SPILL_SPACE(0x0002_0002, INSUFFICIENT_RESOURCES),

    STORAGE_BACKEND_UNAVAILABLE(0x0003_0000, EXTERNAL, true),
    /**/;

    private final ErrorCode errorCode;

    StandardErrorCode(int code, ErrorType type)
    {
        this(code, type, false);
    }

    StandardErrorCode(int code, ErrorType type, boolean retriable)
    {
        errorCode = new ErrorCode(code, name(), type, retriable);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
