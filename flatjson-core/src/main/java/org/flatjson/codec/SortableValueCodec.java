/*
 * SortableValueCodec.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
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

package org.flatjson.codec;

import com.google.common.primitives.Longs;
import org.flatjson.FlatJsonArgumentException;
import org.flatjson.annotation.API;
import org.flatjson.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.time.Instant;

/**
 * Fixed-width encodings of numbers and timestamps whose unsigned lexicographic byte order matches the numeric
 * order of the values they encode. Both encodings are always {@link #ENCODED_LENGTH} bytes, big-endian.
 *
 * <p>
 * Doubles keep their IEEE-754 bits with the sign bit set for non-negative values and all bits flipped for negative
 * ones, so {@code -0.0} and {@code 0.0} share an encoding. Timestamps are microseconds since the epoch with the sign
 * bit flipped, so pre-epoch values sort before post-epoch ones.
 * </p>
 */
@API(API.Status.STABLE)
public final class SortableValueCodec {
    public static final int ENCODED_LENGTH = Long.BYTES;

    private static final long SIGN_BIT = 1L << 63;
    private static final long MICROS_PER_SECOND = 1_000_000L;
    private static final long NANOS_PER_MICRO = 1_000L;

    private SortableValueCodec() {
    }

    @Nonnull
    public static byte[] encodeDouble(double value) {
        final long bits = Double.doubleToRawLongBits(value);
        return Longs.toByteArray(value >= 0.0 ? bits | SIGN_BIT : ~bits);
    }

    public static double decodeDouble(@Nonnull byte[] bytes, int offset) {
        final long sortable = readLong(bytes, offset);
        return Double.longBitsToDouble((sortable & SIGN_BIT) != 0 ? sortable ^ SIGN_BIT : ~sortable);
    }

    @Nonnull
    public static byte[] encodeTimestampMicros(long micros) {
        return Longs.toByteArray(micros ^ SIGN_BIT);
    }

    public static long decodeTimestampMicros(@Nonnull byte[] bytes, int offset) {
        return readLong(bytes, offset) ^ SIGN_BIT;
    }

    @Nonnull
    public static byte[] encodeInstant(@Nonnull Instant instant) {
        return encodeTimestampMicros(toEpochMicros(instant));
    }

    /**
     * Convert an instant to whole microseconds since the epoch, truncating sub-microsecond precision toward negative
     * infinity.
     *
     * @param instant the instant to convert
     * @return microseconds since 1970-01-01T00:00:00Z
     * @throws ArithmeticException if the instant does not fit in a signed 64 bit microsecond count
     */
    public static long toEpochMicros(@Nonnull Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), MICROS_PER_SECOND), instant.getNano() / NANOS_PER_MICRO);
    }

    private static long readLong(@Nonnull byte[] bytes, int offset) {
        if (offset < 0 || bytes.length - offset < ENCODED_LENGTH) {
            throw new FlatJsonArgumentException("encoded value is too short",
                    LogMessageKeys.LENGTH, bytes.length,
                    LogMessageKeys.OFFSET, offset);
        }
        return Longs.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3],
                bytes[offset + 4], bytes[offset + 5], bytes[offset + 6], bytes[offset + 7]);
    }
}
