/*
 * SortableValueCodecTest.java
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

import org.flatjson.FlatJsonArgumentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SortableValueCodec}.
 */
class SortableValueCodecTest {
    private static final double[] EDGE_DOUBLES = {
            Double.NEGATIVE_INFINITY, -Double.MAX_VALUE, -1e300, -12345.678, -1.0, -Double.MIN_NORMAL,
            -Double.MIN_VALUE, 0.0, Double.MIN_VALUE, Double.MIN_NORMAL, 0.5, 1.0, 28.0, 12345.678, 1e300,
            Double.MAX_VALUE, Double.POSITIVE_INFINITY
    };

    static Stream<Long> seeds() {
        return LongStream.of(0L, 1L, 42L, 0x5eedL, 20261018L).boxed();
    }

    @Test
    void knownDoubleEncodings() {
        assertArrayEquals(bytes(0xbf, 0xf0, 0, 0, 0, 0, 0, 0), SortableValueCodec.encodeDouble(1.0));
        assertArrayEquals(bytes(0x40, 0x0f, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff), SortableValueCodec.encodeDouble(-1.0));
        assertArrayEquals(bytes(0x80, 0, 0, 0, 0, 0, 0, 0), SortableValueCodec.encodeDouble(0.0));
    }

    @Test
    void signedZerosShareEncoding() {
        assertArrayEquals(SortableValueCodec.encodeDouble(0.0), SortableValueCodec.encodeDouble(-0.0));
    }

    @Test
    void edgeDoublesSortInOrder() {
        for (int i = 1; i < EDGE_DOUBLES.length; i++) {
            byte[] lower = SortableValueCodec.encodeDouble(EDGE_DOUBLES[i - 1]);
            byte[] upper = SortableValueCodec.encodeDouble(EDGE_DOUBLES[i]);
            assertThat(EDGE_DOUBLES[i - 1] + " vs " + EDGE_DOUBLES[i], Arrays.compareUnsigned(lower, upper), lessThan(0));
        }
    }

    @ParameterizedTest(name = "doubleOrderMatchesByteOrder [seed = {0}]")
    @MethodSource("seeds")
    void doubleOrderMatchesByteOrder(long seed) {
        final Random random = new Random(seed);
        for (int i = 0; i < 2000; i++) {
            double a = randomDouble(random);
            double b = randomDouble(random);
            int byteOrder = Integer.signum(Arrays.compareUnsigned(SortableValueCodec.encodeDouble(a), SortableValueCodec.encodeDouble(b)));
            int numericOrder = a == b ? 0 : (a < b ? -1 : 1);
            assertEquals(numericOrder, byteOrder, () -> a + " vs " + b);
        }
    }

    @ParameterizedTest(name = "timestampOrderMatchesByteOrder [seed = {0}]")
    @MethodSource("seeds")
    void timestampOrderMatchesByteOrder(long seed) {
        final Random random = new Random(seed);
        for (int i = 0; i < 2000; i++) {
            long a = random.nextBoolean() ? random.nextLong() : random.nextInt();
            long b = random.nextBoolean() ? random.nextLong() : random.nextInt();
            int byteOrder = Integer.signum(Arrays.compareUnsigned(SortableValueCodec.encodeTimestampMicros(a), SortableValueCodec.encodeTimestampMicros(b)));
            assertEquals(Long.signum(Long.compare(a, b)), byteOrder, () -> a + " vs " + b);
        }
    }

    @Test
    void preEpochSortsBeforeEpoch() {
        assertArrayEquals(bytes(0x80, 0, 0, 0, 0, 0, 0, 0), SortableValueCodec.encodeTimestampMicros(0L));
        assertArrayEquals(bytes(0x7f, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff), SortableValueCodec.encodeTimestampMicros(-1L));
        assertArrayEquals(bytes(0, 0, 0, 0, 0, 0, 0, 0), SortableValueCodec.encodeTimestampMicros(Long.MIN_VALUE));
        assertArrayEquals(bytes(0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff), SortableValueCodec.encodeTimestampMicros(Long.MAX_VALUE));
    }

    @Test
    void instantsUseMicroseconds() {
        assertEquals(1_579_078_800_000_000L, SortableValueCodec.toEpochMicros(Instant.parse("2020-01-15T09:00:00Z")));
        assertEquals(-1L, SortableValueCodec.toEpochMicros(Instant.parse("1969-12-31T23:59:59.999999Z")));
        // sub-microsecond precision is truncated toward the past
        assertEquals(-1L, SortableValueCodec.toEpochMicros(Instant.parse("1969-12-31T23:59:59.999999999Z")));
        assertArrayEquals(SortableValueCodec.encodeTimestampMicros(1_579_078_800_000_000L),
                SortableValueCodec.encodeInstant(Instant.parse("2020-01-15T09:00:00Z")));
    }

    @Test
    void decodeAtOffset() {
        final byte[] term = new byte[3 + SortableValueCodec.ENCODED_LENGTH];
        term[0] = 'a';
        term[1] = '_';
        term[2] = '_';
        System.arraycopy(SortableValueCodec.encodeDouble(-273.15), 0, term, 3, SortableValueCodec.ENCODED_LENGTH);
        assertEquals(-273.15, SortableValueCodec.decodeDouble(term, 3));

        System.arraycopy(SortableValueCodec.encodeTimestampMicros(-86_400_000_000L), 0, term, 3, SortableValueCodec.ENCODED_LENGTH);
        assertEquals(-86_400_000_000L, SortableValueCodec.decodeTimestampMicros(term, 3));
    }

    @Test
    void decodeRejectsShortInput() {
        assertThrows(FlatJsonArgumentException.class, () -> SortableValueCodec.decodeDouble(new byte[7], 0));
        assertThrows(FlatJsonArgumentException.class, () -> SortableValueCodec.decodeTimestampMicros(new byte[10], 3));
    }

    @Test
    void negativeZeroDecodesAsZero() {
        double decoded = SortableValueCodec.decodeDouble(SortableValueCodec.encodeDouble(-0.0), 0);
        assertEquals(0.0, decoded);
        assertThat(Double.doubleToRawLongBits(decoded), equalTo(0L));
        assertThat(SortableValueCodec.decodeDouble(SortableValueCodec.encodeDouble(Double.POSITIVE_INFINITY), 0), greaterThan(Double.MAX_VALUE));
    }

    private static double randomDouble(Random random) {
        switch (random.nextInt(4)) {
            case 0:
                return EDGE_DOUBLES[random.nextInt(EDGE_DOUBLES.length)];
            case 1:
                double value;
                do {
                    value = Double.longBitsToDouble(random.nextLong());
                } while (Double.isNaN(value));
                return value;
            case 2:
                return (random.nextDouble() - 0.5) * 2e6;
            default:
                return random.nextInt(201) - 100;
        }
    }

    private static byte[] bytes(int... values) {
        final byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }
}
