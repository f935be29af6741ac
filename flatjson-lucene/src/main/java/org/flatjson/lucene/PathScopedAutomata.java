/*
 * PathScopedAutomata.java
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

package org.flatjson.lucene;

import com.google.common.primitives.Bytes;
import org.apache.lucene.search.TermRangeQuery;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.automaton.Automata;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.Operations;
import org.flatjson.annotation.API;
import org.flatjson.codec.SortableValueCodec;

import javax.annotation.Nonnull;

/**
 * Binary automata over the {@code number} and {@code date} fields, whose terms are a path prefix followed by exactly
 * {@link SortableValueCodec#ENCODED_LENGTH} value bytes.
 *
 * <p>
 * A plain byte range from {@code prefix + low} to {@code prefix + high} also covers terms of a longer path that
 * starts with the same prefix, such as {@code score__adjusted__...} for the path {@code score}. Requiring the exact
 * term length rules those out.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class PathScopedAutomata {
    private static final int MAX_BYTE = 0xff;

    private PathScopedAutomata() {
    }

    /**
     * Terms of one path whose encoded value lies in an inclusive range.
     *
     * @param prefix path prefix bytes, separator included
     * @param lower encoded lower bound
     * @param upper encoded upper bound
     * @return an automaton accepting {@code prefix + v} for every 8 byte {@code v} with {@code lower <= v <= upper}
     */
    @Nonnull
    public static Automaton encodedRange(@Nonnull byte[] prefix, @Nonnull byte[] lower, @Nonnull byte[] upper) {
        final Automaton range = TermRangeQuery.toAutomaton(
                new BytesRef(Bytes.concat(prefix, lower)), new BytesRef(Bytes.concat(prefix, upper)), true, true);
        return Operations.intersection(range, encodedTerm(prefix));
    }

    /**
     * Terms of any path that end with the separator followed by the given encoded value.
     *
     * @param separator separator bytes
     * @param encoded encoded value
     * @return an automaton accepting {@code anything + separator + encoded}
     */
    @Nonnull
    public static Automaton anyPathWithValue(@Nonnull byte[] separator, @Nonnull byte[] encoded) {
        return Operations.concatenate(Automata.makeAnyBinary(), Automata.makeBinary(new BytesRef(Bytes.concat(separator, encoded))));
    }

    @Nonnull
    private static Automaton encodedTerm(@Nonnull byte[] prefix) {
        final Automaton anyByte = Automata.makeCharRange(0, MAX_BYTE);
        return Operations.concatenate(Automata.makeBinary(new BytesRef(prefix)),
                Operations.repeat(anyByte, SortableValueCodec.ENCODED_LENGTH, SortableValueCodec.ENCODED_LENGTH));
    }
}
