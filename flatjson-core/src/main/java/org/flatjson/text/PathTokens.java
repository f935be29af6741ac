/*
 * PathTokens.java
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

package org.flatjson.text;

import com.google.common.collect.ImmutableList;
import org.flatjson.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Result of splitting a path-prefixed string. Either the normalized, path-prefixed word tokens or, when no word
 * survived or the input had no path prefix, the input itself as a single verbatim token.
 */
@API(API.Status.UNSTABLE)
public final class PathTokens {
    @Nonnull
    private final List<String> tokens;
    private final boolean verbatim;

    private PathTokens(@Nonnull List<String> tokens, boolean verbatim) {
        this.tokens = tokens;
        this.verbatim = verbatim;
    }

    @Nonnull
    static PathTokens verbatim(@Nonnull String input) {
        return new PathTokens(ImmutableList.of(input), true);
    }

    @Nonnull
    static PathTokens normalized(@Nonnull List<String> tokens) {
        return new PathTokens(ImmutableList.copyOf(tokens), false);
    }

    @Nonnull
    public List<String> getTokens() {
        return tokens;
    }

    /**
     * Whether the single token is the unmodified input.
     * @return {@code true} for the fallback result
     */
    public boolean isVerbatim() {
        return verbatim;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PathTokens that = (PathTokens) o;
        return verbatim == that.verbatim && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokens, verbatim);
    }

    @Override
    public String toString() {
        return (verbatim ? "verbatim" : "normalized") + tokens;
    }
}
