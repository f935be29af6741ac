/*
 * PathPrefixSplitterTest.java
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PathPrefixSplitter}.
 */
class PathPrefixSplitterTest {
    private final PathPrefixSplitter splitter = new PathPrefixSplitter("__");

    @Test
    void splitsFreeText() {
        PathTokens tokens = splitter.split("product_description__A high-quality search engine library");
        assertFalse(tokens.isVerbatim());
        assertEquals(ImmutableList.of(
                "product_description__high",
                "product_description__quality",
                "product_description__search",
                "product_description__engine",
                "product_description__library"), tokens.getTokens());
    }

    @Test
    void prefixEndsAtLastSeparator() {
        assertEquals(ImmutableList.of("a__b__hello", "a__b__world"), splitter.split("a__b__Hello, World!").getTokens());
        assertEquals("a__b__", splitter.pathPrefix("a__b__Hello"));
        assertNull(splitter.pathPrefix("no separator here"));
    }

    @Test
    void pathCaseIsKept() {
        assertEquals(ImmutableList.of("UserName__alice", "UserName__smith"), splitter.split("UserName__Alice Smith").getTokens());
    }

    @Test
    void singleNormalizedWord() {
        PathTokens tokens = splitter.split("product_description__library");
        assertFalse(tokens.isVerbatim());
        assertEquals(ImmutableList.of("product_description__library"), tokens.getTokens());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "no separator at all",
            "",
            "p__",
            "p__!!",
            "p__ab cd",
            "p__é",
            "p__a-b-c"
    })
    void fallsBackToInput(String input) {
        PathTokens tokens = splitter.split(input);
        assertTrue(tokens.isVerbatim(), tokens::toString);
        assertEquals(ImmutableList.of(input), tokens.getTokens());
    }

    @Test
    void lengthCountsUtf8Bytes() {
        // two characters, six bytes
        assertEquals(ImmutableList.of("city__東京"), splitter.split("city__東京").getTokens());
        // two characters, three bytes
        assertEquals(ImmutableList.of("name__éa"), splitter.split("name__éa").getTokens());
    }

    @Test
    void piecesAreAlphanumericRuns() {
        List<String> pieces = PathPrefixSplitter.textPieces("v2.0 is ½ done, x²!");
        assertEquals(ImmutableList.of("v2", "0", "is", "½", "done", "x²"), pieces);
    }

    @Test
    void lowerCasingIsLocaleIndependent() {
        assertEquals(ImmutableList.of("t__title"), splitter.split("t__TITLE").getTokens());
    }

    @Test
    void deterministic() {
        final String input = "review_comments__Great search library! Very fast, well-documented.";
        assertEquals(splitter.split(input), splitter.split(input));
        assertEquals(splitter.split(input), new PathPrefixSplitter("__").split(input));
    }

    @Test
    void customSeparator() {
        PathPrefixSplitter dotted = new PathPrefixSplitter("::");
        assertEquals(ImmutableList.of("title::rust", "title::search"), dotted.split("title::Rust search").getTokens());
        assertTrue(dotted.split("title__Rust search").isVerbatim());
    }
}
