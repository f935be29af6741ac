/*
 * PathPrefixNgramTokenizerTest.java
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

import org.apache.lucene.analysis.Analyzer;
import org.flatjson.FlatJsonConfig;
import org.flatjson.document.FieldKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

class PathPrefixNgramTokenizerTest {
    @Test
    void prefixedGramsInStartThenLengthOrder() throws IOException {
        List<String> grams = TokenStreamTerms.collectTerms(new PathPrefixNgramTokenizer("__", 2, 3), "p__abcd");
        Assertions.assertIterableEquals(List.of("p__ab", "p__abc", "p__bc", "p__bcd", "p__cd"), grams);
    }

    @Test
    void gramsKeepCaseAndWhitespace() throws IOException {
        List<String> grams = TokenStreamTerms.collectTerms(new PathPrefixNgramTokenizer("__", 2, 3), "n__Ab c");
        Assertions.assertIterableEquals(List.of("n__Ab", "n__Ab ", "n__b ", "n__b c", "n__ c"), grams);
    }

    @Test
    void onlyLastSeparatorCounts() throws IOException {
        List<String> grams = TokenStreamTerms.collectTerms(new PathPrefixNgramTokenizer("__", 3, 3), "a__b__xyz");
        Assertions.assertIterableEquals(List.of("a__b__xyz"), grams);
    }

    @Test
    void withoutSeparatorWholeInputIsGrammed() throws IOException {
        List<TokenStreamTerms.Token> grams = TokenStreamTerms.collect(new PathPrefixNgramTokenizer("__", 2, 3), "abc");
        Assertions.assertIterableEquals(List.of("ab[0,2)", "abc[0,3)", "bc[1,3)"),
                grams.stream().map(TokenStreamTerms.Token::toString).collect(Collectors.toList()));
    }

    @Test
    void shortTextHasNoGrams() throws IOException {
        Assertions.assertTrue(TokenStreamTerms.collectTerms(new PathPrefixNgramTokenizer("__", 2, 3), "p__a").isEmpty());
        Assertions.assertTrue(TokenStreamTerms.collectTerms(new PathPrefixNgramTokenizer("__", 2, 3), "p__").isEmpty());
    }

    @Test
    void analyzerUsesConfiguredBounds() throws IOException {
        FlatJsonConfig config = FlatJsonConfig.newBuilder().setNgramMinGram(4).setNgramMaxGram(4).build();
        try (Analyzer analyzer = new FlatJsonAnalyzer(config)) {
            Assertions.assertIterableEquals(List.of("d__rust", "d__ust "),
                    PathPrefixTokenizerTest.readTokenizedText(analyzer, FieldKind.TEXT_NGRAM.getFieldName(), "d__rust "));
        }
    }

    @Test
    void invalidBounds() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PathPrefixNgramTokenizer("__", 0, 3));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PathPrefixNgramTokenizer("__", 3, 2));
    }
}
