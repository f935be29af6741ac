/*
 * TokenizerFactoriesTest.java
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

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.util.TokenizerFactory;
import org.flatjson.FlatJsonConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class TokenizerFactoriesTest {
    @Test
    void registeredWithLuceneSpi() {
        Assertions.assertEquals(PathPrefixTokenizerFactory.class, TokenizerFactory.lookupClass(PathPrefixTokenizerFactory.NAME));
        Assertions.assertEquals(PathPrefixNgramTokenizerFactory.class, TokenizerFactory.lookupClass(PathPrefixNgramTokenizerFactory.NAME));
    }

    @Test
    void pathPrefixByName() throws IOException {
        TokenizerFactory factory = TokenizerFactory.forName(PathPrefixTokenizerFactory.NAME, args(PathPrefixTokenizerFactory.SEPARATOR_KEY, "::"));
        Tokenizer tokenizer = factory.create();
        Assertions.assertIterableEquals(List.of("title::rust", "title::search"), TokenStreamTerms.collectTerms(tokenizer, "title::Rust Search"));
    }

    @Test
    void pathPrefixNgramByName() throws IOException {
        TokenizerFactory factory = TokenizerFactory.forName(PathPrefixNgramTokenizerFactory.NAME,
                args(PathPrefixNgramTokenizerFactory.MIN_GRAM_KEY, "3", PathPrefixNgramTokenizerFactory.MAX_GRAM_KEY, "4"));
        Assertions.assertIterableEquals(List.of("t__abc", "t__abcd", "t__bcd"), TokenStreamTerms.collectTerms(factory.create(), "t__abcd"));
    }

    @Test
    void defaults() {
        PathPrefixNgramTokenizerFactory factory = new PathPrefixNgramTokenizerFactory(new HashMap<>());
        Assertions.assertEquals("__", factory.getSeparator());
        Assertions.assertEquals(2, factory.getMinGram());
        Assertions.assertEquals(3, factory.getMaxGram());
        Assertions.assertEquals("__", new PathPrefixTokenizerFactory(new HashMap<>()).getSeparator());
    }

    @Test
    void unknownParameters() {
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixTokenizerFactory(args("delimiter", "__")));
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixNgramTokenizerFactory(args("minGrams", "2")));
    }

    @Test
    void invalidValues() {
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixTokenizerFactory(args(PathPrefixTokenizerFactory.SEPARATOR_KEY, " ")));
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixNgramTokenizerFactory(args(PathPrefixNgramTokenizerFactory.MIN_GRAM_KEY, "0")));
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixNgramTokenizerFactory(args(PathPrefixNgramTokenizerFactory.MIN_GRAM_KEY, "5")));
        Assertions.assertThrows(FlatJsonConfigurationException.class,
                () -> new PathPrefixNgramTokenizerFactory(args(PathPrefixNgramTokenizerFactory.MAX_GRAM_KEY, "lots")));
    }

    private static Map<String, String> args(String... keysAndValues) {
        Map<String, String> args = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            args.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return args;
    }
}
