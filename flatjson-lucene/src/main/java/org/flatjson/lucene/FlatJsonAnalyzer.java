/*
 * FlatJsonAnalyzer.java
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

import com.google.common.collect.ImmutableMap;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.DelegatingAnalyzerWrapper;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.util.TokenizerFactory;
import org.flatjson.FlatJsonConfig;
import org.flatjson.annotation.API;
import org.flatjson.document.FieldKind;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-field analyzer of a flat JSON index. {@code text_analyzed} uses the {@value PathPrefixTokenizerFactory#NAME}
 * tokenizer, {@code text_ngram} uses the {@value PathPrefixNgramTokenizerFactory#NAME} tokenizer, and every other
 * field is indexed as a single keyword.
 */
@API(API.Status.UNSTABLE)
public class FlatJsonAnalyzer extends DelegatingAnalyzerWrapper {
    @Nonnull
    private final Analyzer defaultAnalyzer;
    @Nonnull
    private final Map<String, Analyzer> fieldAnalyzers;

    public FlatJsonAnalyzer(@Nonnull FlatJsonConfig config) {
        super(PER_FIELD_REUSE_STRATEGY);
        this.defaultAnalyzer = new KeywordAnalyzer();
        this.fieldAnalyzers = ImmutableMap.of(
                FieldKind.TEXT_ANALYZED.getFieldName(), new TokenizerAnalyzer(pathPrefixFactory(config)),
                FieldKind.TEXT_NGRAM.getFieldName(), new TokenizerAnalyzer(pathPrefixNgramFactory(config)));
    }

    @Nonnull
    static PathPrefixTokenizerFactory pathPrefixFactory(@Nonnull FlatJsonConfig config) {
        final Map<String, String> args = new HashMap<>();
        args.put(PathPrefixTokenizerFactory.SEPARATOR_KEY, config.getPathSeparator());
        return new PathPrefixTokenizerFactory(args);
    }

    @Nonnull
    static PathPrefixNgramTokenizerFactory pathPrefixNgramFactory(@Nonnull FlatJsonConfig config) {
        final Map<String, String> args = new HashMap<>();
        args.put(PathPrefixNgramTokenizerFactory.SEPARATOR_KEY, config.getPathSeparator());
        args.put(PathPrefixNgramTokenizerFactory.MIN_GRAM_KEY, Integer.toString(config.getNgramMinGram()));
        args.put(PathPrefixNgramTokenizerFactory.MAX_GRAM_KEY, Integer.toString(config.getNgramMaxGram()));
        return new PathPrefixNgramTokenizerFactory(args);
    }

    @Override
    protected Analyzer getWrappedAnalyzer(String fieldName) {
        return fieldAnalyzers.getOrDefault(fieldName, defaultAnalyzer);
    }

    @Override
    public void close() {
        for (Analyzer analyzer : fieldAnalyzers.values()) {
            analyzer.close();
        }
        defaultAnalyzer.close();
        super.close();
    }

    @Override
    public String toString() {
        return "FlatJsonAnalyzer(" + fieldAnalyzers.keySet() + ")";
    }

    /**
     * Analyzer whose token stream is a single tokenizer made by a factory.
     */
    private static final class TokenizerAnalyzer extends Analyzer {
        @Nonnull
        private final TokenizerFactory factory;

        TokenizerAnalyzer(@Nonnull TokenizerFactory factory) {
            this.factory = factory;
        }

        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            return new TokenStreamComponents(factory.create());
        }
    }
}
