/*
 * PathPrefixNgramTokenizerFactory.java
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

import com.google.auto.service.AutoService;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.util.TokenizerFactory;
import org.apache.lucene.util.AttributeFactory;
import org.flatjson.FlatJsonConfig;
import org.flatjson.FlatJsonConfigurationException;
import org.flatjson.annotation.API;
import org.flatjson.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Factory for {@link PathPrefixNgramTokenizer}, registered with Lucene's analysis SPI as {@value #NAME}.
 *
 * <pre>
 * separator: path separator, default "__"
 * minGram:   shortest gram, default 2
 * maxGram:   longest gram, default 3
 * </pre>
 */
@AutoService(TokenizerFactory.class)
@API(API.Status.UNSTABLE)
public final class PathPrefixNgramTokenizerFactory extends TokenizerFactory {
    public static final String NAME = "pathPrefixNgram";
    public static final String SEPARATOR_KEY = "separator";
    public static final String MIN_GRAM_KEY = "minGram";
    public static final String MAX_GRAM_KEY = "maxGram";

    @Nonnull
    private final String separator;
    private final int minGram;
    private final int maxGram;

    public PathPrefixNgramTokenizerFactory(Map<String, String> args) {
        super(args);
        separator = FlatJsonConfig.validatePathSeparator(get(args, SEPARATOR_KEY, FlatJsonConfig.DEFAULT_PATH_SEPARATOR));
        minGram = intArg(args, MIN_GRAM_KEY, FlatJsonConfig.DEFAULT_NGRAM_MIN_GRAM);
        maxGram = intArg(args, MAX_GRAM_KEY, FlatJsonConfig.DEFAULT_NGRAM_MAX_GRAM);
        FlatJsonConfig.validateNgramBounds(minGram, maxGram);
        if (!args.isEmpty()) {
            throw new FlatJsonConfigurationException("unknown tokenizer parameters",
                    LogMessageKeys.OPTION_NAME, args.keySet());
        }
    }

    private int intArg(@Nonnull Map<String, String> args, @Nonnull String name, int defaultValue) {
        final String value = args.remove(name);
        if (value == null) {
            return defaultValue;
        }
        return FlatJsonConfig.parseIntOption(name, value);
    }

    @Override
    public Tokenizer create(AttributeFactory factory) {
        return new PathPrefixNgramTokenizer(factory, separator, minGram, maxGram);
    }

    @Nonnull
    public String getSeparator() {
        return separator;
    }

    public int getMinGram() {
        return minGram;
    }

    public int getMaxGram() {
        return maxGram;
    }
}
