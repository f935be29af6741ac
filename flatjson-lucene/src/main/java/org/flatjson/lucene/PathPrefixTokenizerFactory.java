/*
 * PathPrefixTokenizerFactory.java
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
 * Factory for {@link PathPrefixTokenizer}, registered with Lucene's analysis SPI as {@value #NAME}.
 *
 * <pre>
 * separator: path separator, default "__"
 * </pre>
 */
@AutoService(TokenizerFactory.class)
@API(API.Status.UNSTABLE)
public final class PathPrefixTokenizerFactory extends TokenizerFactory {
    public static final String NAME = "pathPrefix";
    public static final String SEPARATOR_KEY = "separator";

    @Nonnull
    private final String separator;

    public PathPrefixTokenizerFactory(Map<String, String> args) {
        super(args);
        separator = FlatJsonConfig.validatePathSeparator(get(args, SEPARATOR_KEY, FlatJsonConfig.DEFAULT_PATH_SEPARATOR));
        if (!args.isEmpty()) {
            throw new FlatJsonConfigurationException("unknown tokenizer parameters",
                    LogMessageKeys.OPTION_NAME, args.keySet());
        }
    }

    @Override
    public Tokenizer create(AttributeFactory factory) {
        return new PathPrefixTokenizer(factory, separator);
    }

    @Nonnull
    public String getSeparator() {
        return separator;
    }
}
