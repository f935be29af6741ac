/*
 * FlatJsonConfig.java
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

package org.flatjson;

import com.google.common.base.Splitter;
import org.flatjson.annotation.API;
import org.flatjson.logging.KeyValueLogMessage;
import org.flatjson.logging.LogMessageKeys;
import org.flatjson.text.TextClassificationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings of a flat JSON index: the path separator, the identifier patterns and the n-gram bounds.
 * Writers and readers of one index must use equal configurations.
 */
@API(API.Status.EXPERIMENTAL)
public class FlatJsonConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlatJsonConfig.class);

    public static final String DEFAULT_PATH_SEPARATOR = "__";
    public static final int DEFAULT_NGRAM_MIN_GRAM = 2;
    public static final int DEFAULT_NGRAM_MAX_GRAM = 3;

    private static final FlatJsonConfig DEFAULT_CONFIG = newBuilder().build();

    @Nonnull
    private final String pathSeparator;
    @Nonnull
    private final TextClassificationRules classificationRules;
    private final int ngramMinGram;
    private final int ngramMaxGram;
    @Nonnull
    private final PathTerms pathTerms;

    private FlatJsonConfig(@Nonnull Builder builder) {
        this.pathSeparator = builder.pathSeparator;
        this.classificationRules = builder.classificationRules;
        this.ngramMinGram = builder.ngramMinGram;
        this.ngramMaxGram = builder.ngramMaxGram;
        this.pathTerms = new PathTerms(pathSeparator);
    }

    @Nonnull
    public static FlatJsonConfig defaultConfig() {
        return DEFAULT_CONFIG;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Build a configuration from string options, as found in a properties file or index metadata.
     * Missing options keep their defaults.
     *
     * @param options option values keyed by the names in {@link FlatJsonOptions}
     * @return the validated configuration
     * @throws FlatJsonConfigurationException if an option is unknown or has an invalid value
     */
    @Nonnull
    public static FlatJsonConfig fromOptions(@Nonnull Map<String, String> options) {
        final Builder builder = newBuilder();
        for (Map.Entry<String, String> option : options.entrySet()) {
            final String value = option.getValue();
            switch (option.getKey()) {
                case FlatJsonOptions.PATH_SEPARATOR:
                    builder.setPathSeparator(value);
                    break;
                case FlatJsonOptions.IDENTIFIER_PATTERNS:
                    builder.setIdentifierPatterns(Splitter.on('\n').omitEmptyStrings().splitToList(value));
                    break;
                case FlatJsonOptions.NGRAM_MIN_GRAM:
                    builder.setNgramMinGram(parseIntOption(option.getKey(), value));
                    break;
                case FlatJsonOptions.NGRAM_MAX_GRAM:
                    builder.setNgramMaxGram(parseIntOption(option.getKey(), value));
                    break;
                default:
                    throw new FlatJsonConfigurationException("unknown option",
                            LogMessageKeys.OPTION_NAME, option.getKey());
            }
        }
        return builder.build();
    }

    /**
     * Parse an integer option value.
     *
     * @param name option name, for error reporting
     * @param value the raw value
     * @return the parsed integer
     * @throws FlatJsonConfigurationException if the value is not an integer
     */
    public static int parseIntOption(@Nonnull String name, @Nullable String value) {
        try {
            return Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException ex) {
            throw new FlatJsonConfigurationException("invalid integer option", ex)
                    .addLogInfo(LogMessageKeys.OPTION_NAME.toString(), name)
                    .addLogInfo(LogMessageKeys.OPTION_VALUE.toString(), value);
        }
    }

    /**
     * Check that a separator can delimit paths from values.
     *
     * @param separator the candidate separator
     * @return the separator
     * @throws FlatJsonConfigurationException if it is null, empty or only whitespace
     */
    @Nonnull
    public static String validatePathSeparator(@Nullable String separator) {
        if (separator == null || separator.trim().isEmpty()) {
            throw new FlatJsonConfigurationException("path separator must not be empty or blank",
                    LogMessageKeys.PATH_SEPARATOR, separator);
        }
        return separator;
    }

    /**
     * Check n-gram bounds.
     *
     * @param minGram shortest gram
     * @param maxGram longest gram
     * @throws FlatJsonConfigurationException unless {@code 1 <= minGram <= maxGram}
     */
    public static void validateNgramBounds(int minGram, int maxGram) {
        if (minGram < 1) {
            throw new FlatJsonConfigurationException("minimum gram must be at least 1",
                    LogMessageKeys.MIN_GRAM, minGram);
        }
        if (minGram > maxGram) {
            throw new FlatJsonConfigurationException("minimum gram must not exceed maximum gram",
                    LogMessageKeys.MIN_GRAM, minGram,
                    LogMessageKeys.MAX_GRAM, maxGram);
        }
    }

    @Nonnull
    public String getPathSeparator() {
        return pathSeparator;
    }

    @Nonnull
    public TextClassificationRules getClassificationRules() {
        return classificationRules;
    }

    public int getNgramMinGram() {
        return ngramMinGram;
    }

    public int getNgramMaxGram() {
        return ngramMaxGram;
    }

    @Nonnull
    public PathTerms getPathTerms() {
        return pathTerms;
    }

    @Override
    public String toString() {
        return KeyValueLogMessage.of("FlatJsonConfig",
                LogMessageKeys.PATH_SEPARATOR, pathSeparator,
                LogMessageKeys.IDENTIFIER_PATTERN_COUNT, classificationRules.getIdentifierPatterns().size(),
                LogMessageKeys.MIN_GRAM, ngramMinGram,
                LogMessageKeys.MAX_GRAM, ngramMaxGram);
    }

    /**
     * Builder for {@link FlatJsonConfig}. Values are validated by {@link #build()}.
     */
    public static class Builder {
        @Nullable
        private String pathSeparator = DEFAULT_PATH_SEPARATOR;
        @Nonnull
        private TextClassificationRules classificationRules = TextClassificationRules.defaultRules();
        private int ngramMinGram = DEFAULT_NGRAM_MIN_GRAM;
        private int ngramMaxGram = DEFAULT_NGRAM_MAX_GRAM;

        private Builder() {
        }

        @Nonnull
        public Builder setPathSeparator(@Nullable String pathSeparator) {
            this.pathSeparator = pathSeparator;
            return this;
        }

        /**
         * Replace the identifier patterns.
         * @param patterns regular expressions in priority order
         * @return this builder
         * @throws FlatJsonConfigurationException if a pattern does not compile
         */
        @Nonnull
        public Builder setIdentifierPatterns(@Nonnull List<String> patterns) {
            this.classificationRules = TextClassificationRules.fromPatterns(patterns);
            return this;
        }

        @Nonnull
        public Builder setClassificationRules(@Nonnull TextClassificationRules classificationRules) {
            this.classificationRules = classificationRules;
            return this;
        }

        @Nonnull
        public Builder setNgramMinGram(int ngramMinGram) {
            this.ngramMinGram = ngramMinGram;
            return this;
        }

        @Nonnull
        public Builder setNgramMaxGram(int ngramMaxGram) {
            this.ngramMaxGram = ngramMaxGram;
            return this;
        }

        @Nonnull
        public FlatJsonConfig build() {
            validatePathSeparator(pathSeparator);
            validateNgramBounds(ngramMinGram, ngramMaxGram);
            final FlatJsonConfig config = new FlatJsonConfig(this);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("built flat json configuration",
                        LogMessageKeys.PATH_SEPARATOR, config.pathSeparator,
                        LogMessageKeys.IDENTIFIER_PATTERN_COUNT, config.classificationRules.getIdentifierPatterns().size(),
                        LogMessageKeys.MIN_GRAM, config.ngramMinGram,
                        LogMessageKeys.MAX_GRAM, config.ngramMaxGram));
            }
            return config;
        }
    }
}
