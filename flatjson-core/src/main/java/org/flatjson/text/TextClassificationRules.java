/*
 * TextClassificationRules.java
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
import org.flatjson.FlatJsonConfigurationException;
import org.flatjson.annotation.API;
import org.flatjson.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered identifier patterns used by {@link TextClassifier}. The first pattern that finds a match wins.
 */
@API(API.Status.UNSTABLE)
public final class TextClassificationRules {
    /**
     * Upper-case alphanumeric codes, lower-case email addresses, and letter-prefixed serial numbers.
     */
    public static final List<String> DEFAULT_IDENTIFIER_PATTERNS = ImmutableList.of(
            "^[A-Z0-9]{6,}$",
            "^[a-z0-9]+@[a-z0-9]+\\.[a-z]+$",
            "^[A-Z]{2,3}[0-9]{6,}$");

    private static final TextClassificationRules DEFAULT_RULES = fromPatterns(DEFAULT_IDENTIFIER_PATTERNS);

    @Nonnull
    private final List<Pattern> identifierPatterns;

    private TextClassificationRules(@Nonnull List<Pattern> identifierPatterns) {
        this.identifierPatterns = ImmutableList.copyOf(identifierPatterns);
    }

    @Nonnull
    public static TextClassificationRules defaultRules() {
        return DEFAULT_RULES;
    }

    /**
     * Compile the given regular expressions, keeping their order.
     *
     * @param patterns regular expressions in priority order
     * @return the compiled rules
     * @throws FlatJsonConfigurationException if any expression does not compile
     */
    @Nonnull
    public static TextClassificationRules fromPatterns(@Nonnull List<String> patterns) {
        final ImmutableList.Builder<Pattern> compiled = ImmutableList.builderWithExpectedSize(patterns.size());
        for (String pattern : patterns) {
            try {
                compiled.add(Pattern.compile(pattern));
            } catch (PatternSyntaxException ex) {
                throw new FlatJsonConfigurationException("invalid identifier pattern", ex)
                        .addLogInfo(LogMessageKeys.PATTERN.toString(), pattern);
            }
        }
        return new TextClassificationRules(compiled.build());
    }

    @Nonnull
    public static TextClassificationRules of(@Nonnull List<Pattern> patterns) {
        return new TextClassificationRules(patterns);
    }

    @Nonnull
    public List<Pattern> getIdentifierPatterns() {
        return identifierPatterns;
    }

    @Override
    public String toString() {
        return identifierPatterns.toString();
    }
}
