/*
 * TextClassifier.java
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

import org.flatjson.annotation.API;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides how a string value is indexed.
 *
 * <p>
 * A value matching an identifier pattern is an {@link TextType#IDENTIFIER}. Otherwise a value with any character that
 * is not alphanumeric (whitespace, punctuation, symbols) is {@link TextType#ANALYZED_TEXT}, and anything left,
 * including the empty string, is a {@link TextType#KEYWORD}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class TextClassifier {
    @Nonnull
    private final TextClassificationRules rules;

    public TextClassifier(@Nonnull TextClassificationRules rules) {
        this.rules = rules;
    }

    @Nonnull
    public TextType classify(@Nonnull String text) {
        if (matchingIdentifierPattern(text).isPresent()) {
            return TextType.IDENTIFIER;
        }
        for (int i = 0; i < text.length(); ) {
            final int codePoint = text.codePointAt(i);
            // whitespace and punctuation are never alphanumeric
            if (!TextChars.isAlphanumeric(codePoint)) {
                return TextType.ANALYZED_TEXT;
            }
            i += Character.charCount(codePoint);
        }
        return TextType.KEYWORD;
    }

    /**
     * Find the first identifier pattern, in configured order, that finds a match in the text.
     *
     * @param text the value to test
     * @return the winning pattern, if any
     */
    @Nonnull
    public Optional<Pattern> matchingIdentifierPattern(@Nonnull String text) {
        for (Pattern pattern : rules.getIdentifierPatterns()) {
            if (pattern.matcher(text).find()) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    @Nonnull
    public TextClassificationRules getRules() {
        return rules;
    }
}
