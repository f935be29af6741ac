/*
 * PathPrefixSplitter.java
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
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a string of the form {@code <path><separator><text>} into path-prefixed word tokens.
 *
 * <p>
 * The path prefix runs up to and including the <em>last</em> occurrence of the separator. The text after it is cut
 * into maximal runs of alphanumeric characters; runs of {@value #MIN_TOKEN_UTF8_LENGTH} or more UTF-8 bytes are
 * lower-cased and prefixed with the path prefix. If the input has no separator, or no run is long enough, the input
 * is returned unchanged as the only token.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class PathPrefixSplitter {
    public static final int MIN_TOKEN_UTF8_LENGTH = 3;

    @Nonnull
    private final String separator;

    public PathPrefixSplitter(@Nonnull String separator) {
        this.separator = separator;
    }

    @Nonnull
    public PathTokens split(@Nonnull String input) {
        final String prefix = pathPrefix(input);
        if (prefix == null) {
            return PathTokens.verbatim(input);
        }
        final List<String> tokens = new ArrayList<>();
        for (String piece : textPieces(input.substring(prefix.length()))) {
            if (piece.getBytes(StandardCharsets.UTF_8).length >= MIN_TOKEN_UTF8_LENGTH) {
                tokens.add(prefix + piece.toLowerCase(Locale.ROOT));
            }
        }
        if (tokens.isEmpty()) {
            return PathTokens.verbatim(input);
        }
        return PathTokens.normalized(tokens);
    }

    /**
     * Get the path prefix of a string, including the trailing separator.
     *
     * @param input a path-prefixed string
     * @return everything up to and including the last separator, or {@code null} if there is none
     */
    @Nullable
    public String pathPrefix(@Nonnull String input) {
        final int pos = input.lastIndexOf(separator);
        if (pos < 0) {
            return null;
        }
        return input.substring(0, pos + separator.length());
    }

    @Nonnull
    public String getSeparator() {
        return separator;
    }

    /**
     * Cut text into its maximal runs of alphanumeric characters.
     *
     * @param text the text to cut
     * @return the runs in order of appearance
     */
    @Nonnull
    public static List<String> textPieces(@Nonnull String text) {
        final List<String> pieces = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < text.length(); ) {
            final int codePoint = text.codePointAt(i);
            if (TextChars.isAlphanumeric(codePoint)) {
                if (start < 0) {
                    start = i;
                }
            } else if (start >= 0) {
                pieces.add(text.substring(start, i));
                start = -1;
            }
            i += Character.charCount(codePoint);
        }
        if (start >= 0) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }
}
