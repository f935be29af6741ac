/*
 * TokenStreamTerms.java
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

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.flatjson.annotation.API;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers that run a tokenizer over a string and collect what it emits.
 */
@API(API.Status.INTERNAL)
public final class TokenStreamTerms {
    private static final int READ_BUFFER_SIZE = 1024;

    private TokenStreamTerms() {
    }

    /**
     * A collected token and its offsets.
     */
    public static final class Token {
        @Nonnull
        private final String text;
        private final int startOffset;
        private final int endOffset;

        Token(@Nonnull String text, int startOffset, int endOffset) {
            this.text = text;
            this.startOffset = startOffset;
            this.endOffset = endOffset;
        }

        @Nonnull
        public String getText() {
            return text;
        }

        public int getStartOffset() {
            return startOffset;
        }

        public int getEndOffset() {
            return endOffset;
        }

        @Override
        public String toString() {
            return text + "[" + startOffset + "," + endOffset + ")";
        }
    }

    /**
     * Run a fresh tokenizer over the text and close it.
     *
     * @param tokenizer a tokenizer that has not been given a reader yet
     * @param text the text to tokenize
     * @return the emitted tokens in order
     * @throws IOException if the tokenizer fails
     */
    @Nonnull
    public static List<Token> collect(@Nonnull Tokenizer tokenizer, @Nonnull String text) throws IOException {
        final List<Token> tokens = new ArrayList<>();
        tokenizer.setReader(new StringReader(text));
        try (TokenStream stream = tokenizer) {
            final CharTermAttribute termAtt = stream.addAttribute(CharTermAttribute.class);
            final OffsetAttribute offsetAtt = stream.addAttribute(OffsetAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(new Token(termAtt.toString(), offsetAtt.startOffset(), offsetAtt.endOffset()));
            }
            stream.end();
        }
        return tokens;
    }

    @Nonnull
    public static List<String> collectTerms(@Nonnull Tokenizer tokenizer, @Nonnull String text) throws IOException {
        final List<String> terms = new ArrayList<>();
        for (Token token : collect(tokenizer, text)) {
            terms.add(token.getText());
        }
        return terms;
    }

    @Nonnull
    static String readFully(@Nonnull Reader reader) throws IOException {
        final StringBuilder sb = new StringBuilder();
        final char[] buffer = new char[READ_BUFFER_SIZE];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            sb.append(buffer, 0, read);
        }
        return sb.toString();
    }
}
