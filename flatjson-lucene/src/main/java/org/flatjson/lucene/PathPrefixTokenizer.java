/*
 * PathPrefixTokenizer.java
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
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.apache.lucene.util.AttributeFactory;
import org.flatjson.annotation.API;
import org.flatjson.text.PathPrefixSplitter;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Tokenizer for {@code <path><separator><text>} values. Emits the words of the text, lower-cased and prefixed with
 * the path and separator, or the whole input when there is no word of at least three UTF-8 bytes.
 * See {@link PathPrefixSplitter} for the exact rules.
 *
 * <p>
 * Positions are consecutive and every token's offsets span {@code [0, token length)}.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class PathPrefixTokenizer extends Tokenizer {
    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);

    @Nonnull
    private final PathPrefixSplitter splitter;
    private List<String> tokens = Collections.emptyList();
    private int nextToken;
    private int inputLength;
    private boolean consumed;

    public PathPrefixTokenizer(@Nonnull String separator) {
        this(DEFAULT_TOKEN_ATTRIBUTE_FACTORY, separator);
    }

    public PathPrefixTokenizer(@Nonnull AttributeFactory factory, @Nonnull String separator) {
        super(factory);
        this.splitter = new PathPrefixSplitter(separator);
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!consumed) {
            final String text = TokenStreamTerms.readFully(input);
            inputLength = text.length();
            tokens = splitter.split(text).getTokens();
            consumed = true;
        }
        if (nextToken >= tokens.size()) {
            return false;
        }
        clearAttributes();
        final String token = tokens.get(nextToken++);
        termAtt.setEmpty().append(token);
        offsetAtt.setOffset(correctOffset(0), correctOffset(token.length()));
        posIncAtt.setPositionIncrement(1);
        return true;
    }

    @Override
    public void end() throws IOException {
        super.end();
        final int finalOffset = correctOffset(inputLength);
        offsetAtt.setOffset(finalOffset, finalOffset);
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        tokens = Collections.emptyList();
        nextToken = 0;
        inputLength = 0;
        consumed = false;
    }

    /**
     * Tokenize a string with this tokenizer. The tokenizer is closed afterwards.
     *
     * @param text the path-prefixed text
     * @return the token texts in order
     * @throws IOException if reading fails
     */
    @Nonnull
    public List<String> tokenizeToStrings(@Nonnull String text) throws IOException {
        return TokenStreamTerms.collectTerms(this, text);
    }
}
