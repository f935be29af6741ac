/*
 * PathPrefixNgramTokenizer.java
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
import org.apache.lucene.analysis.ngram.NGramTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import org.apache.lucene.util.AttributeFactory;
import org.flatjson.annotation.API;
import org.flatjson.text.PathPrefixSplitter;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tokenizer for {@code <path><separator><text>} values that emits every character n-gram of the text with the path
 * and separator in front of it. N-grams are produced by Lucene's {@link NGramTokenizer}, ordered by start position
 * and then by length, and keep their case and any whitespace.
 *
 * <p>
 * Input without a separator is n-grammed whole, without a prefix. Text shorter than the minimum gram yields no
 * tokens at all.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class PathPrefixNgramTokenizer extends Tokenizer {
    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);

    @Nonnull
    private final PathPrefixSplitter splitter;
    private final int minGram;
    private final int maxGram;
    private List<TokenStreamTerms.Token> tokens = Collections.emptyList();
    private int nextToken;
    private int inputLength;
    private boolean consumed;

    public PathPrefixNgramTokenizer(@Nonnull String separator, int minGram, int maxGram) {
        this(DEFAULT_TOKEN_ATTRIBUTE_FACTORY, separator, minGram, maxGram);
    }

    public PathPrefixNgramTokenizer(@Nonnull AttributeFactory factory, @Nonnull String separator, int minGram, int maxGram) {
        super(factory);
        if (minGram < 1 || minGram > maxGram) {
            throw new IllegalArgumentException("invalid n-gram bounds: " + minGram + ".." + maxGram);
        }
        this.splitter = new PathPrefixSplitter(separator);
        this.minGram = minGram;
        this.maxGram = maxGram;
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!consumed) {
            final String text = TokenStreamTerms.readFully(input);
            inputLength = text.length();
            tokens = prefixedGrams(text);
            consumed = true;
        }
        if (nextToken >= tokens.size()) {
            return false;
        }
        clearAttributes();
        final TokenStreamTerms.Token token = tokens.get(nextToken++);
        termAtt.setEmpty().append(token.getText());
        offsetAtt.setOffset(correctOffset(token.getStartOffset()), correctOffset(token.getEndOffset()));
        posIncAtt.setPositionIncrement(1);
        return true;
    }

    @Nonnull
    private List<TokenStreamTerms.Token> prefixedGrams(@Nonnull String text) throws IOException {
        final String prefix = splitter.pathPrefix(text);
        if (prefix == null) {
            return TokenStreamTerms.collect(new NGramTokenizer(minGram, maxGram), text);
        }
        final List<TokenStreamTerms.Token> grams = TokenStreamTerms.collect(
                new NGramTokenizer(minGram, maxGram), text.substring(prefix.length()));
        final List<TokenStreamTerms.Token> prefixed = new ArrayList<>(grams.size());
        for (TokenStreamTerms.Token gram : grams) {
            final String term = prefix + gram.getText();
            prefixed.add(new TokenStreamTerms.Token(term, 0, term.length()));
        }
        return prefixed;
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

    public int getMinGram() {
        return minGram;
    }

    public int getMaxGram() {
        return maxGram;
    }
}
