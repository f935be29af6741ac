/*
 * FlatJsonQueryBuilder.java
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

import org.apache.lucene.analysis.ngram.NGramTokenizer;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.AutomatonQuery;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.Operations;
import org.flatjson.FlatJsonConfig;
import org.flatjson.FlatJsonException;
import org.flatjson.PathTerms;
import org.flatjson.annotation.API;
import org.flatjson.codec.SortableValueCodec;
import org.flatjson.date.FlatJsonDateParser;
import org.flatjson.document.FieldKind;
import org.flatjson.logging.KeyValueLogMessage;
import org.flatjson.logging.LogMessageKeys;
import org.flatjson.text.PathPrefixSplitter;
import org.flatjson.text.PathTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;

/**
 * Builds Lucene queries over a flat JSON index. Every query is scoped to one JSON key by the path prefix of the
 * terms it looks for, except {@link #dateExact(String)}.
 */
@API(API.Status.UNSTABLE)
public class FlatJsonQueryBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlatJsonQueryBuilder.class);

    @Nonnull
    private final PathTerms pathTerms;
    @Nonnull
    private final PathPrefixSplitter splitter;
    private final int minGram;
    private final int maxGram;

    public FlatJsonQueryBuilder(@Nonnull FlatJsonConfig config) {
        this.pathTerms = config.getPathTerms();
        this.splitter = new PathPrefixSplitter(config.getPathSeparator());
        this.minGram = config.getNgramMinGram();
        this.maxGram = config.getNgramMaxGram();
    }

    /**
     * Match documents whose value for the key is exactly the given string. Applies to every string that is not a
     * date, and to booleans written as {@code "true"} or {@code "false"}.
     *
     * @param path the JSON key
     * @param value the value, compared case-sensitively
     * @return a term query on {@code text_raw}
     */
    @Nonnull
    public Query exact(@Nonnull String path, @Nonnull String value) {
        return new TermQuery(new Term(FieldKind.TEXT_RAW.getFieldName(), pathTerms.text(path, value)));
    }

    /**
     * Match documents whose value for the key is exactly the given string, or whose free text value for the key
     * contains every word of the given string.
     *
     * @param path the JSON key
     * @param value a value or a few words
     * @return a disjunction of the exact query and, if the value has words, a conjunction over {@code text_analyzed}
     */
    @Nonnull
    public Query smart(@Nonnull String path, @Nonnull String value) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(exact(path, value), BooleanClause.Occur.SHOULD);
        final PathTokens tokens = splitter.split(pathTerms.text(path, value));
        if (!tokens.isVerbatim()) {
            final BooleanQuery.Builder words = new BooleanQuery.Builder();
            for (String token : tokens.getTokens()) {
                words.add(new TermQuery(new Term(FieldKind.TEXT_ANALYZED.getFieldName(), token)), BooleanClause.Occur.MUST);
            }
            builder.add(words.build(), BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }

    /**
     * Match documents whose free text value for the key contains the given substring, case-sensitively.
     * A substring shorter than the minimum n-gram matches nothing.
     *
     * @param path the JSON key
     * @param value the substring
     * @return a conjunction of the substring's n-grams over {@code text_ngram}
     */
    @Nonnull
    public Query ngram(@Nonnull String path, @Nonnull String value) {
        final List<String> grams = grams(value);
        if (grams.isEmpty()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("n-gram query has no grams",
                        LogMessageKeys.PATH, path,
                        LogMessageKeys.QUERY_VALUE, value,
                        LogMessageKeys.MIN_GRAM, minGram));
            }
            return new MatchNoDocsQuery("value shorter than minimum n-gram");
        }
        final String prefix = pathTerms.prefix(path);
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (String gram : grams) {
            builder.add(new TermQuery(new Term(FieldKind.TEXT_NGRAM.getFieldName(), prefix + gram)), BooleanClause.Occur.MUST);
        }
        return builder.build();
    }

    /**
     * Match documents with a number for the key in the inclusive range.
     *
     * @param path the JSON key
     * @param min lower bound
     * @param max upper bound
     * @return a range query on {@code number}; empty if {@code min > max}
     */
    @Nonnull
    public Query numberRange(@Nonnull String path, double min, double max) {
        return encodedRange(FieldKind.NUMBER, path, SortableValueCodec.encodeDouble(min), SortableValueCodec.encodeDouble(max));
    }

    @Nonnull
    public Query numberExact(@Nonnull String path, double value) {
        return new TermQuery(new Term(FieldKind.NUMBER.getFieldName(),
                new BytesRef(pathTerms.bytes(path, SortableValueCodec.encodeDouble(value)))));
    }

    /**
     * Match documents with a date for the key in the inclusive range.
     *
     * @param path the JSON key
     * @param start lower bound, in any accepted date format
     * @param end upper bound, in any accepted date format
     * @return a range query on {@code date}
     * @throws org.flatjson.date.DateParseException if either bound is not a date
     */
    @Nonnull
    public Query dateRange(@Nonnull String path, @Nonnull String start, @Nonnull String end) {
        final byte[] lower = SortableValueCodec.encodeInstant(FlatJsonDateParser.parse(start));
        final byte[] upper = SortableValueCodec.encodeInstant(FlatJsonDateParser.parse(end));
        return encodedRange(FieldKind.DATE, path, lower, upper);
    }

    /**
     * Match documents with exactly this date under any key. Documents that have the date under a different key than
     * the one a caller has in mind match too; use {@link #dateExact(String, String)} to restrict the key.
     *
     * @param date the date, in any accepted date format
     * @return a query on {@code date}
     * @throws org.flatjson.date.DateParseException if the value is not a date
     */
    @Nonnull
    public Query dateExact(@Nonnull String date) {
        final byte[] encoded = SortableValueCodec.encodeInstant(FlatJsonDateParser.parse(date));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("date query is not scoped to a path",
                    LogMessageKeys.DATE_VALUE, date));
        }
        final Automaton automaton = PathScopedAutomata.anyPathWithValue(pathTerms.separatorBytes(), encoded);
        return new AutomatonQuery(new Term(FieldKind.DATE.getFieldName()), automaton,
                Operations.DEFAULT_DETERMINIZE_WORK_LIMIT, true);
    }

    @Nonnull
    public Query dateExact(@Nonnull String path, @Nonnull String date) {
        final byte[] encoded = SortableValueCodec.encodeInstant(FlatJsonDateParser.parse(date));
        return new TermQuery(new Term(FieldKind.DATE.getFieldName(), new BytesRef(pathTerms.bytes(path, encoded))));
    }

    @Nonnull
    public Query bool(@Nonnull String path, boolean value) {
        return new TermQuery(new Term(FieldKind.TEXT_RAW.getFieldName(), pathTerms.bool(path, value)));
    }

    @Nonnull
    private Query encodedRange(@Nonnull FieldKind kind, @Nonnull String path, @Nonnull byte[] lower, @Nonnull byte[] upper) {
        final Automaton automaton = PathScopedAutomata.encodedRange(pathTerms.prefixBytes(path), lower, upper);
        return new AutomatonQuery(new Term(kind.getFieldName(), new BytesRef(pathTerms.prefixBytes(path))), automaton,
                Operations.DEFAULT_DETERMINIZE_WORK_LIMIT, true);
    }

    @Nonnull
    private List<String> grams(@Nonnull String value) {
        try {
            return TokenStreamTerms.collectTerms(new NGramTokenizer(minGram, maxGram), value);
        } catch (IOException ex) {
            throw new FlatJsonException("unable to split query value into n-grams", ex)
                    .addLogInfo(LogMessageKeys.QUERY_VALUE.toString(), value);
        }
    }
}
