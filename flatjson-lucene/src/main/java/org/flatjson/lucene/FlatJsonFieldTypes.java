/*
 * FlatJsonFieldTypes.java
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

import org.apache.lucene.document.FieldType;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexOptions;
import org.flatjson.annotation.API;
import org.flatjson.document.FieldKind;

import javax.annotation.Nonnull;

/**
 * Lucene field types of the five physical fields. Only document membership is indexed: no frequencies, positions
 * or norms.
 */
@API(API.Status.UNSTABLE)
public final class FlatJsonFieldTypes {
    /**
     * Untokenized and stored.
     */
    public static final FieldType TEXT_RAW = StringField.TYPE_STORED;
    /**
     * Tokenized with {@link PathPrefixTokenizer} and stored.
     */
    public static final FieldType TEXT_ANALYZED = tokenizedType(true);
    /**
     * Tokenized with {@link PathPrefixNgramTokenizer}.
     */
    public static final FieldType TEXT_NGRAM = tokenizedType(false);
    /**
     * Untokenized binary terms.
     */
    public static final FieldType BINARY = StringField.TYPE_NOT_STORED;

    private FlatJsonFieldTypes() {
    }

    @Nonnull
    public static FieldType forKind(@Nonnull FieldKind kind) {
        switch (kind) {
            case TEXT_RAW:
                return TEXT_RAW;
            case TEXT_ANALYZED:
                return TEXT_ANALYZED;
            case TEXT_NGRAM:
                return TEXT_NGRAM;
            case NUMBER:
            case DATE:
                return BINARY;
            default:
                throw new IllegalArgumentException("unknown field kind " + kind);
        }
    }

    private static FieldType tokenizedType(boolean stored) {
        FieldType ft = new FieldType();
        ft.setIndexOptions(IndexOptions.DOCS);
        ft.setTokenized(true);
        ft.setStored(stored);
        ft.setOmitNorms(true);
        ft.freeze();
        return ft;
    }
}
