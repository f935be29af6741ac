/*
 * FieldKind.java
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

package org.flatjson.document;

import org.flatjson.annotation.API;

import javax.annotation.Nonnull;

/**
 * The five physical fields every flat JSON object is indexed into, whatever its keys.
 */
@API(API.Status.STABLE)
public enum FieldKind {
    /**
     * Verbatim {@code path + separator + value} strings. Untokenized, stored.
     */
    TEXT_RAW("text_raw", false),
    /**
     * Normalized path-prefixed word tokens of free text. Stored.
     */
    TEXT_ANALYZED("text_analyzed", false),
    /**
     * Path-prefixed character n-grams of free text.
     */
    TEXT_NGRAM("text_ngram", false),
    /**
     * Path prefix bytes followed by a sortable double.
     */
    NUMBER("number", true),
    /**
     * Path prefix bytes followed by a sortable microsecond timestamp.
     */
    DATE("date", true);

    @Nonnull
    private final String fieldName;
    private final boolean binary;

    FieldKind(@Nonnull String fieldName, boolean binary) {
        this.fieldName = fieldName;
        this.binary = binary;
    }

    @Nonnull
    public String getFieldName() {
        return fieldName;
    }

    public boolean isBinary() {
        return binary;
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
