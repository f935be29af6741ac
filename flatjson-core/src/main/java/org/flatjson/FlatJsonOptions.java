/*
 * FlatJsonOptions.java
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

import org.flatjson.annotation.API;

/**
 * Option keys understood by {@link FlatJsonConfig#fromOptions(java.util.Map)}.
 */
@API(API.Status.EXPERIMENTAL)
public class FlatJsonOptions {
    /**
     * Separator placed between a JSON key and its value in every indexed term. Default {@code "__"}.
     */
    public static final String PATH_SEPARATOR = "pathSeparator";
    /**
     * Identifier regular expressions in priority order, one per line.
     */
    public static final String IDENTIFIER_PATTERNS = "identifierPatterns";
    /**
     * Shortest n-gram, at least 1. Default 2.
     */
    public static final String NGRAM_MIN_GRAM = "ngramMinGram";
    /**
     * Longest n-gram, at least the minimum. Default 3.
     */
    public static final String NGRAM_MAX_GRAM = "ngramMaxGram";

    private FlatJsonOptions() {
    }
}
