/*
 * LogMessageKeys.java
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

package org.flatjson.logging;

import org.flatjson.annotation.API;

import java.util.Locale;

/**
 * Common keys for {@link KeyValueLogMessage} and for the log info of {@link org.flatjson.FlatJsonException}.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // configuration
    PATH_SEPARATOR,
    IDENTIFIER_PATTERN_COUNT,
    PATTERN,
    MIN_GRAM,
    MAX_GRAM,
    OPTION_NAME,
    OPTION_VALUE,
    // documents
    PATH,
    LENGTH,
    OFFSET,
    JSON_TYPE,
    // queries
    FIELD_NAME,
    QUERY_VALUE,
    DATE_VALUE,
    // index
    DIRECTORY,
    EXISTING;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
