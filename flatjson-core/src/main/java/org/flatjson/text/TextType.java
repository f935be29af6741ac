/*
 * TextType.java
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

/**
 * How a string value is indexed.
 */
@API(API.Status.STABLE)
public enum TextType {
    /**
     * Matches one of the configured identifier patterns. Indexed verbatim only.
     */
    IDENTIFIER,
    /**
     * Free text with separators or punctuation. Indexed verbatim, as normalized word tokens and as n-grams.
     */
    ANALYZED_TEXT,
    /**
     * A single alphanumeric word. Indexed verbatim only.
     */
    KEYWORD
}
