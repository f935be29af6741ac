/*
 * TextChars.java
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
 * Character classes shared by the classifier and the path-prefix splitter.
 */
@API(API.Status.INTERNAL)
public final class TextChars {
    private TextChars() {
    }

    /**
     * Whether a code point is alphanumeric: any Unicode letter or any Unicode numeric character
     * (decimal digits, letter numbers and other numbers).
     *
     * @param codePoint the code point to test
     * @return {@code true} if it belongs to a word
     */
    public static boolean isAlphanumeric(int codePoint) {
        if (Character.isAlphabetic(codePoint)) {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.DECIMAL_DIGIT_NUMBER:
            case Character.LETTER_NUMBER:
            case Character.OTHER_NUMBER:
                return true;
            default:
                return false;
        }
    }
}
