/*
 * DateParseException.java
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

package org.flatjson.date;

import org.flatjson.FlatJsonArgumentException;
import org.flatjson.annotation.API;
import org.flatjson.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Thrown when a date query endpoint matches none of the accepted formats.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class DateParseException extends FlatJsonArgumentException {
    @Nonnull
    private final String value;

    public DateParseException(@Nonnull String value) {
        super("unable to parse date", LogMessageKeys.DATE_VALUE.toString(), value);
        this.value = value;
    }

    @Nonnull
    public String getValue() {
        return value;
    }
}
