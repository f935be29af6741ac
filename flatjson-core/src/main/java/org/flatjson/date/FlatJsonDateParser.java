/*
 * FlatJsonDateParser.java
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

import org.flatjson.annotation.API;
import org.flatjson.codec.SortableValueCodec;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Recognizes the date strings that get indexed into the date field.
 *
 * <p>
 * Accepted forms, tried in order: an ISO-8601 date-time with offset, an ISO-8601 local date-time (taken as UTC), and
 * a bare {@code YYYY-MM-DD} date (taken as midnight UTC).
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class FlatJsonDateParser {
    /**
     * Shortest string that is considered as a date candidate during ingestion.
     */
    public static final int MIN_CANDIDATE_LENGTH = 8;
    private static final int DATE_ONLY_LENGTH = 10;

    private FlatJsonDateParser() {
    }

    /**
     * Check whether a string value should be indexed as a date. Strings that are too short or that have none of
     * {@code -}, {@code T} or {@code :} are never dates.
     *
     * @param value a JSON string value
     * @return the instant the value denotes, or empty if it should be treated as text
     */
    @Nonnull
    public static Optional<Instant> tryParse(@Nonnull String value) {
        if (!isCandidate(value)) {
            return Optional.empty();
        }
        return parseFormats(value);
    }

    /**
     * Parse a string in any accepted form, without the ingestion heuristics.
     *
     * @param value the date string
     * @return the instant, if any form matched and it fits the date encoding
     */
    @Nonnull
    public static Optional<Instant> parseFormats(@Nonnull String value) {
        Instant instant = parseOffsetDateTime(value);
        if (instant == null) {
            instant = parseLocalDateTime(value);
        }
        if (instant == null && value.length() == DATE_ONLY_LENGTH && countDashes(value) == 2) {
            instant = parseLocalDate(value);
        }
        if (instant == null || !isRepresentable(instant)) {
            return Optional.empty();
        }
        return Optional.of(instant);
    }

    /**
     * Parse a date supplied as a query argument.
     *
     * @param value the date string
     * @return the instant
     * @throws DateParseException if no accepted form matches
     */
    @Nonnull
    public static Instant parse(@Nonnull String value) {
        return parseFormats(value).orElseThrow(() -> new DateParseException(value));
    }

    static boolean isCandidate(@Nonnull String value) {
        return value.length() >= MIN_CANDIDATE_LENGTH
               && (value.indexOf('-') >= 0 || value.indexOf('T') >= 0 || value.indexOf(':') >= 0);
    }

    // dates beyond the signed 64 bit microsecond range cannot be encoded
    private static boolean isRepresentable(@Nonnull Instant instant) {
        try {
            SortableValueCodec.toEpochMicros(instant);
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    @Nullable
    private static Instant parseOffsetDateTime(@Nonnull String value) {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Nullable
    private static Instant parseLocalDateTime(@Nonnull String value) {
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Nullable
    private static Instant parseLocalDate(@Nonnull String value) {
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static int countDashes(@Nonnull String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '-') {
                count++;
            }
        }
        return count;
    }
}
