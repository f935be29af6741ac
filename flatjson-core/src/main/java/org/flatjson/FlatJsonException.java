/*
 * FlatJsonException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for the flat JSON layer. Carries key/value log information that callers can pass on to
 * {@link org.flatjson.logging.KeyValueLogMessage} so failures stay searchable in logs.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class FlatJsonException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     * This will throw an {@link IllegalArgumentException} if <code>keyValues</code>
     * contains an odd number of elements.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @see #addLogInfo(Object...)
     */
    public FlatJsonException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public FlatJsonException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information associated with this exception as a map.
     *
     * @return a single map with all log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description description of the log info pair
     * @param object value of the log info pair
     * @return this exception
     */
    @Nonnull
    public FlatJsonException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key and
     * every odd element is the value of the key before it. This is the same format that
     * {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened map of key-value pairs
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public FlatJsonException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information to a flattened array of alternating keys and values.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exportedInfo = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exportedInfo[i] = entry.getKey();
            exportedInfo[i + 1] = entry.getValue();
            i += 2;
        }
        return exportedInfo;
    }
}
