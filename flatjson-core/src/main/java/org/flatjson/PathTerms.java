/*
 * PathTerms.java
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

import com.google.common.primitives.Bytes;
import org.flatjson.annotation.API;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;

/**
 * Composes the path-scoped terms stored in the shared physical fields. Every term starts with the JSON key followed
 * by the separator, so terms of different keys never meet in the same field.
 */
@API(API.Status.UNSTABLE)
public class PathTerms {
    @Nonnull
    private final String separator;

    public PathTerms(@Nonnull String separator) {
        this.separator = separator;
    }

    @Nonnull
    public String prefix(@Nonnull String path) {
        return path + separator;
    }

    @Nonnull
    public String text(@Nonnull String path, @Nonnull String value) {
        return path + separator + value;
    }

    @Nonnull
    public String bool(@Nonnull String path, boolean value) {
        return text(path, Boolean.toString(value));
    }

    @Nonnull
    public byte[] prefixBytes(@Nonnull String path) {
        return prefix(path).getBytes(StandardCharsets.UTF_8);
    }

    @Nonnull
    public byte[] separatorBytes() {
        return separator.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Compose a byte term from a path and an encoded value.
     *
     * @param path the JSON key
     * @param encoded bytes from {@link org.flatjson.codec.SortableValueCodec}
     * @return {@code UTF-8(path + separator)} followed by the encoded bytes
     */
    @Nonnull
    public byte[] bytes(@Nonnull String path, @Nonnull byte[] encoded) {
        return Bytes.concat(prefixBytes(path), encoded);
    }

    @Nonnull
    public String getSeparator() {
        return separator;
    }
}
