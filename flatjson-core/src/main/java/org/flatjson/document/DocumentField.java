/*
 * DocumentField.java
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

import org.flatjson.FlatJsonArgumentException;
import org.flatjson.annotation.API;
import org.flatjson.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * One value destined for one physical field, together with the JSON key it came from. String values belong to the
 * text fields and byte values to the binary ones.
 */
@API(API.Status.UNSTABLE)
public final class DocumentField {
    @Nonnull
    private final FieldKind kind;
    @Nonnull
    private final String path;
    @Nonnull
    private final Object value;

    private DocumentField(@Nonnull FieldKind kind, @Nonnull String path, @Nonnull Object value) {
        this.kind = kind;
        this.path = path;
        this.value = value;
    }

    @Nonnull
    public static DocumentField text(@Nonnull FieldKind kind, @Nonnull String path, @Nonnull String value) {
        if (kind.isBinary()) {
            throw wrongValueType("text value for binary field", kind, path);
        }
        return new DocumentField(kind, path, value);
    }

    @Nonnull
    public static DocumentField bytes(@Nonnull FieldKind kind, @Nonnull String path, @Nonnull byte[] value) {
        if (!kind.isBinary()) {
            throw wrongValueType("binary value for text field", kind, path);
        }
        return new DocumentField(kind, path, value.clone());
    }

    @Nonnull
    public FieldKind getKind() {
        return kind;
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    @Nonnull
    public String getTextValue() {
        if (kind.isBinary()) {
            throw wrongValueType("field has a binary value", kind, path);
        }
        return (String) value;
    }

    @Nonnull
    public byte[] getBytesValue() {
        if (!kind.isBinary()) {
            throw wrongValueType("field has a text value", kind, path);
        }
        return ((byte[]) value).clone();
    }

    @Nonnull
    private static FlatJsonArgumentException wrongValueType(@Nonnull String message, @Nonnull FieldKind kind,
                                                            @Nonnull String path) {
        return new FlatJsonArgumentException(message,
                LogMessageKeys.FIELD_NAME, kind.getFieldName(),
                LogMessageKeys.PATH, path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DocumentField that = (DocumentField) o;
        if (kind != that.kind || !path.equals(that.path)) {
            return false;
        }
        if (kind.isBinary()) {
            return Arrays.equals((byte[]) value, (byte[]) that.value);
        }
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, path, kind.isBinary() ? Arrays.hashCode((byte[]) value) : value.hashCode());
    }

    @Override
    public String toString() {
        final String printable;
        if (kind.isBinary()) {
            final byte[] bytes = (byte[]) value;
            final StringBuilder sb = new StringBuilder();
            for (byte b : bytes) {
                if (b >= 0x20 && b < 0x7f) {
                    sb.append((char) b);
                } else {
                    sb.append(String.format("\\x%02x", b & 0xff));
                }
            }
            printable = sb.toString();
        } else {
            printable = (String) value;
        }
        return kind + "(" + path + ")=" + printable;
    }
}
