/*
 * FlatJsonFieldRouter.java
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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.flatjson.FlatJsonConfig;
import org.flatjson.PathTerms;
import org.flatjson.annotation.API;
import org.flatjson.codec.SortableValueCodec;
import org.flatjson.date.FlatJsonDateParser;
import org.flatjson.logging.KeyValueLogMessage;
import org.flatjson.logging.LogMessageKeys;
import org.flatjson.text.PathPrefixSplitter;
import org.flatjson.text.TextClassifier;
import org.flatjson.text.TextType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes the values of a flat JSON object to the physical fields they are indexed in.
 *
 * <ul>
 *     <li>Strings that parse as dates go to {@link FieldKind#DATE}.</li>
 *     <li>Identifiers and keywords go to {@link FieldKind#TEXT_RAW} only.</li>
 *     <li>Free text goes to {@link FieldKind#TEXT_RAW} verbatim, to {@link FieldKind#TEXT_ANALYZED} as split word
 *     tokens, and to {@link FieldKind#TEXT_NGRAM} verbatim.</li>
 *     <li>Numbers go to {@link FieldKind#NUMBER} as doubles.</li>
 *     <li>Booleans go to {@link FieldKind#TEXT_RAW} as {@code true} or {@code false}.</li>
 *     <li>Array elements are routed one by one under the array's key.</li>
 *     <li>Nulls and nested objects are skipped.</li>
 * </ul>
 */
@API(API.Status.UNSTABLE)
public class FlatJsonFieldRouter {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlatJsonFieldRouter.class);

    @Nonnull
    private final PathTerms pathTerms;
    @Nonnull
    private final TextClassifier classifier;
    @Nonnull
    private final PathPrefixSplitter splitter;

    public FlatJsonFieldRouter(@Nonnull FlatJsonConfig config) {
        this.pathTerms = config.getPathTerms();
        this.classifier = new TextClassifier(config.getClassificationRules());
        this.splitter = new PathPrefixSplitter(config.getPathSeparator());
    }

    @Nonnull
    public List<DocumentField> route(@Nonnull JsonObject object) {
        final List<DocumentField> fields = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            addValue(entry.getKey(), entry.getValue(), fields);
        }
        return fields;
    }

    private void addValue(@Nonnull String path, @Nonnull JsonElement element, @Nonnull List<DocumentField> fields) {
        if (element.isJsonArray()) {
            final JsonArray array = element.getAsJsonArray();
            for (JsonElement item : array) {
                addValue(path, item, fields);
            }
        } else if (element.isJsonPrimitive()) {
            addPrimitive(path, element.getAsJsonPrimitive(), fields);
        } else {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("skipping unsupported json value",
                        LogMessageKeys.PATH, path,
                        LogMessageKeys.JSON_TYPE, element.isJsonNull() ? "null" : "object"));
            }
        }
    }

    private void addPrimitive(@Nonnull String path, @Nonnull JsonPrimitive primitive, @Nonnull List<DocumentField> fields) {
        if (primitive.isBoolean()) {
            fields.add(DocumentField.text(FieldKind.TEXT_RAW, path, pathTerms.bool(path, primitive.getAsBoolean())));
        } else if (primitive.isNumber()) {
            final byte[] encoded = SortableValueCodec.encodeDouble(primitive.getAsDouble());
            fields.add(DocumentField.bytes(FieldKind.NUMBER, path, pathTerms.bytes(path, encoded)));
        } else {
            addString(path, primitive.getAsString(), fields);
        }
    }

    private void addString(@Nonnull String path, @Nonnull String value, @Nonnull List<DocumentField> fields) {
        final Optional<Instant> date = FlatJsonDateParser.tryParse(value);
        if (date.isPresent()) {
            final byte[] encoded = SortableValueCodec.encodeInstant(date.get());
            fields.add(DocumentField.bytes(FieldKind.DATE, path, pathTerms.bytes(path, encoded)));
            return;
        }
        final String term = pathTerms.text(path, value);
        fields.add(DocumentField.text(FieldKind.TEXT_RAW, path, term));
        if (classifier.classify(value) == TextType.ANALYZED_TEXT) {
            for (String token : splitter.split(term).getTokens()) {
                fields.add(DocumentField.text(FieldKind.TEXT_ANALYZED, path, token));
            }
            fields.add(DocumentField.text(FieldKind.TEXT_NGRAM, path, term));
        }
    }
}
