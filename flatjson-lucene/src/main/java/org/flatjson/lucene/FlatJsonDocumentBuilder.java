/*
 * FlatJsonDocumentBuilder.java
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

package org.flatjson.lucene;

import com.google.gson.JsonObject;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.FieldType;
import org.apache.lucene.util.BytesRef;
import org.flatjson.FlatJsonConfig;
import org.flatjson.annotation.API;
import org.flatjson.document.DocumentField;
import org.flatjson.document.FieldKind;
import org.flatjson.document.FlatJsonFieldRouter;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Turns flat JSON objects into Lucene documents over the five physical fields.
 */
@API(API.Status.UNSTABLE)
public class FlatJsonDocumentBuilder {
    @Nonnull
    private final FlatJsonFieldRouter router;

    public FlatJsonDocumentBuilder(@Nonnull FlatJsonConfig config) {
        this.router = new FlatJsonFieldRouter(config);
    }

    @Nonnull
    public Document process(@Nonnull JsonObject object) {
        final Document document = new Document();
        for (DocumentField field : router.route(object)) {
            insertField(field, document);
        }
        return document;
    }

    /**
     * Get the fields an object would be indexed with, without building a document.
     * @param object a flat JSON object
     * @return the routed fields in key order
     */
    @Nonnull
    public List<DocumentField> getFields(@Nonnull JsonObject object) {
        return router.route(object);
    }

    static void insertField(@Nonnull DocumentField field, @Nonnull Document document) {
        final FieldKind kind = field.getKind();
        final FieldType fieldType = FlatJsonFieldTypes.forKind(kind);
        if (kind.isBinary()) {
            document.add(new Field(kind.getFieldName(), new BytesRef(field.getBytesValue()), fieldType));
        } else {
            document.add(new Field(kind.getFieldName(), field.getTextValue(), fieldType));
        }
    }
}
