/*
 * FlatJsonDocumentBuilderTest.java
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
import com.google.gson.JsonParser;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.util.BytesRef;
import org.flatjson.FlatJsonConfig;
import org.flatjson.PathTerms;
import org.flatjson.codec.SortableValueCodec;
import org.flatjson.document.FieldKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class FlatJsonDocumentBuilderTest {
    private final FlatJsonDocumentBuilder builder = new FlatJsonDocumentBuilder(FlatJsonConfig.defaultConfig());
    private final PathTerms terms = FlatJsonConfig.defaultConfig().getPathTerms();

    @Test
    void fieldsPerKind() {
        Document document = builder.process(json("{\"user_name\": \"Alice Smith\", \"user_age\": 28, \"user_active\": true, "
                                                 + "\"user_email\": \"alice@example.com\", \"user_created\": \"2024-01-15T10:30:00Z\"}"));

        Assertions.assertArrayEquals(new String[] {"user_name__Alice Smith", "user_active__true", "user_email__alice@example.com"},
                document.getValues(FieldKind.TEXT_RAW.getFieldName()));
        Assertions.assertArrayEquals(new String[] {"user_name__alice", "user_name__smith"},
                document.getValues(FieldKind.TEXT_ANALYZED.getFieldName()));
        IndexableField ngram = document.getField(FieldKind.TEXT_NGRAM.getFieldName());
        Assertions.assertEquals("user_name__Alice Smith", ngram.stringValue());
        Assertions.assertFalse(ngram.fieldType().stored());
        Assertions.assertEquals(1, document.getFields(FieldKind.TEXT_NGRAM.getFieldName()).length);

        IndexableField number = document.getField(FieldKind.NUMBER.getFieldName());
        Assertions.assertEquals(new BytesRef(terms.bytes("user_age", SortableValueCodec.encodeDouble(28))), number.binaryValue());
        Assertions.assertFalse(number.fieldType().stored());

        IndexableField date = document.getField(FieldKind.DATE.getFieldName());
        BytesRef dateTerm = date.binaryValue();
        Assertions.assertEquals("user_created__".length() + SortableValueCodec.ENCODED_LENGTH, dateTerm.length);
        Assertions.assertEquals(1_705_314_600_000_000L,
                SortableValueCodec.decodeTimestampMicros(BytesRef.deepCopyOf(dateTerm).bytes, "user_created__".length()));
    }

    @Test
    void fieldTypes() {
        Assertions.assertEquals(IndexOptions.DOCS, FlatJsonFieldTypes.forKind(FieldKind.TEXT_ANALYZED).indexOptions());
        Assertions.assertTrue(FlatJsonFieldTypes.forKind(FieldKind.TEXT_ANALYZED).stored());
        Assertions.assertTrue(FlatJsonFieldTypes.forKind(FieldKind.TEXT_NGRAM).tokenized());
        Assertions.assertFalse(FlatJsonFieldTypes.forKind(FieldKind.TEXT_NGRAM).stored());
        Assertions.assertTrue(FlatJsonFieldTypes.forKind(FieldKind.TEXT_RAW).stored());
        Assertions.assertFalse(FlatJsonFieldTypes.forKind(FieldKind.TEXT_RAW).tokenized());
        Assertions.assertSame(FlatJsonFieldTypes.BINARY, FlatJsonFieldTypes.forKind(FieldKind.DATE));
        Assertions.assertTrue(FlatJsonFieldTypes.TEXT_NGRAM.omitNorms());
    }

    @Test
    void everyFieldUsesItsDeclaredType() {
        Document document = builder.process(json("{\"title\": \"Rust Search\", \"sku\": \"WH001234\", \"price\": 19.99, "
                                                 + "\"active\": false, \"released\": \"2020-08-15\"}"));
        for (FieldKind kind : FieldKind.values()) {
            IndexableField[] fields = document.getFields(kind.getFieldName());
            Assertions.assertTrue(fields.length > 0, kind.getFieldName());
            for (IndexableField field : fields) {
                Assertions.assertSame(FlatJsonFieldTypes.forKind(kind), field.fieldType(), kind.getFieldName());
            }
        }
    }

    @Test
    void eachCallBuildsAFreshDocument() {
        JsonObject object = json("{\"tags\": [\"rust\", \"search\"]}");
        Document first = builder.process(object);
        Document second = builder.process(object);
        Assertions.assertNotSame(first, second);
        Assertions.assertArrayEquals(first.getValues("text_raw"), second.getValues("text_raw"));
        Assertions.assertEquals(List.of("tags", "tags"), List.of(builder.getFields(object).get(0).getPath(), builder.getFields(object).get(1).getPath()));
    }

    @Test
    void unsupportedValuesProduceEmptyDocument() {
        Assertions.assertTrue(builder.process(json("{\"a\": null, \"b\": {\"c\": 1}}")).getFields().isEmpty());
    }

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }
}
