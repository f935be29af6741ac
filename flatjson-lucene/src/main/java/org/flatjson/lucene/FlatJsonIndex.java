/*
 * FlatJsonIndex.java
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
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.IOUtils;
import org.flatjson.FlatJsonConfig;
import org.flatjson.annotation.API;
import org.flatjson.document.FieldKind;
import org.flatjson.logging.KeyValueLogMessage;
import org.flatjson.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * A Lucene index of flat JSON objects. Writes go through one {@link IndexWriter} configured with the
 * {@link FlatJsonAnalyzer}; searches see everything added so far, committed or not.
 *
 * <p>
 * Document ids returned by {@link #search(Query, int)} stay valid for {@link #storedRawValues(int)} until the next
 * search or write.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class FlatJsonIndex implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlatJsonIndex.class);

    @Nonnull
    private final Directory directory;
    @Nonnull
    private final FlatJsonAnalyzer analyzer;
    @Nonnull
    private final IndexWriter writer;
    @Nonnull
    private final SearcherManager searcherManager;
    @Nonnull
    private final FlatJsonDocumentBuilder documentBuilder;
    @Nonnull
    private final FlatJsonQueryBuilder queryBuilder;

    private FlatJsonIndex(@Nonnull Directory directory, @Nonnull FlatJsonAnalyzer analyzer, @Nonnull IndexWriter writer,
                          @Nonnull SearcherManager searcherManager, @Nonnull FlatJsonConfig config) {
        this.directory = directory;
        this.analyzer = analyzer;
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.documentBuilder = new FlatJsonDocumentBuilder(config);
        this.queryBuilder = new FlatJsonQueryBuilder(config);
    }

    /**
     * Take ownership of a directory and start writing to it. Everything opened so far, the directory included, is
     * closed if any step fails.
     */
    @Nonnull
    @SuppressWarnings("PMD.CloseResource")
    private static FlatJsonIndex create(@Nonnull Directory directory, @Nonnull FlatJsonConfig config) throws IOException {
        FlatJsonAnalyzer analyzer = null;
        IndexWriter writer = null;
        try {
            analyzer = new FlatJsonAnalyzer(config);
            final IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            writer = new IndexWriter(directory, writerConfig);
            final SearcherManager searcherManager = new SearcherManager(writer, null);
            return new FlatJsonIndex(directory, analyzer, writer, searcherManager, config);
        } catch (IOException | RuntimeException ex) {
            IOUtils.closeWhileHandlingException(writer, analyzer, directory);
            throw ex;
        }
    }

    /**
     * Open the index stored in a directory, creating the directory and an empty index if needed.
     *
     * @param path index directory
     * @param config configuration the index was, or will be, written with
     * @return the open index
     * @throws IOException if the directory cannot be created or opened
     */
    @Nonnull
    public static FlatJsonIndex open(@Nonnull Path path, @Nonnull FlatJsonConfig config) throws IOException {
        boolean existing = false;
        if (Files.isDirectory(path)) {
            try (Directory probe = FSDirectory.open(path)) {
                existing = DirectoryReader.indexExists(probe);
            }
        } else {
            Files.createDirectories(path);
        }
        final FlatJsonIndex index = create(FSDirectory.open(path), config);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of(existing ? "opened existing flat json index" : "created flat json index",
                    LogMessageKeys.DIRECTORY, path,
                    LogMessageKeys.EXISTING, existing));
        }
        return index;
    }

    @Nonnull
    public static FlatJsonIndex inMemory(@Nonnull FlatJsonConfig config) throws IOException {
        return create(new ByteBuffersDirectory(), config);
    }

    public void add(@Nonnull JsonObject object) throws IOException {
        final Document document = documentBuilder.process(object);
        writer.addDocument(document);
    }

    public long commit() throws IOException {
        return writer.commit();
    }

    public void deleteAll() throws IOException {
        writer.deleteAll();
    }

    @Nonnull
    public TopDocs search(@Nonnull Query query, int n) throws IOException {
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.search(query, n);
        } finally {
            searcherManager.release(searcher);
        }
    }

    public int count(@Nonnull Query query) throws IOException {
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(query);
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Get the stored {@code text_raw} values of a hit, such as {@code "user_name__Alice Smith"}.
     *
     * @param docId a document id from the latest {@link #search(Query, int)}
     * @return the stored values in the order they were added
     * @throws IOException if the stored fields cannot be read
     */
    @Nonnull
    public List<String> storedRawValues(int docId) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return Arrays.asList(searcher.doc(docId).getValues(FieldKind.TEXT_RAW.getFieldName()));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Nonnull
    public FlatJsonQueryBuilder getQueryBuilder() {
        return queryBuilder;
    }

    @Override
    public void close() throws IOException {
        IOUtils.close(searcherManager, writer, analyzer, directory);
    }
}
