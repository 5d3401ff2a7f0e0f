package eu.okaeri.docstore.backend;

import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.cursor.MappedCursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.exception.NotConnectedException;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.Update;
import eu.okaeri.docstore.identity.IdentityNormalizer;
import eu.okaeri.docstore.result.DeleteResult;
import eu.okaeri.docstore.result.InsertManyResult;
import eu.okaeri.docstore.result.InsertResult;
import eu.okaeri.docstore.result.UpdateResult;
import lombok.NonNull;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Uniform document-collection access over a selected {@link StorageBackend}.
 * <p>
 * The backend is chosen once, by {@link #open()}. Every operation fails with
 * {@link NotConnectedException} before {@code open()} and after {@link #close()}.
 * Documents passed in are copied, never mutated; documents returned carry the
 * external {@code id} and never the native {@code _id}.
 * <pre>{@code
 * DocumentStore store = new DocumentStore(selector);
 * store.open();
 * store.registerCollection(DocumentCollection.of("countries").sequenceFields("visa_types"));
 * List<Document> page = store.find("countries", Filter.eq("published", true))
 *     .sort("name", SortDirection.ASC)
 *     .skip(20)
 *     .limit(10)
 *     .toList();
 * }</pre>
 */
public class DocumentStore implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(DocumentStore.class.getSimpleName());

    public static final int DEFAULT_TEXT_SEARCH_LIMIT = 20;

    private final BackendSelector selector;
    private final IdentityNormalizer normalizer;
    private final Map<String, DocumentCollection> collections = new ConcurrentHashMap<>();

    private volatile StorageBackend backend;
    private volatile boolean closed;

    public DocumentStore(@NonNull BackendSelector selector) {
        this(selector, new IdentityNormalizer());
    }

    public DocumentStore(@NonNull BackendSelector selector, @NonNull IdentityNormalizer normalizer) {
        this.selector = selector;
        this.normalizer = normalizer;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Select and connect the backend. Calling it again on an open store does nothing.
     *
     * @throws IllegalStateException when the store was already closed
     */
    public synchronized void open() {
        if (this.closed) {
            throw new IllegalStateException("DocumentStore was closed and cannot be reopened");
        }
        if (this.backend != null) {
            return;
        }

        StorageBackend selected = this.selector.select();
        this.collections.values().forEach(selected::registerCollection);
        this.backend = selected;
        LOGGER.info("DocumentStore opened with " + selected.getName());
    }

    public boolean isOpen() {
        return (this.backend != null) && !this.closed;
    }

    /**
     * Name of the selected backend, for logging only.
     */
    public String getBackendName() {
        return this.backend().getName();
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        StorageBackend current = this.backend;
        this.backend = null;
        if (current != null) {
            current.close();
            LOGGER.info("DocumentStore closed (" + current.getName() + ")");
        }
    }

    // ==================== COLLECTION MANAGEMENT ====================

    /**
     * Register collection metadata: sequence fields defaulted on read, slug field, native indexes.
     * May be called before {@link #open()}; the backend receives it once selected.
     */
    public void registerCollection(@NonNull DocumentCollection collection) {
        this.collections.put(collection.getName(), collection);
        StorageBackend current = this.backend;
        if ((current != null) && !this.closed) {
            current.registerCollection(collection);
        }
    }

    public DocumentCollection getCollection(@NonNull String name) {
        return this.collections.getOrDefault(name, DocumentCollection.of(name));
    }

    // ==================== READ OPERATIONS ====================

    public Optional<Document> findOne(@NonNull String collection, @NonNull Filter filter) {
        DocumentCollection target = this.getCollection(collection);
        return this.backend().findOne(target, filter).map(document -> this.normalizer.normalize(document, target));
    }

    /**
     * Find by identifier, trying the external {@code id}, then the slug, then the native identifier.
     */
    public Optional<Document> findById(@NonNull String collection, @NonNull String id) {
        DocumentCollection target = this.getCollection(collection);
        StorageBackend current = this.backend();

        Optional<Document> found = current.findOne(target, Filter.eq(IdentityNormalizer.ID_FIELD, id));
        if (!found.isPresent() && target.hasSlugField()) {
            found = current.findOne(target, Filter.eq(target.getSlugField(), id));
        }
        if (!found.isPresent()) {
            found = current.findByNativeId(target, id);
        }

        return found.map(document -> this.normalizer.normalize(document, target));
    }

    public Cursor find(@NonNull String collection, @NonNull Filter filter) {
        DocumentCollection target = this.getCollection(collection);
        return new MappedCursor(this.backend().find(target, filter), document -> this.normalizer.normalize(document, target));
    }

    public Cursor find(@NonNull String collection, @NonNull Filter filter, int skip, int limit, Sort sort) {
        return this.find(collection, filter).skip(skip).limit(limit).sort(sort);
    }

    public long countDocuments(@NonNull String collection) {
        return this.countDocuments(collection, Filter.empty());
    }

    public long countDocuments(@NonNull String collection, @NonNull Filter filter) {
        return this.backend().count(this.getCollection(collection), filter);
    }

    public Set<Object> distinct(@NonNull String collection, @NonNull String field) {
        return this.distinct(collection, field, Filter.empty());
    }

    public Set<Object> distinct(@NonNull String collection, @NonNull String field, @NonNull Filter filter) {
        return Collections.unmodifiableSet(this.backend().distinct(this.getCollection(collection), field, filter));
    }

    /**
     * Run an aggregation pipeline. Result rows have their group key under {@code id}.
     */
    public Cursor aggregate(@NonNull String collection, @NonNull Pipeline pipeline) {
        return new MappedCursor(this.backend().aggregate(this.getCollection(collection), pipeline), this.normalizer::normalizeRow);
    }

    public List<Document> textSearch(@NonNull String collection, @NonNull String term) {
        return this.textSearch(collection, term, DEFAULT_TEXT_SEARCH_LIMIT);
    }

    /**
     * Free-text search ranked by where the term occurs: name, then summary, then region.
     */
    public List<Document> textSearch(@NonNull String collection, @NonNull String term, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
        DocumentCollection target = this.getCollection(collection);
        return this.backend().textSearch(target, term, limit).stream()
            .map(document -> this.normalizer.normalize(document, target))
            .collect(Collectors.toList());
    }

    // ==================== WRITE OPERATIONS ====================

    public InsertResult insertOne(@NonNull String collection, @NonNull Map<String, ?> document) {
        DocumentCollection target = this.getCollection(collection);
        StorageBackend current = this.backend();

        Document copy = new Document(document).deepCopy();
        String id = this.normalizer.assignId(copy, target);
        current.insertOne(target, copy);
        return new InsertResult(id);
    }

    public InsertManyResult insertMany(@NonNull String collection, @NonNull List<? extends Map<String, ?>> documents) {
        DocumentCollection target = this.getCollection(collection);
        StorageBackend current = this.backend();
        if (documents.isEmpty()) {
            return new InsertManyResult(Collections.emptyList());
        }

        List<Document> copies = new ArrayList<>(documents.size());
        List<String> ids = new ArrayList<>(documents.size());
        for (Map<String, ?> document : documents) {
            Document copy = new Document(document).deepCopy();
            ids.add(this.normalizer.assignId(copy, target));
            copies.add(copy);
        }

        current.insertMany(target, copies);
        return new InsertManyResult(Collections.unmodifiableList(ids));
    }

    public UpdateResult updateOne(@NonNull String collection, @NonNull Filter filter, @NonNull Update update) {
        return this.backend().updateOne(this.getCollection(collection), filter, update);
    }

    /**
     * Update the first match and return it as it reads after the update.
     */
    public Optional<Document> findOneAndUpdate(@NonNull String collection, @NonNull Filter filter, @NonNull Update update) {
        DocumentCollection target = this.getCollection(collection);
        return this.backend().findOneAndUpdate(target, filter, update).map(document -> this.normalizer.normalize(document, target));
    }

    /**
     * Replace every document matching the parent filter with a new set.
     * Not atomic: readers may observe the collection between the delete and the insert.
     */
    public InsertManyResult replaceAll(@NonNull String collection, @NonNull Filter parentFilter, @NonNull List<? extends Map<String, ?>> documents) {
        DeleteResult deleted = this.deleteMany(collection, parentFilter);
        InsertManyResult inserted = this.insertMany(collection, documents);
        LOGGER.fine("Replaced " + deleted.getDeletedCount() + " documents in " + collection + " with " + inserted.getInsertedCount());
        return inserted;
    }

    // ==================== DELETE OPERATIONS ====================

    public DeleteResult deleteOne(@NonNull String collection, @NonNull Filter filter) {
        return this.backend().deleteOne(this.getCollection(collection), filter);
    }

    public DeleteResult deleteMany(@NonNull String collection, @NonNull Filter filter) {
        return this.backend().deleteMany(this.getCollection(collection), filter);
    }

    private StorageBackend backend() {
        StorageBackend current = this.backend;
        if ((current == null) || this.closed) {
            throw new NotConnectedException(this.closed
                ? "DocumentStore is closed"
                : "DocumentStore is not open, call open() first");
        }
        return current;
    }
}
