package eu.okaeri.docstore.backend;

import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.Update;
import eu.okaeri.docstore.result.DeleteResult;
import eu.okaeri.docstore.result.UpdateResult;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage strategy behind a {@link DocumentStore}.
 * <p>
 * Backends work on raw documents: results may still carry the native
 * {@code _id} and are normalized by the store. Documents handed to a backend
 * are private copies the backend may keep or mutate.
 * <p>
 * Implementations:
 * <ul>
 *   <li>File backend - one JSON array file per collection, evaluated in memory</li>
 *   <li>Network backend - MongoDB through the sync driver</li>
 * </ul>
 */
public interface StorageBackend extends Closeable {

    /**
     * Short backend name, for logging only.
     */
    String getName();

    // ==================== COLLECTION MANAGEMENT ====================

    /**
     * Register collection metadata. Backends with native indexes create them here.
     * Collections are usable without registration.
     *
     * @param collection Collection to be registered
     */
    void registerCollection(DocumentCollection collection);

    // ==================== READ OPERATIONS ====================

    /**
     * Find the first document matching the filter, in storage order.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @return First match, empty otherwise
     */
    Optional<Document> findOne(DocumentCollection collection, Filter filter);

    /**
     * Find a document by its backend-native identifier.
     *
     * @param collection Target collection
     * @param nativeId   String form of the native identifier
     * @return Document if found, empty otherwise
     */
    Optional<Document> findByNativeId(DocumentCollection collection, String nativeId);

    /**
     * Create a deferred query. Nothing is read before {@link Cursor#toList()}.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @return Cursor over matching documents
     */
    Cursor find(DocumentCollection collection, Filter filter);

    /**
     * Count documents matching the filter.
     *
     * @param collection Target collection
     * @param filter     Equality filter, empty for all
     * @return Number of matches
     */
    long count(DocumentCollection collection, Filter filter);

    /**
     * Distinct non-null values of a field among matching documents.
     * Sequence values contribute their elements.
     *
     * @param collection Target collection
     * @param field      Field name, dotted for nested fields
     * @param filter     Equality filter, empty for all
     * @return Distinct values in first-seen order
     */
    Set<Object> distinct(DocumentCollection collection, String field, Filter filter);

    /**
     * Run an aggregation pipeline over the collection.
     *
     * @param collection Target collection
     * @param pipeline   Stages to run
     * @return Cursor over result rows
     */
    Cursor aggregate(DocumentCollection collection, Pipeline pipeline);

    /**
     * Weighted free-text search, best match first.
     *
     * @param collection Target collection
     * @param term       Search term, matched case-insensitively
     * @param limit      Maximum number of results, 0 for all
     * @return Ranked documents
     */
    List<Document> textSearch(DocumentCollection collection, String term, int limit);

    // ==================== WRITE OPERATIONS ====================

    /**
     * Insert a single document.
     *
     * @param collection Target collection
     * @param document   Document to insert, already carrying its external id
     */
    void insertOne(DocumentCollection collection, Document document);

    /**
     * Insert documents in order.
     *
     * @param collection Target collection
     * @param documents  Documents to insert, never empty
     */
    void insertMany(DocumentCollection collection, List<Document> documents);

    /**
     * Update the first document matching the filter.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @param update     Fields to set
     * @return Matched and modified counts, each 0 or 1
     */
    UpdateResult updateOne(DocumentCollection collection, Filter filter, Update update);

    /**
     * Update the first document matching the filter and return it as stored after the update.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @param update     Fields to set
     * @return Updated document, empty when nothing matched
     */
    Optional<Document> findOneAndUpdate(DocumentCollection collection, Filter filter, Update update);

    // ==================== DELETE OPERATIONS ====================

    /**
     * Delete the first document matching the filter.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @return Deleted count, 0 or 1
     */
    DeleteResult deleteOne(DocumentCollection collection, Filter filter);

    /**
     * Delete every document matching the filter. An empty filter deletes all documents.
     *
     * @param collection Target collection
     * @param filter     Equality filter
     * @return Deleted count
     */
    DeleteResult deleteMany(DocumentCollection collection, Filter filter);

    // ==================== LIFECYCLE ====================

    /**
     * Release backend resources. Unchecked, unlike {@link Closeable#close()}.
     */
    @Override
    void close();
}
