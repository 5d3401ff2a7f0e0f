package eu.okaeri.docstore.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.backend.BackendFactory;
import eu.okaeri.docstore.backend.StorageBackend;
import eu.okaeri.docstore.collection.CollectionIndex;
import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.config.StorageConfig;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.TextScorer;
import eu.okaeri.docstore.filter.Update;
import eu.okaeri.docstore.identity.IdentityNormalizer;
import eu.okaeri.docstore.mongo.filter.MongoFilterRenderer;
import eu.okaeri.docstore.mongo.filter.MongoPipelineRenderer;
import eu.okaeri.docstore.mongo.filter.MongoUpdateRenderer;
import eu.okaeri.docstore.result.DeleteResult;
import eu.okaeri.docstore.result.UpdateResult;
import lombok.Getter;
import lombok.NonNull;
import org.bson.BsonValue;
import org.bson.UuidRepresentation;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * MongoDB storage backend on the sync driver.
 * <p>
 * Filters, updates and pipelines are rendered to native queries and run
 * server-side. Free-text search fetches regex candidates and ranks them
 * with the same weights as the file backend.
 */
public class MongoBackend implements StorageBackend {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.docstore.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(MongoBackend.class.getSimpleName());
    private static final FindOneAndUpdateOptions RETURN_AFTER = new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER);

    private final MongoFilterRenderer filterRenderer = new MongoFilterRenderer();
    private final MongoUpdateRenderer updateRenderer = new MongoUpdateRenderer();
    private final MongoPipelineRenderer pipelineRenderer = new MongoPipelineRenderer(this.filterRenderer);
    private final TextScorer textScorer = new TextScorer();

    private final @Getter MongoClient client;
    private final @Getter MongoDatabase database;
    private final boolean ownsClient;
    private final Map<String, DocumentCollection> knownCollections = new ConcurrentHashMap<>();

    private MongoBackend(@NonNull MongoClient client, @NonNull String databaseName, boolean ownsClient) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
        this.ownsClient = ownsClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MongoClient client;
        private String databaseName;
        private boolean ownsClient;

        public Builder client(@NonNull MongoClient client) {
            this.client = client;
            return this;
        }

        public Builder databaseName(@NonNull String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * Close the client together with the backend.
         */
        public Builder ownsClient(boolean ownsClient) {
            this.ownsClient = ownsClient;
            return this;
        }

        public MongoBackend build() {
            if (this.client == null) {
                throw new IllegalStateException("client is required");
            }
            if (this.databaseName == null) {
                throw new IllegalStateException("databaseName is required");
            }
            return new MongoBackend(this.client, this.databaseName, this.ownsClient);
        }
    }

    /**
     * Create a client from the config and check it answers a ping.
     * The client is closed again when the ping fails.
     *
     * @throws IllegalStateException when the config has no connection string
     */
    public static MongoBackend connect(@NonNull StorageConfig config) {
        return connect(config, config.getProbeTimeout());
    }

    /**
     * Same as {@link #connect(StorageConfig)}, waiting at most {@code budget}
     * for a server when it is shorter than the configured probe timeout.
     */
    public static MongoBackend connect(@NonNull StorageConfig config, @NonNull Duration budget) {
        if (!config.hasMongoUri()) {
            throw new IllegalStateException("mongoUri is required");
        }

        MongoClient client = MongoClients.create(settings(config, budget));
        MongoBackend backend = builder()
            .client(client)
            .databaseName(config.getDatabaseName())
            .ownsClient(true)
            .build();

        try {
            backend.ping();
        } catch (RuntimeException exception) {
            client.close();
            throw exception;
        }
        return backend;
    }

    /**
     * Primary backend factory for a {@link eu.okaeri.docstore.backend.BackendSelector},
     * or null when no connection string is configured.
     */
    public static BackendFactory factory(@NonNull StorageConfig config) {
        if (!config.hasMongoUri()) {
            return null;
        }
        return new BackendFactory() {
            @Override
            public StorageBackend create() {
                return connect(config);
            }

            @Override
            public StorageBackend create(@NonNull Duration budget) {
                return connect(config, budget);
            }
        };
    }

    static MongoClientSettings settings(@NonNull StorageConfig config) {
        return settings(config, config.getProbeTimeout());
    }

    static MongoClientSettings settings(@NonNull StorageConfig config, @NonNull Duration budget) {
        // serverSelectionTimeout 0 fails without waiting, keep at least 1ms
        long selectionMillis = Math.max(1, Math.min(config.getProbeTimeout().toMillis(), budget.toMillis()));
        return MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(config.getMongoUri()))
            .applyToConnectionPoolSettings(pool -> pool.maxSize(config.getMaxPoolSize()))
            .applyToSocketSettings(socket -> socket
                .connectTimeout((int) config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout((int) config.getSocketTimeout().toMillis(), TimeUnit.MILLISECONDS))
            .applyToClusterSettings(cluster -> cluster
                .serverSelectionTimeout(selectionMillis, TimeUnit.MILLISECONDS))
            .uuidRepresentation(UuidRepresentation.STANDARD)
            .build();
    }

    /**
     * @throws com.mongodb.MongoException when the server does not answer
     */
    public void ping() {
        this.database.runCommand(new org.bson.Document("ping", 1));
    }

    @Override
    public String getName() {
        return "mongodb (" + this.database.getName() + ")";
    }

    // ==================== COLLECTION MANAGEMENT ====================

    @Override
    public void registerCollection(@NonNull DocumentCollection collection) {
        this.knownCollections.computeIfAbsent(collection.getName(), key -> {
            // Create native indexes (only once per collection)
            if (!collection.getIndexes().isEmpty()) {
                List<IndexModel> indexModels = collection.getIndexes().stream()
                    .map(MongoBackend::toIndexModel)
                    .collect(Collectors.toList());
                this.mongo(collection).createIndexes(indexModels);
            }
            return collection;
        });
    }

    private static IndexModel toIndexModel(CollectionIndex index) {
        if (index.isText()) {
            Bson keys = Indexes.compoundIndex(index.getFields().stream()
                .map(Indexes::text)
                .collect(Collectors.toList()));
            return new IndexModel(keys);
        }
        return new IndexModel(Indexes.ascending(index.getFields()), new IndexOptions().unique(index.isUnique()));
    }

    private MongoCollection<org.bson.Document> mongo(@NonNull DocumentCollection collection) {
        return this.database.getCollection(collection.getName());
    }

    private Bson debugQuery(@NonNull String operation, @NonNull Bson query) {
        if (DEBUG) {
            LOGGER.info("[MongoDB] " + operation + " " + query.toBsonDocument().toJson());
        }
        return query;
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public Optional<Document> findOne(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        org.bson.Document result = this.mongo(collection)
            .find(this.debugQuery("findOne", this.filterRenderer.render(filter)))
            .first();
        return Optional.ofNullable(result).map(MongoDocuments::fromBson);
    }

    @Override
    public Optional<Document> findByNativeId(@NonNull DocumentCollection collection, @NonNull String nativeId) {
        Bson filter = ObjectId.isValid(nativeId)
            ? Filters.or(Filters.eq(IdentityNormalizer.NATIVE_ID_FIELD, new ObjectId(nativeId)), Filters.eq(IdentityNormalizer.NATIVE_ID_FIELD, nativeId))
            : Filters.eq(IdentityNormalizer.NATIVE_ID_FIELD, nativeId);
        org.bson.Document result = this.mongo(collection).find(this.debugQuery("findByNativeId", filter)).first();
        return Optional.ofNullable(result).map(MongoDocuments::fromBson);
    }

    @Override
    public Cursor find(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return new MongoFindCursor(this.mongo(collection), this.debugQuery("find", this.filterRenderer.render(filter)));
    }

    @Override
    public long count(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return this.mongo(collection).countDocuments(this.debugQuery("count", this.filterRenderer.render(filter)));
    }

    @Override
    public Set<Object> distinct(@NonNull DocumentCollection collection, @NonNull String field, @NonNull Filter filter) {
        Set<Object> values = new LinkedHashSet<>();
        for (BsonValue value : this.mongo(collection).distinct(field, this.debugQuery("distinct", this.filterRenderer.render(filter)), BsonValue.class)) {
            Object decoded = MongoDocuments.fromBsonValue(value);
            if (decoded != null) {
                values.add(decoded);
            }
        }
        return values;
    }

    @Override
    public Cursor aggregate(@NonNull DocumentCollection collection, @NonNull Pipeline pipeline) {
        if (DEBUG) {
            this.pipelineRenderer.render(pipeline).forEach(stage -> this.debugQuery("aggregate", stage));
        }
        return new MongoAggregateCursor(this.mongo(collection), pipeline, this.pipelineRenderer);
    }

    @Override
    public List<Document> textSearch(@NonNull DocumentCollection collection, @NonNull String term, int limit) {
        Bson filter = this.filterRenderer.renderText(this.textScorer.getFields(), term);
        List<Document> candidates = this.mongo(collection)
            .find(this.debugQuery("textSearch", filter))
            .map(MongoDocuments::fromBson)
            .into(new ArrayList<>());
        return this.textScorer.rank(candidates, term, limit);
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public void insertOne(@NonNull DocumentCollection collection, @NonNull Document document) {
        this.mongo(collection).insertOne(MongoDocuments.toBson(document));
    }

    @Override
    public void insertMany(@NonNull DocumentCollection collection, @NonNull List<Document> documents) {
        List<org.bson.Document> converted = documents.stream()
            .map(MongoDocuments::toBson)
            .collect(Collectors.toList());
        this.mongo(collection).insertMany(converted);
    }

    @Override
    public UpdateResult updateOne(@NonNull DocumentCollection collection, @NonNull Filter filter, @NonNull Update update) {
        com.mongodb.client.result.UpdateResult result = this.mongo(collection).updateOne(
            this.debugQuery("updateOne", this.filterRenderer.render(filter)),
            this.debugQuery("updateOne", this.updateRenderer.render(update)));
        return new UpdateResult(result.getMatchedCount(), result.getModifiedCount());
    }

    @Override
    public Optional<Document> findOneAndUpdate(@NonNull DocumentCollection collection, @NonNull Filter filter, @NonNull Update update) {
        org.bson.Document result = this.mongo(collection).findOneAndUpdate(
            this.debugQuery("findOneAndUpdate", this.filterRenderer.render(filter)),
            this.debugQuery("findOneAndUpdate", this.updateRenderer.render(update)),
            RETURN_AFTER);
        return Optional.ofNullable(result).map(MongoDocuments::fromBson);
    }

    // ==================== DELETE OPERATIONS ====================

    @Override
    public DeleteResult deleteOne(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return new DeleteResult(this.mongo(collection)
            .deleteOne(this.debugQuery("deleteOne", this.filterRenderer.render(filter)))
            .getDeletedCount());
    }

    @Override
    public DeleteResult deleteMany(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return new DeleteResult(this.mongo(collection)
            .deleteMany(this.debugQuery("deleteMany", this.filterRenderer.render(filter)))
            .getDeletedCount());
    }

    @Override
    public void close() {
        if (this.ownsClient) {
            this.client.close();
        }
    }
}
