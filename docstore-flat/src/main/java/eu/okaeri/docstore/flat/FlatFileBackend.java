package eu.okaeri.docstore.flat;

import com.google.gson.JsonParseException;
import eu.okaeri.docstore.aggregate.AggregationEngine;
import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.backend.StorageBackend;
import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.config.StorageConfig;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.cursor.InMemoryCursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.exception.StorageIOException;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.FilterMatcher;
import eu.okaeri.docstore.filter.TextScorer;
import eu.okaeri.docstore.filter.Update;
import eu.okaeri.docstore.identity.IdentityNormalizer;
import eu.okaeri.docstore.result.DeleteResult;
import eu.okaeri.docstore.result.UpdateResult;
import lombok.Getter;
import lombok.NonNull;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;
import static eu.okaeri.docstore.document.DocumentValueUtils.toParts;

/**
 * File-based storage backend.
 * <p>
 * Each collection is a single file {@code <storageDir>/<collection><suffix>} holding
 * a JSON array of documents. Every operation reads the whole file, and every
 * mutation rewrites it through a temporary file moved into place. There is no
 * locking: of two concurrent full-snapshot writes the later one wins.
 */
public class FlatFileBackend implements StorageBackend {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.docstore.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(FlatFileBackend.class.getSimpleName());

    private final @Getter Path storageDir;
    private final @Getter String fileSuffix;
    private final FlatFileCodec codec;
    private final FilterMatcher matcher = new FilterMatcher();
    private final AggregationEngine aggregationEngine = new AggregationEngine(this.matcher);
    private final TextScorer textScorer = new TextScorer();
    private final Map<String, DocumentCollection> knownCollections = new ConcurrentHashMap<>();

    private FlatFileBackend(@NonNull Path storageDir, @NonNull String fileSuffix, @NonNull FlatFileCodec codec) {
        this.storageDir = storageDir;
        this.fileSuffix = fileSuffix;
        this.codec = codec;
        try {
            Files.createDirectories(storageDir);
        } catch (IOException exception) {
            throw new StorageIOException("Cannot create storage directory " + storageDir, exception);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FlatFileBackend fromConfig(@NonNull StorageConfig config) {
        return builder()
            .storageDir(Paths.get(config.getStorageDir()))
            .suffix(config.getFileSuffix())
            .build();
    }

    public static class Builder {
        private Path storageDir;
        private String fileSuffix = StorageConfig.DEFAULT_FILE_SUFFIX;
        private FlatFileCodec codec;

        public Builder storageDir(@NonNull File dir) {
            this.storageDir = dir.toPath();
            return this;
        }

        public Builder storageDir(@NonNull Path dir) {
            this.storageDir = dir;
            return this;
        }

        public Builder suffix(@NonNull String suffix) {
            this.fileSuffix = suffix;
            return this;
        }

        public Builder extension(@NonNull String extension) {
            this.fileSuffix = "." + extension;
            return this;
        }

        public Builder codec(@NonNull FlatFileCodec codec) {
            this.codec = codec;
            return this;
        }

        public FlatFileBackend build() {
            if (this.storageDir == null) {
                throw new IllegalStateException("storageDir is required");
            }
            if (this.fileSuffix.isEmpty()) {
                throw new IllegalStateException("suffix cannot be empty");
            }
            FlatFileCodec codec = (this.codec != null) ? this.codec : new FlatFileCodec();
            return new FlatFileBackend(this.storageDir, this.fileSuffix, codec);
        }
    }

    @Override
    public String getName() {
        return "flat-file (" + this.storageDir + ")";
    }

    // ==================== COLLECTION MANAGEMENT ====================

    @Override
    public void registerCollection(@NonNull DocumentCollection collection) {
        this.knownCollections.put(collection.getName(), collection);
        if (DEBUG && !collection.getIndexes().isEmpty()) {
            LOGGER.info("Ignoring " + collection.getIndexes().size() + " native indexes of " + collection.getName());
        }
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public Optional<Document> findOne(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return this.readCollection(collection.getName()).stream()
            .filter(document -> this.matcher.matches(document, filter))
            .findFirst();
    }

    @Override
    public Optional<Document> findByNativeId(@NonNull DocumentCollection collection, @NonNull String nativeId) {
        return this.readCollection(collection.getName()).stream()
            .filter(document -> nativeId.equals(document.getString(IdentityNormalizer.NATIVE_ID_FIELD)))
            .findFirst();
    }

    @Override
    public Cursor find(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        String name = collection.getName();
        return new InMemoryCursor(() -> this.readCollection(name), filter, this.matcher);
    }

    @Override
    public long count(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        return this.readCollection(collection.getName()).stream()
            .filter(document -> this.matcher.matches(document, filter))
            .count();
    }

    @Override
    public Set<Object> distinct(@NonNull DocumentCollection collection, @NonNull String field, @NonNull Filter filter) {
        List<String> parts = toParts(field);
        Set<Object> values = new LinkedHashSet<>();

        for (Document document : this.readCollection(collection.getName())) {
            if (!this.matcher.matches(document, filter)) {
                continue;
            }
            Object value = extractValue(document, parts);
            if (value instanceof List) {
                for (Object element : (List<?>) value) {
                    if (element != null) {
                        values.add(element);
                    }
                }
            } else if (value != null) {
                values.add(value);
            }
        }

        return values;
    }

    @Override
    public Cursor aggregate(@NonNull DocumentCollection collection, @NonNull Pipeline pipeline) {
        String name = collection.getName();
        return new InMemoryCursor(() -> this.aggregationEngine.execute(this.readCollection(name), pipeline), Filter.empty(), this.matcher);
    }

    @Override
    public List<Document> textSearch(@NonNull DocumentCollection collection, @NonNull String term, int limit) {
        return this.textScorer.rank(this.readCollection(collection.getName()), term, limit);
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public void insertOne(@NonNull DocumentCollection collection, @NonNull Document document) {
        List<Document> documents = this.readCollection(collection.getName());
        documents.add(withNativeId(document));
        this.writeCollection(collection.getName(), documents);
    }

    @Override
    public void insertMany(@NonNull DocumentCollection collection, @NonNull List<Document> documents) {
        List<Document> stored = this.readCollection(collection.getName());
        for (Document document : documents) {
            stored.add(withNativeId(document));
        }
        this.writeCollection(collection.getName(), stored);
    }

    @Override
    public UpdateResult updateOne(@NonNull DocumentCollection collection, @NonNull Filter filter, @NonNull Update update) {
        List<Document> documents = this.readCollection(collection.getName());
        for (Document document : documents) {
            if (!this.matcher.matches(document, filter)) {
                continue;
            }
            boolean modified = update.applyTo(document);
            if (modified) {
                this.writeCollection(collection.getName(), documents);
            }
            return new UpdateResult(1, modified ? 1 : 0);
        }
        return UpdateResult.none();
    }

    @Override
    public Optional<Document> findOneAndUpdate(@NonNull DocumentCollection collection, @NonNull Filter filter, @NonNull Update update) {
        List<Document> documents = this.readCollection(collection.getName());
        for (Document document : documents) {
            if (!this.matcher.matches(document, filter)) {
                continue;
            }
            if (update.applyTo(document)) {
                this.writeCollection(collection.getName(), documents);
            }
            return Optional.of(document.deepCopy());
        }
        return Optional.empty();
    }

    // ==================== DELETE OPERATIONS ====================

    @Override
    public DeleteResult deleteOne(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        List<Document> documents = this.readCollection(collection.getName());
        Iterator<Document> iterator = documents.iterator();
        while (iterator.hasNext()) {
            if (this.matcher.matches(iterator.next(), filter)) {
                iterator.remove();
                this.writeCollection(collection.getName(), documents);
                return new DeleteResult(1);
            }
        }
        return new DeleteResult(0);
    }

    @Override
    public DeleteResult deleteMany(@NonNull DocumentCollection collection, @NonNull Filter filter) {
        List<Document> documents = this.readCollection(collection.getName());
        int before = documents.size();
        documents.removeIf(document -> this.matcher.matches(document, filter));

        long deleted = before - documents.size();
        if (deleted > 0) {
            this.writeCollection(collection.getName(), documents);
        }
        return new DeleteResult(deleted);
    }

    // ==================== SNAPSHOT ACCESS ====================

    /**
     * Read the whole collection. A missing file is an empty collection.
     *
     * @return mutable snapshot, detached from the file
     * @throws StorageIOException when the file cannot be read or is not a JSON array of objects
     */
    public List<Document> readCollection(@NonNull String collection) {
        Path file = this.toFile(collection);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }

        String json;
        try {
            json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new StorageIOException("Cannot read collection file " + file, exception);
        }

        try {
            List<Document> documents = this.codec.decode(json);
            if (DEBUG) {
                LOGGER.info("Read " + documents.size() + " documents from " + file);
            }
            return documents;
        } catch (JsonParseException exception) {
            throw new StorageIOException("Malformed collection file " + file, exception);
        }
    }

    /**
     * Replace the whole collection with the given snapshot.
     *
     * @throws StorageIOException when the file cannot be written
     */
    public void writeCollection(@NonNull String collection, @NonNull List<? extends Map<String, ?>> documents) {
        Path file = this.toFile(collection);
        String json = this.codec.encode(documents);

        Path temp = null;
        try {
            Files.createDirectories(this.storageDir);
            temp = Files.createTempFile(this.storageDir, collection + "-", ".tmp");
            Files.write(temp, json.getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException exception) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException exception) {
            throw new StorageIOException("Cannot write collection file " + file, exception);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }

        if (DEBUG) {
            LOGGER.info("Wrote " + documents.size() + " documents to " + file);
        }
    }

    @Override
    public void close() {
        if (DEBUG) {
            LOGGER.info("Closed " + this.getName());
        }
    }

    // ==================== HELPERS ====================

    private Path toFile(String collection) {
        if (collection.isEmpty() || collection.contains("/") || collection.contains("\\") || collection.startsWith(".")) {
            throw new IllegalArgumentException("Illegal collection name for file storage: " + collection);
        }
        return this.storageDir.resolve(collection + this.fileSuffix);
    }

    private static Document withNativeId(Document document) {
        if (document.get(IdentityNormalizer.NATIVE_ID_FIELD) == null) {
            document.put(IdentityNormalizer.NATIVE_ID_FIELD, UUID.randomUUID().toString());
        }
        return document;
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException exception) {
            LOGGER.log(Level.WARNING, "Failed to delete temporary file " + temp, exception);
        }
    }
}
