package eu.okaeri.docstore.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import eu.okaeri.docstore.exception.StorageIOException;
import lombok.NonNull;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Builds a {@link StorageConfig} from layered sources, lowest precedence first:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>optional JSON file</li>
 *   <li>environment: {@code MONGODB_URL}, {@code DATABASE_NAME}, {@code DOCSTORE_STORAGE_DIR}</li>
 *   <li>system properties {@code okaeri.docstore.*}</li>
 * </ol>
 * The JSON file uses the same keys as the system properties without the prefix, e.g.
 * <pre>{@code
 * {"mongoUri": "mongodb://localhost:27017", "databaseName": "content", "probeTimeoutMs": 5000}
 * }</pre>
 */
public class StorageConfigLoader {

    private static final Logger LOGGER = Logger.getLogger(StorageConfigLoader.class.getSimpleName());
    private static final Gson GSON = new Gson();

    public static final String ENV_MONGODB_URL = "MONGODB_URL";
    public static final String ENV_DATABASE_NAME = "DATABASE_NAME";
    public static final String ENV_STORAGE_DIR = "DOCSTORE_STORAGE_DIR";
    public static final String PROPERTY_PREFIX = "okaeri.docstore.";

    private final Map<String, String> environment;
    private final Properties properties;
    private Path configFile;

    public StorageConfigLoader(@NonNull Map<String, String> environment, @NonNull Properties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    public static StorageConfigLoader system() {
        return new StorageConfigLoader(System.getenv(), System.getProperties());
    }

    public StorageConfigLoader configFile(Path configFile) {
        this.configFile = configFile;
        return this;
    }

    public StorageConfig load() {
        StorageConfig config = StorageConfig.defaults();

        if (this.configFile != null) {
            if (Files.exists(this.configFile)) {
                this.applyFile(config, this.configFile);
            } else {
                LOGGER.info("Config file " + this.configFile + " not found, skipping");
            }
        }

        applyString(this.environment.get(ENV_MONGODB_URL), config::setMongoUri);
        applyString(this.environment.get(ENV_DATABASE_NAME), config::setDatabaseName);
        applyString(this.environment.get(ENV_STORAGE_DIR), config::setStorageDir);

        applyString(this.property("mongoUri"), config::setMongoUri);
        applyString(this.property("databaseName"), config::setDatabaseName);
        applyString(this.property("storageDir"), config::setStorageDir);
        applyString(this.property("fileSuffix"), config::setFileSuffix);
        applyParsed("probeTimeoutMs", this.property("probeTimeoutMs"), StorageConfigLoader::millis, config::setProbeTimeout);
        applyParsed("maxPoolSize", this.property("maxPoolSize"), Integer::parseInt, config::setMaxPoolSize);
        applyParsed("connectTimeoutMs", this.property("connectTimeoutMs"), StorageConfigLoader::millis, config::setConnectTimeout);
        applyParsed("socketTimeoutMs", this.property("socketTimeoutMs"), StorageConfigLoader::millis, config::setSocketTimeout);

        return config;
    }

    private void applyFile(StorageConfig config, Path file) {
        FileSource source;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            source = GSON.fromJson(reader, FileSource.class);
        } catch (IOException exception) {
            throw new StorageIOException("Cannot read config file " + file, exception);
        } catch (JsonParseException exception) {
            throw new StorageIOException("Malformed config file " + file, exception);
        }
        if (source == null) {
            return;
        }

        applyString(source.mongoUri, config::setMongoUri);
        applyString(source.databaseName, config::setDatabaseName);
        applyString(source.storageDir, config::setStorageDir);
        applyString(source.fileSuffix, config::setFileSuffix);
        if (source.probeTimeoutMs != null) config.setProbeTimeout(Duration.ofMillis(source.probeTimeoutMs));
        if (source.maxPoolSize != null) config.setMaxPoolSize(source.maxPoolSize);
        if (source.connectTimeoutMs != null) config.setConnectTimeout(Duration.ofMillis(source.connectTimeoutMs));
        if (source.socketTimeoutMs != null) config.setSocketTimeout(Duration.ofMillis(source.socketTimeoutMs));
    }

    private String property(String key) {
        return this.properties.getProperty(PROPERTY_PREFIX + key);
    }

    private static void applyString(String value, Consumer<String> setter) {
        if ((value != null) && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static <T> void applyParsed(String key, String value, Function<String, T> parser, Consumer<T> setter) {
        if ((value == null) || value.trim().isEmpty()) {
            return;
        }
        try {
            setter.accept(parser.apply(value.trim()));
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + value, exception);
        }
    }

    private static Duration millis(String value) {
        return Duration.ofMillis(Long.parseLong(value));
    }

    private static final class FileSource {
        private String mongoUri;
        private String databaseName;
        private String storageDir;
        private String fileSuffix;
        private Long probeTimeoutMs;
        private Integer maxPoolSize;
        private Long connectTimeoutMs;
        private Long socketTimeoutMs;
    }
}
