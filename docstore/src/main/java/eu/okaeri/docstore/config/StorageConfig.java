package eu.okaeri.docstore.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Storage settings shared by both backends.
 * A {@code null} {@link #mongoUri} selects the file backend without probing.
 *
 * @see StorageConfigLoader
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StorageConfig {

    public static final String DEFAULT_DATABASE_NAME = "docstore";
    public static final String DEFAULT_STORAGE_DIR = "data_storage";
    public static final String DEFAULT_FILE_SUFFIX = ".json";

    private String mongoUri;
    @Builder.Default
    private String databaseName = DEFAULT_DATABASE_NAME;

    @Builder.Default
    private String storageDir = DEFAULT_STORAGE_DIR;
    @Builder.Default
    private String fileSuffix = DEFAULT_FILE_SUFFIX;

    @Builder.Default
    private Duration probeTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private int maxPoolSize = 10;
    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(30);
    @Builder.Default
    private Duration socketTimeout = Duration.ofSeconds(30);

    public static StorageConfig defaults() {
        return StorageConfig.builder().build();
    }

    public boolean hasMongoUri() {
        return (this.mongoUri != null) && !this.mongoUri.trim().isEmpty();
    }
}
