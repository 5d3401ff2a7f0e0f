package eu.okaeri.docstoretest.containers;

import com.mongodb.client.MongoClients;
import eu.okaeri.docstore.backend.BackendSelector;
import eu.okaeri.docstore.backend.DocumentStore;
import eu.okaeri.docstore.mongo.MongoBackend;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * MongoDB backend container using testcontainers.
 * The container starts on first use and is shared by all tests.
 */
public class MongoBackendContainer implements BackendContainer {

    public static final String DATABASE_NAME = "okaeri_docstore";

    private static final class Holder {

        private static final MongoDBContainer MONGO;

        static {
            MONGO = new MongoDBContainer(DockerImageName.parse("mongo:7"))
                .withReuse(true);

            MONGO.start();
        }
    }

    public static String getConnectionString() {
        return Holder.MONGO.getConnectionString();
    }

    @Override
    public String getName() {
        return "MongoDB 7";
    }

    public MongoBackend.Builder createBackendBuilder() {
        return MongoBackend.builder()
            .client(MongoClients.create(getConnectionString()))
            .databaseName(DATABASE_NAME)
            .ownsClient(true);
    }

    @Override
    public DocumentStore createStore() {
        return new DocumentStore(BackendSelector.of(() -> this.createBackendBuilder().build()));
    }

    @Override
    public boolean requiresContainer() {
        return true;
    }

    @Override
    public BackendType getType() {
        return BackendType.MONGODB;
    }

    @Override
    public void close() throws Exception {
        // Container is reused across tests, the store closes its own client
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
