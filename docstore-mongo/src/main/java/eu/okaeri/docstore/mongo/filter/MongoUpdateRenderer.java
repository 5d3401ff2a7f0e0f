package eu.okaeri.docstore.mongo.filter;

import com.mongodb.client.model.Updates;
import eu.okaeri.docstore.filter.Update;
import eu.okaeri.docstore.mongo.MongoDocuments;
import lombok.NonNull;
import org.bson.conversions.Bson;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders store updates to a driver {@code $set} update.
 */
public class MongoUpdateRenderer {

    public Bson render(@NonNull Update update) {
        List<Bson> sets = update.getFields().entrySet().stream()
            .map(entry -> Updates.set(entry.getKey(), MongoDocuments.toBsonValue(entry.getValue())))
            .collect(Collectors.toList());
        return (sets.size() == 1) ? sets.get(0) : Updates.combine(sets);
    }
}
