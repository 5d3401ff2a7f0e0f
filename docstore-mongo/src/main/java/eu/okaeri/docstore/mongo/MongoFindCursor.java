package eu.okaeri.docstore.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Sorts;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.identity.IdentityNormalizer;
import eu.okaeri.docstore.mongo.filter.MongoPipelineRenderer;
import lombok.NonNull;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor forwarding skip, limit and sort to a driver {@code find}.
 * Sorted queries break ties by native id, i.e. insertion order.
 */
public class MongoFindCursor extends Cursor {

    private final MongoCollection<org.bson.Document> collection;
    private final Bson filter;

    public MongoFindCursor(@NonNull MongoCollection<org.bson.Document> collection, @NonNull Bson filter) {
        this.collection = collection;
        this.filter = filter;
    }

    @Override
    public List<Document> toList() {
        FindIterable<org.bson.Document> iterable = this.collection.find(this.filter);

        if (this.hasSort()) {
            Bson sort = MongoPipelineRenderer.renderSort(this.getSort());
            if (!IdentityNormalizer.NATIVE_ID_FIELD.equals(this.getSort().getField())) {
                sort = Sorts.orderBy(sort, Sorts.ascending(IdentityNormalizer.NATIVE_ID_FIELD));
            }
            iterable = iterable.sort(sort);
        }

        if (this.hasSkip()) {
            iterable = iterable.skip(this.getSkip());
        }

        if (this.hasLimit()) {
            iterable = iterable.limit(this.getLimit());
        }

        return iterable.map(MongoDocuments::fromBson).into(new ArrayList<>());
    }
}
