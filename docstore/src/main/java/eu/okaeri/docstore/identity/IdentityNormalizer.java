package eu.okaeri.docstore.identity;

import eu.okaeri.docstore.collection.DocumentCollection;
import eu.okaeri.docstore.document.Document;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps backend-native identities onto the single external {@value #ID_FIELD} field.
 * <p>
 * Normalized documents carry {@value #ID_FIELD}, never {@value #NATIVE_ID_FIELD},
 * and every registered sequence field of the collection holds a list.
 * Normalizing an already normalized document changes nothing.
 */
public class IdentityNormalizer {

    public static final String ID_FIELD = "id";
    public static final String NATIVE_ID_FIELD = "_id";

    /**
     * Normalize a stored document into a new document.
     * The identifier is the existing {@value #ID_FIELD}, else the slug,
     * else the string form of the native identifier.
     */
    public Document normalize(@NonNull Document source, @NonNull DocumentCollection collection) {
        Object id = this.resolveId(source, collection);

        Document normalized = new Document();
        if (id != null) {
            normalized.put(ID_FIELD, id);
        }
        source.forEach((key, value) -> {
            if (!ID_FIELD.equals(key) && !NATIVE_ID_FIELD.equals(key)) {
                normalized.put(key, value);
            }
        });

        for (String field : collection.getSequenceFields()) {
            if (normalized.get(field) == null) {
                normalized.put(field, new ArrayList<>());
            }
        }

        return normalized;
    }

    /**
     * Rename the native identifier of an aggregation row, no other defaults applied.
     */
    public Document normalizeRow(@NonNull Document row) {
        if (!row.containsKey(NATIVE_ID_FIELD)) {
            return row;
        }
        Document normalized = new Document();
        normalized.put(ID_FIELD, stringifyNative(row.get(NATIVE_ID_FIELD)));
        row.forEach((key, value) -> {
            if (!NATIVE_ID_FIELD.equals(key)) {
                normalized.put(key, value);
            }
        });
        return normalized;
    }

    /**
     * Assign the external identifier before insertion, in place.
     * Keeps an existing {@value #ID_FIELD}, else uses the slug, else a random UUID.
     *
     * @return the assigned identifier
     */
    public String assignId(@NonNull Document document, @NonNull DocumentCollection collection) {
        Object current = document.get(ID_FIELD);
        if (isPresent(current)) {
            return String.valueOf(current);
        }

        String id = null;
        if (collection.hasSlugField() && isPresent(document.get(collection.getSlugField()))) {
            id = String.valueOf(document.get(collection.getSlugField()));
        }
        if (id == null) {
            id = UUID.randomUUID().toString();
        }

        document.put(ID_FIELD, id);
        return id;
    }

    private Object resolveId(Document source, DocumentCollection collection) {
        Object id = source.get(ID_FIELD);
        if (isPresent(id)) {
            return id;
        }
        if (collection.hasSlugField()) {
            Object slug = source.get(collection.getSlugField());
            if (isPresent(slug)) {
                return String.valueOf(slug);
            }
        }
        Object nativeId = source.get(NATIVE_ID_FIELD);
        return (nativeId == null) ? null : String.valueOf(nativeId);
    }

    private static Object stringifyNative(Object value) {
        if ((value == null) || (value instanceof String) || (value instanceof Number) || (value instanceof Boolean)) {
            return value;
        }
        if ((value instanceof Map) || (value instanceof List)) {
            return value;
        }
        // ObjectId
        return String.valueOf(value);
    }

    private static boolean isPresent(Object value) {
        return (value != null) && !String.valueOf(value).isEmpty();
    }
}
