package eu.okaeri.docstore.mongo;

import eu.okaeri.docstore.document.Document;
import lombok.NonNull;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonValue;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Conversions between store documents and driver documents.
 * UUIDs are written as strings, matching the file backend.
 */
public final class MongoDocuments {

    private static final DocumentCodec DOCUMENT_CODEC = new DocumentCodec();
    private static final String VALUE_KEY = "v";

    private MongoDocuments() {
    }

    public static org.bson.Document toBson(@NonNull Map<String, ?> document) {
        org.bson.Document out = new org.bson.Document();
        document.forEach((key, value) -> out.put(key, toBsonValue(value)));
        return out;
    }

    @SuppressWarnings("unchecked")
    public static Object toBsonValue(Object value) {
        if (value instanceof Map) {
            return toBson((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object element : (List<?>) value) {
                out.add(toBsonValue(element));
            }
            return out;
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        return value;
    }

    public static Document fromBson(@NonNull Map<String, ?> document) {
        Document out = new Document();
        document.forEach((key, value) -> out.put(key, fromBsonObject(value)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object fromBsonObject(Object value) {
        if (value instanceof Map) {
            return fromBson((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object element : (List<?>) value) {
                out.add(fromBsonObject(element));
            }
            return out;
        }
        return value;
    }

    /**
     * Decode a raw BSON value, e.g. one returned by {@code distinct}, into its Java form.
     */
    public static Object fromBsonValue(BsonValue value) {
        if ((value == null) || value.isNull()) {
            return null;
        }
        BsonDocument wrapper = new BsonDocument(VALUE_KEY, value);
        org.bson.Document decoded = DOCUMENT_CODEC.decode(new BsonDocumentReader(wrapper), DecoderContext.builder().build());
        return fromBsonObject(decoded.get(VALUE_KEY));
    }
}
