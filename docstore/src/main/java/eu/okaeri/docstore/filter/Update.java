package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.exception.UnsupportedQueryException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;
import static eu.okaeri.docstore.document.DocumentValueUtils.hasPath;
import static eu.okaeri.docstore.document.DocumentValueUtils.toParts;
import static eu.okaeri.docstore.document.DocumentValueUtils.valueEquals;

/**
 * Field-level update.
 * <p>
 * Every field is replaced as a whole: scalars are set, lists and nested
 * mappings are replaced wholesale rather than merged. Applying the same
 * update twice yields the same document as applying it once.
 */
@ToString
@EqualsAndHashCode
public final class Update {

    public static final String SET_OPERATOR = "$set";

    @Getter
    private final Map<String, Object> fields;

    private Update(@NonNull Map<String, Object> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("update requires at least one field");
        }
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Update set(@NonNull String field, Object value) {
        return new Update(checkedField(new LinkedHashMap<>(), field, value));
    }

    /**
     * Parse a raw update, either {@code {"$set": {...}}} or a plain field map.
     *
     * @throws UnsupportedQueryException for any operator other than {@code $set}
     */
    @SuppressWarnings("unchecked")
    public static Update of(@NonNull Map<String, ?> raw) {
        Map<String, ?> source = raw;
        if (raw.keySet().stream().anyMatch(key -> key.startsWith("$"))) {
            if ((raw.size() != 1) || !(raw.get(SET_OPERATOR) instanceof Map)) {
                throw new UnsupportedQueryException("Unsupported update operators: " + raw.keySet() + " (only " + SET_OPERATOR + " is supported)");
            }
            source = (Map<String, ?>) raw.get(SET_OPERATOR);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        source.forEach((field, value) -> checkedField(fields, field, value));
        return new Update(fields);
    }

    public Update and(@NonNull String field, Object value) {
        return new Update(checkedField(new LinkedHashMap<>(this.fields), field, value));
    }

    /**
     * Apply this update to a document in place.
     *
     * @return true if any field value changed
     */
    public boolean applyTo(@NonNull Document document) {
        boolean modified = false;
        for (Map.Entry<String, Object> entry : this.fields.entrySet()) {
            List<String> parts = toParts(entry.getKey());
            if (hasPath(document, parts) && valueEquals(extractValue(document, parts), entry.getValue())) {
                continue;
            }
            setPath(document, parts, Document.copyValue(entry.getValue()));
            modified = true;
        }
        return modified;
    }

    /**
     * Render to the raw {@code {"$set": {...}}} shape.
     */
    public Map<String, Object> toMap() {
        return Collections.singletonMap(SET_OPERATOR, new LinkedHashMap<>(this.fields));
    }

    @SuppressWarnings("unchecked")
    private static void setPath(Document document, List<String> parts, Object value) {
        Map<String, Object> current = document;
        for (int i = 0; i < (parts.size() - 1); i++) {
            Object next = current.get(parts.get(i));
            if (!(next instanceof Map)) {
                next = new Document();
                current.put(parts.get(i), next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(parts.get(parts.size() - 1), value);
    }

    private static Map<String, Object> checkedField(Map<String, Object> fields, String field, Object value) {
        if (field.isEmpty() || field.startsWith("$")) {
            throw new UnsupportedQueryException("Unsupported update field: " + field);
        }
        fields.put(field, value);
        return fields;
    }
}
