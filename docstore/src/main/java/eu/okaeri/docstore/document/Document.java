package eu.okaeri.docstore.document;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schemaless document: an ordered mapping of field name to value.
 * <p>
 * Values are scalars, nested mappings or lists of either. Field order
 * follows insertion order and survives both backends.
 */
public class Document extends LinkedHashMap<String, Object> {

    public Document() {
        super();
    }

    public Document(@NonNull Map<String, ?> source) {
        super(source);
    }

    public static Document of(@NonNull String key, Object value) {
        return new Document().append(key, value);
    }

    public Document append(@NonNull String key, Object value) {
        this.put(key, value);
        return this;
    }

    public String getString(@NonNull String key) {
        Object value = this.get(key);
        return (value == null) ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(@NonNull String key) {
        Object value = this.get(key);
        return (value instanceof List) ? (List<Object>) value : null;
    }

    /**
     * Copy this document recursively, nested mappings become Documents.
     * Mutating the copy never touches the source.
     */
    public Document deepCopy() {
        Document copy = new Document();
        this.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    public static Object copyValue(Object value) {
        if (value instanceof Map) {
            Document nested = new Document();
            ((Map<String, Object>) value).forEach((key, nestedValue) -> nested.put(key, copyValue(nestedValue)));
            return nested;
        }
        if (value instanceof List) {
            List<Object> source = (List<Object>) value;
            List<Object> copy = new ArrayList<>(source.size());
            for (Object element : source) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }
}
