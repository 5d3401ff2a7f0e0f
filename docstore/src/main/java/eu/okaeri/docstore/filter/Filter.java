package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.exception.UnsupportedQueryException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality-based query predicate.
 * <p>
 * The grammar is closed: a mapping of field to literal value (all implicitly
 * AND-ed, dotted names address nested mappings) plus the reserved
 * {@value #TEXT_OPERATOR} key for free-text matching. Anything else, such as
 * {@code $or} or {@code {"$gt": 5}}, is rejected with
 * {@link UnsupportedQueryException}.
 */
@ToString
@EqualsAndHashCode
public final class Filter {

    public static final String TEXT_OPERATOR = "$text";
    public static final String SEARCH_KEY = "$search";

    private static final Filter EMPTY = new Filter(Collections.emptyMap(), null);

    @Getter
    private final Map<String, Object> equalities;
    @Getter
    private final String textTerm;

    private Filter(@NonNull Map<String, Object> equalities, String textTerm) {
        this.equalities = Collections.unmodifiableMap(equalities);
        this.textTerm = textTerm;
    }

    public static Filter empty() {
        return EMPTY;
    }

    public static Filter eq(@NonNull String field, Object value) {
        return EMPTY.and(field, value);
    }

    public static Filter text(@NonNull String term) {
        return EMPTY.andText(term);
    }

    /**
     * Parse a raw filter map, e.g. one built from request parameters.
     *
     * @param raw field to value map, optionally holding {@code $text}
     * @return validated filter
     * @throws UnsupportedQueryException when the map uses any other operator
     */
    public static Filter of(Map<String, ?> raw) {
        if ((raw == null) || raw.isEmpty()) {
            return EMPTY;
        }

        Filter filter = EMPTY;
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            if (TEXT_OPERATOR.equals(key)) {
                filter = filter.andText(parseTextTerm(entry.getValue()));
            } else {
                filter = filter.and(key, entry.getValue());
            }
        }
        return filter;
    }

    public Filter and(@NonNull String field, Object value) {
        if (field.isEmpty()) {
            throw new IllegalArgumentException("filter field name cannot be empty");
        }
        if (field.startsWith("$")) {
            throw new UnsupportedQueryException("Unsupported filter operator: " + field);
        }
        checkLiteral(field, value);

        Map<String, Object> next = new LinkedHashMap<>(this.equalities);
        next.put(field, value);
        return new Filter(next, this.textTerm);
    }

    public Filter andText(@NonNull String term) {
        return new Filter(new LinkedHashMap<>(this.equalities), term);
    }

    public boolean isEmpty() {
        return this.equalities.isEmpty() && !this.hasText();
    }

    public boolean hasText() {
        return this.textTerm != null;
    }

    /**
     * Render back to the raw map shape, {@code $text} as {@code {"$search": term}}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>(this.equalities);
        if (this.hasText()) {
            out.put(TEXT_OPERATOR, Collections.singletonMap(SEARCH_KEY, this.textTerm));
        }
        return out;
    }

    private static String parseTextTerm(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Map) {
            Object search = ((Map<?, ?>) value).get(SEARCH_KEY);
            if ((((Map<?, ?>) value).size() == 1) && (search instanceof String)) {
                return (String) search;
            }
        }
        throw new UnsupportedQueryException("Unsupported " + TEXT_OPERATOR + " value: " + value + " (expected a term or {\"" + SEARCH_KEY + "\": term})");
    }

    private static void checkLiteral(String field, Object value) {
        if (!(value instanceof Map)) {
            return;
        }
        for (Object key : ((Map<?, ?>) value).keySet()) {
            if (String.valueOf(key).startsWith("$")) {
                throw new UnsupportedQueryException("Unsupported operator " + key + " on field " + field);
            }
        }
    }
}
