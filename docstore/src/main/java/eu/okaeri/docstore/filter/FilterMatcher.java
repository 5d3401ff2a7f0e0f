package eu.okaeri.docstore.filter;

import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;
import static eu.okaeri.docstore.document.DocumentValueUtils.hasPath;
import static eu.okaeri.docstore.document.DocumentValueUtils.toParts;
import static eu.okaeri.docstore.document.DocumentValueUtils.valueEquals;

/**
 * Evaluates {@link Filter}s in-memory for backends without a native query engine.
 */
@Getter
public class FilterMatcher {

    /**
     * Fields searched by {@link Filter#TEXT_OPERATOR}.
     */
    public static final List<String> TEXT_FIELDS = Collections.unmodifiableList(Arrays.asList("name", "summary"));

    private final List<String> textFields;

    public FilterMatcher() {
        this(TEXT_FIELDS);
    }

    public FilterMatcher(@NonNull List<String> textFields) {
        this.textFields = Collections.unmodifiableList(textFields);
    }

    /**
     * Check whether a document satisfies every condition of the filter.
     * A field missing from the document never matches.
     */
    public boolean matches(@NonNull Map<String, ?> document, @NonNull Filter filter) {
        for (Map.Entry<String, Object> condition : filter.getEqualities().entrySet()) {
            List<String> parts = toParts(condition.getKey());
            if (!hasPath(document, parts)) {
                return false;
            }
            if (!valueEquals(extractValue(document, parts), condition.getValue())) {
                return false;
            }
        }

        return !filter.hasText() || containsText(document, this.textFields, filter.getTextTerm());
    }

    /**
     * Case-insensitive substring match of a term against any of the given fields.
     */
    public static boolean containsText(@NonNull Map<String, ?> document, @NonNull List<String> fields, @NonNull String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        for (String field : fields) {
            Object value = document.get(field);
            if ((value != null) && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
