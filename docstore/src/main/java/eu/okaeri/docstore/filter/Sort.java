package eu.okaeri.docstore.filter;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Sort {

    private final String field;
    private final SortDirection direction;

    public static Sort asc(@NonNull String field) {
        return new Sort(field, SortDirection.ASC);
    }

    public static Sort desc(@NonNull String field) {
        return new Sort(field, SortDirection.DESC);
    }

    public static Sort of(@NonNull String field, @NonNull SortDirection direction) {
        return new Sort(field, direction);
    }

    /**
     * Parse the common "field" / "-field" notation used by listing endpoints.
     */
    public static Sort parse(@NonNull String expression) {
        String field = expression.startsWith("-") ? expression.substring(1) : expression;
        if (field.trim().isEmpty()) {
            throw new IllegalArgumentException("Sort expression has no field: '" + expression + "'");
        }
        return (field.length() == expression.length()) ? asc(field) : desc(field);
    }
}
