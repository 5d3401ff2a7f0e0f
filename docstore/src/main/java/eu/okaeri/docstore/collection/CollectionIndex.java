package eu.okaeri.docstore.collection;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Native index declaration. Only backends with a native index facility use it.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CollectionIndex {

    private final List<String> fields;
    private final boolean unique;
    private final boolean text;

    public static CollectionIndex of(@NonNull String field) {
        return new CollectionIndex(Collections.singletonList(field), false, false);
    }

    public static CollectionIndex unique(@NonNull String field) {
        return new CollectionIndex(Collections.singletonList(field), true, false);
    }

    public static CollectionIndex text(@NonNull String... fields) {
        if (fields.length == 0) {
            throw new IllegalArgumentException("text index requires at least one field");
        }
        return new CollectionIndex(Collections.unmodifiableList(Arrays.asList(fields)), false, true);
    }
}
