package eu.okaeri.docstore.collection;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Named document collection and its optional metadata.
 * <pre>{@code
 * DocumentCollection countries = DocumentCollection.of("countries")
 *     .sequenceFields("visa_types", "documents", "embassies")
 *     .index(CollectionIndex.unique("slug"))
 *     .index(CollectionIndex.of("region"));
 * }</pre>
 */
@Getter
@ToString
public class DocumentCollection {

    public static final String DEFAULT_SLUG_FIELD = "slug";

    private final String name;
    private final Set<String> sequenceFields = new LinkedHashSet<>();
    private final Set<CollectionIndex> indexes = new LinkedHashSet<>();
    private String slugField = DEFAULT_SLUG_FIELD;

    private DocumentCollection(@NonNull String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("collection name cannot be empty");
        }
        this.name = name;
    }

    public static DocumentCollection of(@NonNull String name) {
        return new DocumentCollection(name);
    }

    /**
     * Nested sequence fields defaulted to an empty list on every read.
     */
    public DocumentCollection sequenceFields(@NonNull String... fields) {
        Collections.addAll(this.sequenceFields, fields);
        return this;
    }

    public DocumentCollection slugField(String slugField) {
        this.slugField = slugField;
        return this;
    }

    public DocumentCollection index(@NonNull CollectionIndex index) {
        this.indexes.add(index);
        return this;
    }

    public Set<String> getSequenceFields() {
        return Collections.unmodifiableSet(this.sequenceFields);
    }

    public Set<CollectionIndex> getIndexes() {
        return Collections.unmodifiableSet(this.indexes);
    }

    public boolean hasSlugField() {
        return (this.slugField != null) && !this.slugField.isEmpty();
    }
}
