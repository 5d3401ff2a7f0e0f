package eu.okaeri.docstore.collection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentCollectionTest {

    @Test
    void collects_metadata() {
        DocumentCollection collection = DocumentCollection.of("countries")
            .sequenceFields("visa_types", "documents")
            .index(CollectionIndex.unique("slug"))
            .index(CollectionIndex.text("name", "summary"));

        assertThat(collection.getSequenceFields()).containsExactly("visa_types", "documents");
        assertThat(collection.getIndexes()).containsExactly(CollectionIndex.unique("slug"), CollectionIndex.text("name", "summary"));
        assertThat(collection.getSlugField()).isEqualTo("slug");
    }

    @Test
    void slug_can_be_disabled() {
        assertThat(DocumentCollection.of("notes").slugField(null).hasSlugField()).isFalse();
    }

    @Test
    void rejects_empty_name() {
        assertThatThrownBy(() -> DocumentCollection.of("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void text_index_requires_fields() {
        assertThatThrownBy(() -> CollectionIndex.text()).isInstanceOf(IllegalArgumentException.class);
    }
}
