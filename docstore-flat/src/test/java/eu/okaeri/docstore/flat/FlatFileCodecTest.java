package eu.okaeri.docstore.flat;

import com.google.gson.JsonParseException;
import eu.okaeri.docstore.document.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlatFileCodecTest {

    private final FlatFileCodec codec = new FlatFileCodec();

    @Test
    void writes_pretty_printed_unescaped_json() {
        String json = this.codec.encode(List.of(Document.of("name", "Côte d'Ivoire <CI>")));

        assertThat(json).contains("\n  {");
        assertThat(json).contains("Côte d'Ivoire <CI>");
    }

    @Test
    void writes_timestamps_and_uuids_as_strings() {
        UUID id = UUID.fromString("3f1c2d4e-0000-4000-8000-000000000001");
        Document document = new Document()
            .append("updated_at", Instant.parse("2024-05-01T10:15:30Z"))
            .append("valid_from", LocalDate.of(2024, 5, 1))
            .append("ref", id);

        String json = this.codec.encode(List.of(document));

        assertThat(json)
            .contains("\"2024-05-01T10:15:30Z\"")
            .contains("\"2024-05-01\"")
            .contains("\"" + id + "\"");
    }

    @Test
    void reads_nested_values_as_documents_and_longs() {
        List<Document> documents = this.codec.decode("[{\"name\": \"Japan\", \"population\": 125, \"gdp\": 4.2, \"photo\": {\"size\": \"35x45\"}, \"tags\": [\"a\"], \"capital\": null}]");

        Document japan = documents.get(0);
        assertThat(japan.get("population")).isEqualTo(125L);
        assertThat(japan.get("gdp")).isEqualTo(4.2);
        assertThat(japan.get("photo")).isInstanceOf(Document.class);
        assertThat(japan.getList("tags")).containsExactly("a");
        assertThat(japan).containsEntry("capital", null);
    }

    @Test
    void blank_text_is_empty_collection() {
        assertThat(this.codec.decode("  ")).isEmpty();
    }

    @Test
    void rejects_non_array_root() {
        assertThatThrownBy(() -> this.codec.decode("{\"name\": \"Japan\"}")).isInstanceOf(JsonParseException.class);
    }

    @Test
    void rejects_non_object_elements() {
        assertThatThrownBy(() -> this.codec.decode("[1, 2]")).isInstanceOf(JsonParseException.class);
    }

    @Test
    void keeps_field_order() {
        List<Document> documents = this.codec.decode(this.codec.encode(List.of(new Document().append("z", 1).append("a", 2))));
        assertThat(documents.get(0).keySet()).containsExactly("z", "a");
        assertThat(documents.get(0)).isEqualTo(Map.of("z", 1L, "a", 2L));
    }
}
