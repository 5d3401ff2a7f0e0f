package eu.okaeri.docstore.aggregate;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.SortDirection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AggregationEngineTest {

    private final AggregationEngine engine = new AggregationEngine();

    private final List<Document> countries = List.of(
        new Document().append("name", "Japan").append("region", "Asia").append("published", true),
        new Document().append("name", "France").append("region", "Europe").append("published", true),
        new Document().append("name", "Vietnam").append("region", "Asia").append("published", false),
        new Document().append("name", "Kenya").append("region", "Africa").append("published", true),
        new Document().append("name", "Thailand").append("region", "Asia").append("published", true)
    );

    @Test
    void group_all_counts_like_count_documents() {
        Filter published = Filter.eq("published", true);

        List<Document> rows = this.engine.execute(this.countries, Pipeline.builder().match(published).groupAll().build());

        assertThat(rows).containsExactly(new Document().append("_id", null).append("count", 4));
    }

    @Test
    void group_all_on_empty_input_counts_zero() {
        List<Document> rows = this.engine.execute(Collections.emptyList(), Pipeline.builder().groupAll().build());
        assertThat(rows).containsExactly(new Document().append("_id", null).append("count", 0));
    }

    @Test
    void group_by_field_keeps_first_appearance_order() {
        List<Document> rows = this.engine.execute(this.countries, Pipeline.builder().group("region").build());

        assertThat(rows).containsExactly(
            new Document().append("_id", "Asia").append("count", 3),
            new Document().append("_id", "Europe").append("count", 1),
            new Document().append("_id", "Africa").append("count", 1)
        );
    }

    @Test
    void group_then_sort_by_count() {
        List<Document> rows = this.engine.execute(this.countries, Pipeline.builder()
            .group("region")
            .sort("count", SortDirection.DESC)
            .build());

        assertThat(rows).extracting(row -> row.get("_id")).containsExactly("Asia", "Europe", "Africa");
    }

    @Test
    void group_by_missing_field_collects_under_null() {
        List<Document> rows = this.engine.execute(this.countries, Pipeline.builder().group("capital").build());
        assertThat(rows).containsExactly(new Document().append("_id", null).append("count", 5));
    }

    @Test
    void numeric_group_keys_compare_by_value() {
        List<Document> rows = this.engine.execute(
            List.of(Document.of("level", 1), Document.of("level", 1L), Document.of("level", 2.0)),
            Pipeline.builder().group("level").build());

        assertThat(rows).extracting(row -> row.get("count")).containsExactly(2, 1);
    }

    @Test
    void signed_zero_group_keys_share_a_group() {
        List<Document> rows = this.engine.execute(
            List.of(Document.of("delta", -0.0), Document.of("delta", 0.0), Document.of("delta", 0)),
            Pipeline.builder().group("delta").build());

        assertThat(rows).extracting(row -> row.get("count")).containsExactly(3);
    }

    @Test
    void nested_group_keys_compare_by_value() {
        List<Document> rows = this.engine.execute(
            List.of(
                Document.of("photo", Map.of("size", 1, "tags", List.of(2L))),
                Document.of("photo", Map.of("size", 1.0, "tags", List.of(2.0))),
                Document.of("photo", Map.of("size", 2))),
            Pipeline.builder().group("photo").build());

        assertThat(rows).extracting(row -> row.get("count")).containsExactly(2, 1);
    }

    @Test
    void sort_treats_missing_field_as_zero() {
        List<Document> rows = this.engine.execute(
            List.of(Document.of("score", 5), Document.of("other", "x"), Document.of("score", -3)),
            Pipeline.builder().sort("score", SortDirection.ASC).build());

        assertThat(rows).extracting(row -> row.get("score")).containsExactly(-3, null, 5);
    }

    @Test
    void pass_through_stage_leaves_rows_unchanged() {
        List<Document> rows = this.engine.execute(this.countries, Pipeline.of(new PassThroughStage("$unwind", "$visa_types")));
        assertThat(rows).containsExactlyElementsOf(this.countries);
    }

    @Test
    void execution_does_not_mutate_snapshot() {
        List<Document> snapshot = new ArrayList<>(this.countries);
        this.engine.execute(snapshot, Pipeline.builder().sort("name", SortDirection.ASC).groupAll().build());
        assertThat(snapshot).containsExactlyElementsOf(this.countries);
    }
}
