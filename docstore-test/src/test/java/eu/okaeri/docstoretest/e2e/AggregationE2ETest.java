package eu.okaeri.docstoretest.e2e;

import eu.okaeri.docstore.aggregate.GroupStage;
import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.SortDirection;
import eu.okaeri.docstoretest.fixtures.Countries;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static eu.okaeri.docstoretest.fixtures.Countries.COLLECTION_NAME;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * E2E aggregation tests, run against every available backend.
 */
public class AggregationE2ETest extends E2ETestBase {

    protected static Stream<BackendTestContext> allBackendsWithContext() {
        return allBackends().map(BackendTestContext::create);
    }

    private static Map<Object, Long> countsById(List<Document> rows) {
        Map<Object, Long> counts = new LinkedHashMap<>();
        for (Document row : rows) {
            counts.put(row.get("id"), ((Number) row.get("count")).longValue());
        }
        return counts;
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_group_all_agrees_with_count(BackendTestContext btc) {
        Pipeline pipeline = Pipeline.builder()
            .match(Filter.eq("published", true))
            .groupAll()
            .build();

        List<Document> rows = btc.getStore().aggregate(COLLECTION_NAME, pipeline).toList();

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("id")).isNull();
        assertThat(((Number) rows.get(0).get("count")).longValue())
            .isEqualTo(btc.getStore().countDocuments(COLLECTION_NAME, Filter.eq("published", true)))
            .isEqualTo(Countries.publishedCount());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_group_all_on_empty_collection_counts_zero(BackendTestContext btc) {
        btc.getStore().deleteMany("empty_countries", Filter.empty());

        List<Document> rows = btc.getStore().aggregate("empty_countries", Pipeline.builder().groupAll().build()).toList();

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("id")).isNull();
        assertThat(((Number) rows.get(0).get("count")).longValue()).isZero();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_group_all_on_empty_match_agrees_with_count(BackendTestContext btc) {
        Filter nowhere = Filter.eq("region", "Atlantis");
        Pipeline pipeline = Pipeline.builder()
            .match(nowhere)
            .groupAll()
            .build();

        List<Document> rows = btc.getStore().aggregate(COLLECTION_NAME, pipeline).toList();

        assertThat(rows).hasSize(1);
        assertThat(((Number) rows.get(0).get("count")).longValue())
            .isEqualTo(btc.getStore().countDocuments(COLLECTION_NAME, nowhere))
            .isZero();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_group_by_region(BackendTestContext btc) {
        Pipeline pipeline = Pipeline.builder()
            .group("region")
            .build();

        Map<Object, Long> counts = countsById(btc.getStore().aggregate(COLLECTION_NAME, pipeline).toList());

        assertThat(counts).containsOnly(
            Map.entry("Asia", 2L),
            Map.entry("Europe", 3L),
            Map.entry("South America", 1L),
            Map.entry("Africa", 1L));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_group_sorted_by_count(BackendTestContext btc) {
        Pipeline pipeline = Pipeline.builder()
            .match(Filter.eq("published", true))
            .group("region")
            .sort(GroupStage.DEFAULT_COUNT_FIELD, SortDirection.DESC)
            .build();

        List<Document> rows = btc.getStore().aggregate(COLLECTION_NAME, pipeline).toList();

        assertThat(rows).hasSize(3);
        assertThat(((Number) rows.get(0).get("count")).longValue()).isEqualTo(2L);
        assertThat(((Number) rows.get(2).get("count")).longValue()).isEqualTo(1L);
        assertThat(countsById(rows)).containsOnly(
            Map.entry("Asia", 2L),
            Map.entry("Europe", 2L),
            Map.entry("Africa", 1L));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_native_pipeline_with_custom_count_field(BackendTestContext btc) {
        Pipeline pipeline = Pipeline.fromNative(Arrays.asList(
            Map.of("$match", Map.of("region", "Europe")),
            Map.of("$group", Map.of("_id", "$published", "total", Map.of("$sum", 1))),
            Map.of("$sort", Map.of("total", -1))));

        List<Document> rows = btc.getStore().aggregate(COLLECTION_NAME, pipeline).toList();

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("id")).isEqualTo(true);
        assertThat(((Number) rows.get(0).get("total")).longValue()).isEqualTo(2L);
        assertThat(rows.get(1).get("id")).isEqualTo(false);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_aggregate_cursor_paging_uses_native_group_key(BackendTestContext btc) {
        Pipeline pipeline = Pipeline.builder()
            .group("region")
            .build();

        List<Document> page = btc.getStore().aggregate(COLLECTION_NAME, pipeline)
            .sort("_id", SortDirection.ASC)
            .skip(1)
            .limit(2)
            .toList();

        assertThat(page).extracting(row -> row.get("id")).containsExactly("Asia", "Europe");
    }
}
