package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.document.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FilterMatcherTest {

    private final FilterMatcher matcher = new FilterMatcher();

    private final Document japan = new Document()
        .append("name", "Japan")
        .append("region", "Asia")
        .append("summary", "Tourist visa waiver for many nationalities")
        .append("published", true)
        .append("population", 125)
        .append("visa_types", List.of("tourist", "work"))
        .append("photo", Map.of("size", "35x45"));

    @Test
    void empty_filter_matches_everything() {
        assertThat(this.matcher.matches(this.japan, Filter.empty())).isTrue();
    }

    @Test
    void all_conditions_must_hold() {
        assertThat(this.matcher.matches(this.japan, Filter.eq("region", "Asia").and("published", true))).isTrue();
        assertThat(this.matcher.matches(this.japan, Filter.eq("region", "Asia").and("published", false))).isFalse();
    }

    @Test
    void missing_field_never_matches() {
        assertThat(this.matcher.matches(this.japan, Filter.eq("featured", false))).isFalse();
    }

    @Test
    void numbers_match_by_value() {
        assertThat(this.matcher.matches(this.japan, Filter.eq("population", 125L))).isTrue();
        assertThat(this.matcher.matches(this.japan, Filter.eq("population", 125.0))).isTrue();
    }

    @Test
    void sequences_match_as_a_whole() {
        assertThat(this.matcher.matches(this.japan, Filter.eq("visa_types", List.of("tourist", "work")))).isTrue();
        assertThat(this.matcher.matches(this.japan, Filter.eq("visa_types", "tourist"))).isFalse();
    }

    @Test
    void dotted_names_address_nested_fields() {
        assertThat(this.matcher.matches(this.japan, Filter.eq("photo.size", "35x45"))).isTrue();
        assertThat(this.matcher.matches(this.japan, Filter.eq("photo.background", "white"))).isFalse();
    }

    @Test
    void text_matches_name_or_summary_ignoring_case() {
        assertThat(this.matcher.matches(this.japan, Filter.text("JAPAN"))).isTrue();
        assertThat(this.matcher.matches(this.japan, Filter.text("waiver"))).isTrue();
    }

    @Test
    void text_does_not_match_region() {
        assertThat(this.matcher.matches(this.japan, Filter.text("asia"))).isFalse();
    }

    @Test
    void text_and_equalities_combine() {
        assertThat(this.matcher.matches(this.japan, Filter.text("japan").and("region", "Europe"))).isFalse();
    }
}
