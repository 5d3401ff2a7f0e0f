package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.document.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextScorerTest {

    private final TextScorer scorer = new TextScorer();

    private final Document nameHit = new Document().append("name", "Thailand").append("summary", "Beaches").append("region", "Asia");
    private final Document summaryHit = new Document().append("name", "Laos").append("summary", "Near Thailand").append("region", "Asia");
    private final Document regionHit = new Document().append("name", "Fiji").append("summary", "Islands").append("region", "Thailand Gulf");
    private final Document miss = new Document().append("name", "Peru").append("summary", "Andes").append("region", "South America");

    @Test
    void weights_name_over_summary_over_region() {
        assertThat(this.scorer.score(this.nameHit, "thailand")).isEqualTo(10);
        assertThat(this.scorer.score(this.summaryHit, "thailand")).isEqualTo(5);
        assertThat(this.scorer.score(this.regionHit, "thailand")).isEqualTo(3);
        assertThat(this.scorer.score(this.miss, "thailand")).isZero();
    }

    @Test
    void rank_orders_best_first_and_drops_misses() {
        List<Document> ranked = this.scorer.rank(List.of(this.miss, this.regionHit, this.summaryHit, this.nameHit), "THAILAND", 0);
        assertThat(ranked).containsExactly(this.nameHit, this.summaryHit, this.regionHit);
    }

    @Test
    void rank_respects_limit() {
        List<Document> ranked = this.scorer.rank(List.of(this.regionHit, this.summaryHit, this.nameHit), "thailand", 2);
        assertThat(ranked).containsExactly(this.nameHit, this.summaryHit);
    }

    @Test
    void rank_keeps_input_order_for_ties() {
        Document first = Document.of("name", "Korea North");
        Document second = Document.of("name", "Korea South");
        assertThat(this.scorer.rank(List.of(first, second), "korea", 0)).containsExactly(first, second);
    }
}
