package eu.okaeri.docstore.filter;

import lombok.NonNull;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted substring relevance used by {@code textSearch}.
 * A name hit outweighs a summary hit, which outweighs a region hit.
 */
public class TextScorer {

    public static final Map<String, Integer> DEFAULT_WEIGHTS;

    static {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("name", 10);
        weights.put("summary", 5);
        weights.put("region", 3);
        DEFAULT_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private final Map<String, Integer> weights;

    public TextScorer() {
        this(DEFAULT_WEIGHTS);
    }

    public TextScorer(@NonNull Map<String, Integer> weights) {
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public List<String> getFields() {
        return new ArrayList<>(this.weights.keySet());
    }

    public int score(@NonNull Map<String, ?> document, @NonNull String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        int score = 0;
        for (Map.Entry<String, Integer> weight : this.weights.entrySet()) {
            Object value = document.get(weight.getKey());
            if ((value != null) && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle)) {
                score += weight.getValue();
            }
        }
        return score;
    }

    /**
     * Keep documents with a positive score, best first (ties keep input order), capped at limit.
     *
     * @param limit maximum number of results, 0 for all
     */
    public <T extends Map<String, ?>> List<T> rank(@NonNull List<T> documents, @NonNull String term, int limit) {
        List<Map.Entry<T, Integer>> scored = new ArrayList<>();
        for (T document : documents) {
            int score = this.score(document, term);
            if (score > 0) {
                scored.add(new AbstractMap.SimpleImmutableEntry<>(document, score));
            }
        }

        scored.sort(Comparator.comparing((Map.Entry<T, Integer> entry) -> entry.getValue()).reversed());

        List<T> out = new ArrayList<>();
        for (Map.Entry<T, Integer> entry : scored) {
            if ((limit > 0) && (out.size() >= limit)) {
                break;
            }
            out.add(entry.getKey());
        }
        return out;
    }
}
