package eu.okaeri.docstore.aggregate;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.FilterMatcher;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.SortDirection;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareForSort;
import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;
import static eu.okaeri.docstore.document.DocumentValueUtils.toParts;
import static eu.okaeri.docstore.document.DocumentValueUtils.valueEquals;
import static eu.okaeri.docstore.document.DocumentValueUtils.valueHash;

/**
 * Evaluates aggregation pipelines in memory over a single collection snapshot.
 * <p>
 * Supported stages:
 * <ul>
 *   <li>{@link MatchStage} - keeps rows matching the filter</li>
 *   <li>{@link GroupStage} - counts rows, all together or per distinct key value</li>
 *   <li>{@link SortStage} - stable sort, a missing field sorts as 0</li>
 * </ul>
 * {@link PassThroughStage}s leave the rows untouched.
 */
@Getter
public class AggregationEngine {

    private static final Logger LOGGER = Logger.getLogger(AggregationEngine.class.getSimpleName());

    private final FilterMatcher matcher;

    public AggregationEngine() {
        this(new FilterMatcher());
    }

    public AggregationEngine(@NonNull FilterMatcher matcher) {
        this.matcher = matcher;
    }

    public List<Document> execute(@NonNull List<Document> snapshot, @NonNull Pipeline pipeline) {
        List<Document> rows = new ArrayList<>(snapshot);

        for (PipelineStage stage : pipeline.getStages()) {
            if (stage instanceof MatchStage) {
                rows = this.match(rows, (MatchStage) stage);
            } else if (stage instanceof GroupStage) {
                rows = group(rows, (GroupStage) stage);
            } else if (stage instanceof SortStage) {
                rows = sort(rows, ((SortStage) stage).getSort());
            } else {
                LOGGER.warning("Ignoring unsupported pipeline stage " + stage.getOperator() + ", rows passed through unchanged");
            }
        }

        return rows;
    }

    private List<Document> match(List<Document> rows, MatchStage stage) {
        return rows.stream()
            .filter(row -> this.matcher.matches(row, stage.getFilter()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<Document> group(List<Document> rows, GroupStage stage) {
        if (stage.isGroupAll()) {
            List<Document> result = new ArrayList<>();
            result.add(groupRow(null, rows.size(), stage));
            return result;
        }

        // first-appearance order
        List<String> parts = toParts(stage.getKeyField());
        Map<GroupKey, Integer> counts = new LinkedHashMap<>();
        for (Document row : rows) {
            counts.merge(new GroupKey(extractValue(row, parts)), 1, Integer::sum);
        }

        List<Document> result = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> result.add(groupRow(key.getValue(), count, stage)));
        return result;
    }

    private static List<Document> sort(List<Document> rows, Sort sort) {
        List<String> parts = toParts(sort.getField());
        Comparator<Document> comparator = (row1, row2) -> compareForSort(
            valueOrZero(extractValue(row1, parts)),
            valueOrZero(extractValue(row2, parts)));
        if (sort.getDirection() == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        List<Document> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return sorted;
    }

    private static Object valueOrZero(Object value) {
        return (value == null) ? 0 : value;
    }

    private static Document groupRow(Object key, int count, GroupStage stage) {
        return new Document()
            .append(GroupStage.ID_FIELD, Document.copyValue(key))
            .append(stage.getCountField(), count);
    }

    /**
     * Group key comparing by value, so 1 and 1.0 land in the same group.
     */
    @Getter
    private static final class GroupKey {

        private final Object value;
        private final int hash;

        private GroupKey(Object value) {
            this.value = value;
            this.hash = valueHash(value);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof GroupKey)) return false;
            return valueEquals(this.value, ((GroupKey) other).value);
        }

        @Override
        public int hashCode() {
            return this.hash;
        }
    }
}
