package eu.okaeri.docstore.aggregate;

import eu.okaeri.docstore.exception.UnsupportedQueryException;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.SortDirection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of aggregation stages.
 * <pre>{@code
 * Pipeline pipeline = Pipeline.builder()
 *     .match(Filter.eq("published", true))
 *     .group("region")
 *     .sort("count", SortDirection.DESC)
 *     .build();
 * }</pre>
 */
@ToString
@EqualsAndHashCode
public final class Pipeline {

    private static final String SUM_OPERATOR = "$sum";

    @Getter
    private final List<PipelineStage> stages;

    private Pipeline(@NonNull List<PipelineStage> stages) {
        this.stages = Collections.unmodifiableList(stages);
    }

    public static Pipeline of(@NonNull PipelineStage... stages) {
        return new Pipeline(new ArrayList<>(Arrays.asList(stages)));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a pipeline in the native stage-list shape,
     * e.g. {@code [{"$match": {...}}, {"$group": {"_id": "$region", "count": {"$sum": 1}}}]}.
     * <p>
     * Stages of kinds other than {@code $match}, {@code $group} and {@code $sort}
     * become {@link PassThroughStage}s.
     *
     * @throws UnsupportedQueryException for malformed stages or group accumulators other than a count
     */
    public static Pipeline fromNative(@NonNull List<? extends Map<String, ?>> raw) {
        List<PipelineStage> stages = new ArrayList<>();
        for (Map<String, ?> stage : raw) {
            if (stage.size() != 1) {
                throw new UnsupportedQueryException("Pipeline stage must hold exactly one operator: " + stage.keySet());
            }
            Map.Entry<String, ?> entry = stage.entrySet().iterator().next();
            stages.add(parseStage(entry.getKey(), entry.getValue()));
        }
        return new Pipeline(stages);
    }

    public boolean isEmpty() {
        return this.stages.isEmpty();
    }

    @SuppressWarnings("unchecked")
    private static PipelineStage parseStage(String operator, Object spec) {
        switch (operator) {
            case MatchStage.OPERATOR:
                return new MatchStage(Filter.of((Map<String, ?>) requireMap(operator, spec)));
            case GroupStage.OPERATOR:
                return parseGroup((Map<String, ?>) requireMap(operator, spec));
            case SortStage.OPERATOR:
                return parseSort((Map<String, ?>) requireMap(operator, spec));
            default:
                return new PassThroughStage(operator, spec);
        }
    }

    private static GroupStage parseGroup(Map<String, ?> spec) {
        if (!spec.containsKey(GroupStage.ID_FIELD)) {
            throw new UnsupportedQueryException(GroupStage.OPERATOR + " requires an " + GroupStage.ID_FIELD + " key");
        }

        Object key = spec.get(GroupStage.ID_FIELD);
        String keyField;
        if (key == null) {
            keyField = null;
        } else if ((key instanceof String) && ((String) key).startsWith("$") && (((String) key).length() > 1)) {
            keyField = ((String) key).substring(1);
        } else {
            throw new UnsupportedQueryException("Unsupported group key: " + key + " (expected null or \"$field\")");
        }

        if (spec.size() == 1) {
            return GroupStage.of(keyField, GroupStage.DEFAULT_COUNT_FIELD);
        }
        if (spec.size() > 2) {
            throw new UnsupportedQueryException("Only a single count accumulator is supported in " + GroupStage.OPERATOR);
        }

        for (Map.Entry<String, ?> entry : spec.entrySet()) {
            if (GroupStage.ID_FIELD.equals(entry.getKey())) {
                continue;
            }
            if (!isCountAccumulator(entry.getValue())) {
                throw new UnsupportedQueryException("Unsupported accumulator " + entry.getKey() + ": " + entry.getValue() + " (only {\"$sum\": 1} is supported)");
            }
            return GroupStage.of(keyField, entry.getKey());
        }
        throw new IllegalStateException("unreachable");
    }

    private static SortStage parseSort(Map<String, ?> spec) {
        if (spec.size() != 1) {
            throw new UnsupportedQueryException(SortStage.OPERATOR + " supports exactly one field, got " + spec.keySet());
        }
        Map.Entry<String, ?> entry = spec.entrySet().iterator().next();
        if (!(entry.getValue() instanceof Number)
            || (((Number) entry.getValue()).doubleValue() != ((Number) entry.getValue()).intValue())) {
            throw new UnsupportedQueryException("Unsupported sort direction: " + entry.getValue());
        }
        return new SortStage(Sort.of(entry.getKey(), SortDirection.fromNative(((Number) entry.getValue()).intValue())));
    }

    private static boolean isCountAccumulator(Object value) {
        if (!(value instanceof Map) || (((Map<?, ?>) value).size() != 1)) {
            return false;
        }
        Object sum = ((Map<?, ?>) value).get(SUM_OPERATOR);
        return (sum instanceof Number) && (((Number) sum).doubleValue() == 1.0);
    }

    private static Map<?, ?> requireMap(String operator, Object spec) {
        if (!(spec instanceof Map)) {
            throw new UnsupportedQueryException(operator + " expects a mapping, got: " + spec);
        }
        return (Map<?, ?>) spec;
    }

    public static final class Builder {

        private final List<PipelineStage> stages = new ArrayList<>();

        private Builder() {
        }

        public Builder match(@NonNull Filter filter) {
            this.stages.add(new MatchStage(filter));
            return this;
        }

        public Builder groupAll() {
            this.stages.add(GroupStage.all());
            return this;
        }

        public Builder group(@NonNull String keyField) {
            this.stages.add(GroupStage.by(keyField));
            return this;
        }

        public Builder sort(@NonNull String field, @NonNull SortDirection direction) {
            this.stages.add(new SortStage(Sort.of(field, direction)));
            return this;
        }

        public Builder stage(@NonNull PipelineStage stage) {
            this.stages.add(stage);
            return this;
        }

        public Pipeline build() {
            return new Pipeline(new ArrayList<>(this.stages));
        }
    }
}
