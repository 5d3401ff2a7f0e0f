package eu.okaeri.docstore.aggregate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Groups rows and counts the members of each group.
 * <p>
 * With no key field the whole input forms one group, emitted as
 * {@code {_id: null, count: N}}. With a key field one row is emitted per
 * distinct value, {@code {_id: value, count: N}}.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class GroupStage extends PipelineStage {

    public static final String OPERATOR = "$group";
    public static final String ID_FIELD = "_id";
    public static final String DEFAULT_COUNT_FIELD = "count";

    private final String keyField;
    private final String countField;

    private GroupStage(String keyField, @NonNull String countField) {
        this.keyField = keyField;
        this.countField = countField;
    }

    public static GroupStage all() {
        return new GroupStage(null, DEFAULT_COUNT_FIELD);
    }

    public static GroupStage by(@NonNull String keyField) {
        return new GroupStage(keyField, DEFAULT_COUNT_FIELD);
    }

    public static GroupStage of(String keyField, @NonNull String countField) {
        return new GroupStage(keyField, countField);
    }

    public boolean isGroupAll() {
        return this.keyField == null;
    }

    @Override
    public String getOperator() {
        return OPERATOR;
    }
}
