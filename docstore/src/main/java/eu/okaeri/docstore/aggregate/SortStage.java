package eu.okaeri.docstore.aggregate;

import eu.okaeri.docstore.filter.Sort;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class SortStage extends PipelineStage {

    public static final String OPERATOR = "$sort";

    private final Sort sort;

    public SortStage(@NonNull Sort sort) {
        this.sort = sort;
    }

    @Override
    public String getOperator() {
        return OPERATOR;
    }
}
