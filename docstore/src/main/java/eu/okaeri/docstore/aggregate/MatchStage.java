package eu.okaeri.docstore.aggregate;

import eu.okaeri.docstore.filter.Filter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class MatchStage extends PipelineStage {

    public static final String OPERATOR = "$match";

    private final Filter filter;

    public MatchStage(@NonNull Filter filter) {
        this.filter = filter;
    }

    @Override
    public String getOperator() {
        return OPERATOR;
    }
}
