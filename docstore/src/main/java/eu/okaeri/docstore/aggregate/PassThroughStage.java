package eu.okaeri.docstore.aggregate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Raw stage of a kind the in-memory engine does not interpret.
 * The file backend passes its input through unchanged; the network
 * backend forwards the stage verbatim to the driver.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class PassThroughStage extends PipelineStage {

    private final String operator;
    private final Object specification;

    public PassThroughStage(@NonNull String operator, Object specification) {
        this.operator = operator;
        this.specification = specification;
    }
}
