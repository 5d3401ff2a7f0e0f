package eu.okaeri.docstore.aggregate;

/**
 * One step of an aggregation pipeline.
 * Stages run in order, each consuming the previous stage's output.
 */
public abstract class PipelineStage {

    /**
     * Native stage operator, e.g. {@code $match}.
     */
    public abstract String getOperator();
}
