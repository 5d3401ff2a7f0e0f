package eu.okaeri.docstore.mongo.filter;

import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Sorts;
import eu.okaeri.docstore.aggregate.GroupStage;
import eu.okaeri.docstore.aggregate.MatchStage;
import eu.okaeri.docstore.aggregate.PassThroughStage;
import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.aggregate.PipelineStage;
import eu.okaeri.docstore.aggregate.SortStage;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.SortDirection;
import eu.okaeri.docstore.mongo.MongoDocuments;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders store pipelines to driver aggregation stages.
 * Pass-through stages are forwarded verbatim.
 */
@RequiredArgsConstructor
public class MongoPipelineRenderer {

    private final @NonNull MongoFilterRenderer filterRenderer;

    public MongoPipelineRenderer() {
        this(new MongoFilterRenderer());
    }

    public List<Bson> render(@NonNull Pipeline pipeline) {
        List<Bson> stages = new ArrayList<>();
        for (PipelineStage stage : pipeline.getStages()) {
            stages.add(this.renderStage(stage));
        }
        return stages;
    }

    public Bson renderStage(@NonNull PipelineStage stage) {
        if (stage instanceof MatchStage) {
            return Aggregates.match(this.filterRenderer.render(((MatchStage) stage).getFilter()));
        }
        if (stage instanceof GroupStage) {
            GroupStage group = (GroupStage) stage;
            Object key = group.isGroupAll() ? null : ("$" + group.getKeyField());
            return Aggregates.group(key, Accumulators.sum(group.getCountField(), 1));
        }
        if (stage instanceof SortStage) {
            return Aggregates.sort(renderSort(((SortStage) stage).getSort()));
        }
        if (stage instanceof PassThroughStage) {
            PassThroughStage passThrough = (PassThroughStage) stage;
            return new org.bson.Document(passThrough.getOperator(), MongoDocuments.toBsonValue(passThrough.getSpecification()));
        }
        throw new IllegalArgumentException("Unknown pipeline stage: " + stage);
    }

    public static Bson renderSort(@NonNull Sort sort) {
        return (sort.getDirection() == SortDirection.DESC)
            ? Sorts.descending(sort.getField())
            : Sorts.ascending(sort.getField());
    }
}
