package eu.okaeri.docstore.mongo;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Aggregates;
import eu.okaeri.docstore.aggregate.AggregationEngine;
import eu.okaeri.docstore.aggregate.GroupStage;
import eu.okaeri.docstore.aggregate.Pipeline;
import eu.okaeri.docstore.aggregate.PipelineStage;
import eu.okaeri.docstore.cursor.Cursor;
import eu.okaeri.docstore.cursor.InMemoryCursor;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.FilterMatcher;
import eu.okaeri.docstore.mongo.filter.MongoPipelineRenderer;
import lombok.NonNull;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cursor over an aggregation; skip, limit and sort run as trailing stages.
 * <p>
 * The server emits nothing for a group-all stage over zero documents, while the
 * file backend emits a single {@code {_id: null, count: 0}} row. When the server
 * returns no rows and the input of the first group-all stage is empty, the rest
 * of the pipeline is evaluated in memory from that empty input, so both
 * backends answer the same.
 */
public class MongoAggregateCursor extends Cursor {

    private static final AggregationEngine EMPTY_INPUT_ENGINE = new AggregationEngine();

    private final MongoCollection<org.bson.Document> collection;
    private final Pipeline pipeline;
    private final MongoPipelineRenderer renderer;

    public MongoAggregateCursor(@NonNull MongoCollection<org.bson.Document> collection, @NonNull Pipeline pipeline, @NonNull MongoPipelineRenderer renderer) {
        this.collection = collection;
        this.pipeline = pipeline;
        this.renderer = renderer;
    }

    public List<Bson> getStages() {
        List<Bson> stages = this.renderer.render(this.pipeline);
        if (this.hasSort()) {
            stages.add(Aggregates.sort(MongoPipelineRenderer.renderSort(this.getSort())));
        }
        if (this.hasSkip()) {
            stages.add(Aggregates.skip(this.getSkip()));
        }
        if (this.hasLimit()) {
            stages.add(Aggregates.limit(this.getLimit()));
        }
        return stages;
    }

    @Override
    public List<Document> toList() {
        List<Document> rows = this.collection.aggregate(this.getStages())
            .map(MongoDocuments::fromBson)
            .into(new ArrayList<>());
        if (!rows.isEmpty()) {
            return rows;
        }

        int groupAll = this.indexOfGroupAll();
        if ((groupAll < 0) || !this.isEmptyBefore(groupAll)) {
            return rows;
        }

        List<PipelineStage> stages = this.pipeline.getStages();
        Pipeline rest = Pipeline.of(stages.subList(groupAll, stages.size()).toArray(new PipelineStage[0]));
        List<Document> emulated = EMPTY_INPUT_ENGINE.execute(Collections.emptyList(), rest);

        Cursor cursor = new InMemoryCursor(() -> emulated, Filter.empty(), new FilterMatcher());
        if (this.hasSort()) {
            cursor.sort(this.getSort());
        }
        if (this.hasSkip()) {
            cursor.skip(this.getSkip());
        }
        if (this.hasLimit()) {
            cursor.limit(this.getLimit());
        }
        return cursor.toList();
    }

    private int indexOfGroupAll() {
        List<PipelineStage> stages = this.pipeline.getStages();
        for (int i = 0; i < stages.size(); i++) {
            PipelineStage stage = stages.get(i);
            if ((stage instanceof GroupStage) && ((GroupStage) stage).isGroupAll()) {
                return i;
            }
        }
        return -1;
    }

    private boolean isEmptyBefore(int stageIndex) {
        List<PipelineStage> stages = this.pipeline.getStages();
        List<Bson> prefix = this.renderer.render(Pipeline.of(stages.subList(0, stageIndex).toArray(new PipelineStage[0])));
        prefix.add(Aggregates.limit(1));
        return this.collection.aggregate(prefix).first() == null;
    }
}
