package eu.okaeri.docstore.result;

import lombok.Value;

import java.util.List;

@Value
public class InsertManyResult {

    /**
     * External identifiers in input order.
     */
    List<String> ids;

    public int getInsertedCount() {
        return this.ids.size();
    }
}
