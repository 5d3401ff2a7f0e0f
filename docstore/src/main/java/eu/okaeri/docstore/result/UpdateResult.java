package eu.okaeri.docstore.result;

import lombok.Value;

@Value
public class UpdateResult {

    long matchedCount;
    long modifiedCount;

    public static UpdateResult none() {
        return new UpdateResult(0, 0);
    }
}
