package eu.okaeri.docstore.result;

import lombok.Value;

@Value
public class DeleteResult {

    long deletedCount;
}
