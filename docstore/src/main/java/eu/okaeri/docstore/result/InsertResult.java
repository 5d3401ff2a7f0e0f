package eu.okaeri.docstore.result;

import lombok.Value;

@Value
public class InsertResult {

    /**
     * External identifier of the inserted document.
     */
    String id;
}
