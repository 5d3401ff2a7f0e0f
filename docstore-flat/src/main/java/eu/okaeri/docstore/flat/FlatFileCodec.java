package eu.okaeri.docstore.flat;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import eu.okaeri.docstore.document.Document;
import lombok.NonNull;

import java.lang.reflect.Type;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON codec for collection files: a pretty-printed array of plain objects.
 * <p>
 * Integral numbers read back as {@code Long}, others as {@code Double}.
 * Timestamps and UUIDs are written as their canonical string.
 */
public class FlatFileCodec {

    private static final Type LIST_TYPE = new TypeToken<List<Object>>() {}.getType();

    private final Gson gson;

    public FlatFileCodec() {
        this(new GsonBuilder());
    }

    public FlatFileCodec(@NonNull GsonBuilder builder) {
        this.gson = builder
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .setNumberToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .registerTypeHierarchyAdapter(TemporalAccessor.class, (JsonSerializer<TemporalAccessor>) (src, type, context) -> new JsonPrimitive(src.toString()))
            .registerTypeHierarchyAdapter(Date.class, (JsonSerializer<Date>) (src, type, context) -> new JsonPrimitive(src.toInstant().toString()))
            .registerTypeAdapter(UUID.class, (JsonSerializer<UUID>) (src, type, context) -> new JsonPrimitive(src.toString()))
            .create();
    }

    /**
     * @throws JsonParseException when the text is not a JSON array of objects
     */
    public List<Document> decode(@NonNull String json) {
        if (json.trim().isEmpty()) {
            return new ArrayList<>();
        }

        List<Object> elements = this.gson.fromJson(json, LIST_TYPE);
        if (elements == null) {
            return new ArrayList<>();
        }

        List<Document> documents = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (!(element instanceof Map)) {
                throw new JsonParseException("Expected a JSON object, got: " + element);
            }
            documents.add((Document) Document.copyValue(element));
        }
        return documents;
    }

    public String encode(@NonNull List<? extends Map<String, ?>> documents) {
        return this.gson.toJson(documents);
    }
}
