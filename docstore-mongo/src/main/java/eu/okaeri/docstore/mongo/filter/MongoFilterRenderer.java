package eu.okaeri.docstore.mongo.filter;

import com.mongodb.client.model.Filters;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.FilterMatcher;
import eu.okaeri.docstore.mongo.MongoDocuments;
import lombok.Getter;
import lombok.NonNull;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders store filters to driver filters.
 * <p>
 * Equalities become {@code $eq} conditions. The free-text term becomes a
 * case-insensitive, regex-quoted {@code $or} over the text fields, so no
 * native text index is needed and matching follows the in-memory rules.
 */
@Getter
public class MongoFilterRenderer {

    private final List<String> textFields;

    public MongoFilterRenderer() {
        this(FilterMatcher.TEXT_FIELDS);
    }

    public MongoFilterRenderer(@NonNull List<String> textFields) {
        this.textFields = textFields;
    }

    public Bson render(@NonNull Filter filter) {
        List<Bson> conditions = new ArrayList<>();

        for (Map.Entry<String, Object> equality : filter.getEqualities().entrySet()) {
            conditions.add(Filters.eq(equality.getKey(), MongoDocuments.toBsonValue(equality.getValue())));
        }

        if (filter.hasText()) {
            conditions.add(this.renderText(this.textFields, filter.getTextTerm()));
        }

        if (conditions.isEmpty()) {
            return Filters.empty();
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        return Filters.and(conditions);
    }

    /**
     * Case-insensitive substring match of a term against any of the fields.
     */
    public Bson renderText(@NonNull List<String> fields, @NonNull String term) {
        String pattern = quoteRegex(term);
        List<Bson> alternatives = fields.stream()
            .map(field -> Filters.regex(field, pattern, "i"))
            .collect(Collectors.toList());
        return (alternatives.size() == 1) ? alternatives.get(0) : Filters.or(alternatives);
    }

    /**
     * Escape every regex metacharacter so the term matches literally.
     */
    public static String quoteRegex(@NonNull String term) {
        StringBuilder out = new StringBuilder(term.length() + 8);
        for (char character : term.toCharArray()) {
            if ("\\^$.|?*+()[]{}-/".indexOf(character) >= 0) {
                out.append('\\');
            }
            out.append(character);
        }
        return out.toString();
    }
}
