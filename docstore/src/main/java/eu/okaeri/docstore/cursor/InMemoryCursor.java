package eu.okaeri.docstore.cursor;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentValueUtils;
import eu.okaeri.docstore.filter.Filter;
import eu.okaeri.docstore.filter.FilterMatcher;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.SortDirection;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareForSort;
import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;
import static eu.okaeri.docstore.document.DocumentValueUtils.toParts;

/**
 * Cursor evaluated in memory over a snapshot supplier.
 * The supplier is invoked on every {@link #toList()}, so results are never stale.
 */
public class InMemoryCursor extends Cursor {

    private final Supplier<List<Document>> source;
    private final Filter filter;
    private final FilterMatcher matcher;

    public InMemoryCursor(@NonNull Supplier<List<Document>> source, @NonNull Filter filter, @NonNull FilterMatcher matcher) {
        this.source = source;
        this.filter = filter;
        this.matcher = matcher;
    }

    @Override
    public List<Document> toList() {
        Stream<Document> stream = this.source.get().stream();

        // Apply WHERE
        if (!this.filter.isEmpty()) {
            stream = stream.filter(document -> this.matcher.matches(document, this.filter));
        }

        // Apply ORDER BY (stable)
        if (this.hasSort()) {
            List<Document> matched = stream.collect(Collectors.toCollection(ArrayList::new));
            matched.sort(comparator(this.getSort(), matched));
            stream = matched.stream();
        }

        // Apply SKIP
        if (this.hasSkip()) {
            stream = stream.skip(this.getSkip());
        }

        // Apply LIMIT
        if (this.hasLimit()) {
            stream = stream.limit(this.getLimit());
        }

        return stream.collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Comparator for a single sort key over the given documents.
     * <p>
     * Missing values sort as the zero value ("", 0 or false) of the first
     * document holding the key, or before everything when no zero value applies.
     * The substitute is fixed for the whole sort, so the order stays total.
     *
     * @param sort      the sort key and direction
     * @param documents the documents about to be sorted
     * @return the comparator
     */
    public static Comparator<Document> comparator(@NonNull Sort sort, @NonNull List<Document> documents) {
        List<String> parts = toParts(sort.getField());
        Object missingValue = documents.stream()
            .map(document -> extractValue(document, parts))
            .filter(Objects::nonNull)
            .findFirst()
            .map(DocumentValueUtils::zeroValueLike)
            .orElse(null);

        Comparator<Document> comparator = (document1, document2) -> compareForSort(
            valueOr(extractValue(document1, parts), missingValue),
            valueOr(extractValue(document2, parts), missingValue));
        return (sort.getDirection() == SortDirection.DESC) ? comparator.reversed() : comparator;
    }

    private static Object valueOr(Object value, Object missingValue) {
        return (value == null) ? missingValue : value;
    }
}
