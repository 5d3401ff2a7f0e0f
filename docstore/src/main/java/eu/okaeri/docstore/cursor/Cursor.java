package eu.okaeri.docstore.cursor;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.Sort;
import eu.okaeri.docstore.filter.SortDirection;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deferred query descriptor materialized on demand.
 * <p>
 * Skip, limit and sort accumulate in any order before {@link #toList()};
 * the last call wins per axis. Materialization always applies
 * filter, then sort, then skip, then limit.
 */
@Getter
public abstract class Cursor {

    private int skip;
    private int limit;
    private Sort sort;

    public Cursor skip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip cannot be negative: " + skip);
        }
        this.skip = skip;
        return this;
    }

    /**
     * @param limit maximum number of documents, 0 for no limit
     */
    public Cursor limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
        this.limit = limit;
        return this;
    }

    public Cursor sort(@NonNull String field, @NonNull SortDirection direction) {
        return this.sort(Sort.of(field, direction));
    }

    public Cursor sort(Sort sort) {
        this.sort = sort;
        return this;
    }

    public boolean hasSkip() {
        return this.skip > 0;
    }

    public boolean hasLimit() {
        return this.limit > 0;
    }

    public boolean hasSort() {
        return this.sort != null;
    }

    /**
     * Run the query and return every selected document.
     */
    public abstract List<Document> toList();

    /**
     * Run the query and return at most {@code length} documents, 0 for all.
     */
    public List<Document> toList(int length) {
        List<Document> documents = this.toList();
        if ((length > 0) && (documents.size() > length)) {
            return new ArrayList<>(documents.subList(0, length));
        }
        return documents;
    }

    public Optional<Document> first() {
        return this.toList(1).stream().findFirst();
    }

    protected void copyStateTo(@NonNull Cursor target) {
        target.skip(this.skip).limit(this.limit).sort(this.sort);
    }
}
