package eu.okaeri.docstore.cursor;

import eu.okaeri.docstore.document.Document;
import lombok.NonNull;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Cursor that forwards its state to a backend cursor and maps every result.
 */
public class MappedCursor extends Cursor {

    private final Cursor delegate;
    private final UnaryOperator<Document> mapper;

    public MappedCursor(@NonNull Cursor delegate, @NonNull UnaryOperator<Document> mapper) {
        this.delegate = delegate;
        this.mapper = mapper;
        delegate.copyStateTo(this);
    }

    @Override
    public List<Document> toList() {
        this.copyStateTo(this.delegate);
        return this.delegate.toList().stream()
            .map(this.mapper)
            .collect(Collectors.toList());
    }
}
