package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.exception.UnsupportedQueryException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SortDirection {

    ASC(1),
    DESC(-1);

    private final int nativeValue;

    public static SortDirection fromNative(int value) {
        if (value == 1) {
            return ASC;
        }
        if (value == -1) {
            return DESC;
        }
        throw new UnsupportedQueryException("Unsupported sort direction: " + value + " (expected 1 or -1)");
    }
}
