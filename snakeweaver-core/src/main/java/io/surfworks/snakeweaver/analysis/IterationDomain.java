package io.surfworks.snakeweaver.analysis;

import io.surfworks.snakeweaver.value.ElementType;

/**
 * Classified iteration source of a for loop.
 *
 * @param kind        domain kind
 * @param elementType element type, null when not knowable
 * @param enumerated  true if the source was wrapped in {@code enumerate}
 * @param offset      enumeration start, 0 when not enumerated
 * @param unpackArity number of names the loop target unpacks each element into, 1 for a plain name
 */
public record IterationDomain(DomainKind kind, ElementType elementType, boolean enumerated, long offset,
                              int unpackArity) {

    public boolean isConvertible() {
        return kind.isConvertible();
    }
}
