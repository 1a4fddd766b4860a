package io.surfworks.snakeweaver.convert;

/**
 * Token issued by {@link ConversionRegistry#register} for one function.
 *
 * @param id   registry-unique id
 * @param name function name, for diagnostics
 */
public record CallableHandle(long id, String name) {

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
