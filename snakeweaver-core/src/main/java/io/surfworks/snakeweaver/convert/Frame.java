package io.surfworks.snakeweaver.convert;

import io.surfworks.snakeweaver.value.Undefined;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local variables of one function activation.
 */
final class Frame {

    private final Map<String, Object> locals;

    Frame() {
        this.locals = new LinkedHashMap<>();
    }

    private Frame(Map<String, Object> locals) {
        this.locals = new LinkedHashMap<>(locals);
    }

    /**
     * @throws UnboundVariableException if the name is unbound
     */
    Object get(String name) {
        if (!locals.containsKey(name)) {
            throw new UnboundVariableException(name);
        }
        return locals.get(name);
    }

    /**
     * Value of the name, or {@link Undefined#INSTANCE} if unbound.
     */
    Object lookup(String name) {
        return locals.containsKey(name) ? locals.get(name) : Undefined.INSTANCE;
    }

    boolean isBound(String name) {
        return locals.containsKey(name);
    }

    /**
     * Binds the name. Binding {@link Undefined#INSTANCE} unbinds it.
     */
    void assign(String name, Object value) {
        if (value instanceof Undefined) {
            locals.remove(name);
        } else {
            locals.put(name, value);
        }
    }

    void assignAll(List<String> names, List<Object> values) {
        for (int i = 0; i < names.size(); i++) {
            assign(names.get(i), values.get(i));
        }
    }

    List<Object> values(List<String> names) {
        List<Object> out = new ArrayList<>(names.size());
        for (String name : names) {
            out.add(lookup(name));
        }
        return out;
    }

    /**
     * Copy whose assignments do not affect this frame.
     */
    Frame child() {
        return new Frame(locals);
    }

    @Override
    public String toString() {
        return "Frame" + locals.keySet();
    }
}
