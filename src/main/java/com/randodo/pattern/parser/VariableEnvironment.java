package com.randodo.pattern.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named, compiled patterns in definition order.
 *
 * Trees refer back into this map by name through {@link Generator.VariableReference},
 * so it has to outlive every tree compiled against it. Bindings are never removed;
 * defining a name again replaces the old tree.
 */
public class VariableEnvironment {
    private final Map<String, Generator.Node> vars = new LinkedHashMap<>();
    private volatile boolean frozen = false;

    public void define(String name, Generator.Node root) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name is empty");
        if (root == null) throw new IllegalArgumentException("root is null: " + name);
        if (frozen) {
            throw new IllegalStateException("Environment is frozen, cannot define: " + name);
        }
        vars.put(name, root);
    }

    /** @return the tree bound to {@code name}, or null */
    public Generator.Node lookup(String name) {
        return vars.get(name);
    }

    public boolean exists(String name) {
        return vars.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(vars.keySet());
    }

    public int size() {
        return vars.size();
    }

    /** Rejects every later {@link #define}. Generation may then run from several threads. */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
