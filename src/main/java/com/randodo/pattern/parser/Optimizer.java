package com.randodo.pattern.parser;

/** Dead-code elimination for freshly compiled trees. */
public final class Optimizer {

    private Optimizer() {}

    /**
     * Optimizes {@code root} in place, depth first, and returns it.
     * Series members that can only produce "" are removed; nothing else changes,
     * so the set of strings the tree can produce stays the same.
     */
    public static Generator.Node optimize(Generator.Node root) {
        root.optimize();
        return root;
    }
}
