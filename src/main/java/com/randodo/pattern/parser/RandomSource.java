package com.randodo.pattern.parser;

/**
 * Source of integers for the choice points of a generator tree.
 *
 * No range is promised: callers reduce the value themselves (see {@link #pick(int)}).
 */
public interface RandomSource {

    int next();

    /** Next draw reduced to [0, bound). {@code bound} must be at least 1. */
    default int pick(int bound) {
        return Math.floorMod(next(), bound);
    }

    /** Hands a source to each choice-point node while a pattern is compiled. */
    @FunctionalInterface
    interface Factory {
        RandomSource create();
    }
}
