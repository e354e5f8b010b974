package com.randodo.pattern.parser;

/**
 * Deterministic source returning start, start+1, start+2, ...
 *
 * Used to make generation reproducible: with a fresh instance per node,
 * a character class cycles through its characters in order.
 */
public final class SequenceRandomSource implements RandomSource {
    private int current;

    public SequenceRandomSource() {
        this(0);
    }

    public SequenceRandomSource(int start) {
        this.current = start;
    }

    @Override
    public int next() {
        return current++;
    }

    public static RandomSource.Factory perNode() {
        return SequenceRandomSource::new;
    }

    /** Every node draws from the same counter. */
    public static RandomSource.Factory shared() {
        SequenceRandomSource shared = new SequenceRandomSource();
        return () -> shared;
    }
}
