package com.randodo.pattern.parser;

import java.util.Random;

/** {@link RandomSource} backed by {@link java.util.Random}. */
public final class PlainRandomSource implements RandomSource {
    private final Random random;

    public PlainRandomSource() {
        this(new Random());
    }

    public PlainRandomSource(long seed) {
        this(new Random(seed));
    }

    public PlainRandomSource(Random random) {
        if (random == null) throw new IllegalArgumentException("random is null");
        this.random = random;
    }

    @Override
    public int next() {
        return random.nextInt(Integer.MAX_VALUE);
    }

    /**
     * One independent source per node, each seeded from {@code master}.
     * A fixed master seed makes a whole compiled file reproducible.
     */
    public static RandomSource.Factory seededFrom(Random master) {
        return () -> new PlainRandomSource(master.nextLong());
    }
}
