package org.javai.randomization.random;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * A {@link RandomSource} driven by a seeded {@link Random}. Two sources with the same seed
 * produce the same shuffles when called in the same sequence.
 */
public final class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public void shuffle(List<?> items) {
        Objects.requireNonNull(items, "items must not be null");
        Collections.shuffle(items, random);
    }

    @Override
    public OptionalLong seed() {
        return OptionalLong.of(seed);
    }

    @Override
    public RandomSource createChild(String name) {
        Objects.requireNonNull(name, "name must not be null");
        long childSeed = seed;
        for (char c : name.toCharArray()) {
            childSeed = childSeed * 31 + c;
        }
        return new SeededRandomSource(childSeed);
    }

    @Override
    public String toString() {
        return "SeededRandomSource{seed=" + seed + "}";
    }
}
