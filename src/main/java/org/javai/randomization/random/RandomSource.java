package org.javai.randomization.random;

import java.util.List;
import java.util.OptionalLong;

/**
 * The source of every random draw an engine makes.
 *
 * <p>Each engine owns its own source; nothing here touches process-wide random state.
 * A {@link SeededRandomSource} replays the same draws for the same seed, a
 * {@link SystemRandomSource} draws from system entropy.</p>
 */
public interface RandomSource {

    /**
     * Permutes the list in place, uniformly at random.
     */
    void shuffle(List<?> items);

    /**
     * The seed this source was created with, if it is deterministic.
     */
    OptionalLong seed();

    /**
     * Creates an independent source. A seeded parent derives the child's seed from its own
     * seed and {@code name}, so children are reproducible as well.
     *
     * @param name distinguishes sibling children
     */
    RandomSource createChild(String name);

    /**
     * A deterministic source for the given seed.
     */
    static RandomSource seeded(long seed) {
        return new SeededRandomSource(seed);
    }

    /**
     * A non-deterministic source backed by system entropy.
     */
    static RandomSource system() {
        return new SystemRandomSource();
    }
}
