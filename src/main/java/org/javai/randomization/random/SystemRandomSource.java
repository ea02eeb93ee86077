package org.javai.randomization.random;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * A non-deterministic {@link RandomSource}. Each instance, including every child, draws
 * from its own {@link SecureRandom}.
 */
public final class SystemRandomSource implements RandomSource {

    private final Random random;

    public SystemRandomSource() {
        this.random = new SecureRandom();
    }

    @Override
    public void shuffle(List<?> items) {
        Objects.requireNonNull(items, "items must not be null");
        Collections.shuffle(items, random);
    }

    @Override
    public OptionalLong seed() {
        return OptionalLong.empty();
    }

    @Override
    public RandomSource createChild(String name) {
        return new SystemRandomSource();
    }

    @Override
    public String toString() {
        return "SystemRandomSource";
    }
}
