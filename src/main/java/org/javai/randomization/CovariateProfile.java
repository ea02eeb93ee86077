package org.javai.randomization;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A composite covariate value combining several named dimensions.
 *
 * <p>Minimization compares covariate values as a whole, so two participants only count
 * against each other when every dimension matches. Use a profile when a trial balances on
 * more than one characteristic:
 *
 * <pre>{@code
 * Map<String, CovariateProfile> covariates = Map.of(
 *     "P1", CovariateProfile.of("sex", "F", "age", "old"),
 *     "P2", CovariateProfile.of("sex", "M", "age", "old"));
 * randomizer.minimization(covariates);
 * }</pre>
 *
 * <p>Dimensions should have bounded cardinality. A dimension with a distinct value per
 * participant makes every profile unique and minimization degenerates to plain round robin.
 *
 * @param dimensions dimension name to value, ordered by name
 */
public record CovariateProfile(Map<String, String> dimensions) {

    /**
     * Canonical constructor with validation.
     */
    public CovariateProfile {
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        if (dimensions.isEmpty()) {
            throw new IllegalArgumentException("dimensions must not be empty");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        dimensions.forEach((name, value) -> {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            sorted.put(name, value);
        });
        dimensions = Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * Creates a profile from alternating name/value pairs.
     *
     * @param namesAndValues {@code name1, value1, name2, value2, ...}
     */
    public static CovariateProfile of(String... namesAndValues) {
        Objects.requireNonNull(namesAndValues, "namesAndValues must not be null");
        if (namesAndValues.length == 0 || namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("namesAndValues must hold name/value pairs");
        }
        TreeMap<String, String> dimensions = new TreeMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Objects.requireNonNull(namesAndValues[i], "name must not be null");
            dimensions.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return new CovariateProfile(dimensions);
    }

    /**
     * The value of one dimension, or null if the profile does not carry it.
     */
    public String value(String name) {
        return dimensions.get(name);
    }
}
