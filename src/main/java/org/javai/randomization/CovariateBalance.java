package org.javai.randomization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-group counts of each covariate value in an allocation.
 *
 * @param counts group label to (covariate value to count), in declared group order
 */
public record CovariateBalance(Map<String, Map<Object, Integer>> counts) {

    public CovariateBalance {
        Objects.requireNonNull(counts, "counts must not be null");
        Map<String, Map<Object, Integer>> copy = new LinkedHashMap<>();
        counts.forEach((group, byValue) ->
                copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(byValue))));
        counts = Collections.unmodifiableMap(copy);
    }

    /**
     * Number of members of {@code group} carrying {@code value}.
     */
    public int count(String group, Object value) {
        Map<Object, Integer> byValue = counts.get(group);
        return byValue == null ? 0 : byValue.getOrDefault(value, 0);
    }

    /**
     * Every covariate value seen in any group.
     */
    public Set<Object> values() {
        Set<Object> values = new LinkedHashSet<>();
        counts.values().forEach(byValue -> values.addAll(byValue.keySet()));
        return Collections.unmodifiableSet(values);
    }

    /**
     * Largest minus smallest per-group count of one covariate value, groups without the
     * value counting as zero.
     */
    public int spread(Object value) {
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        for (String group : counts.keySet()) {
            int count = count(group, value);
            max = Math.max(max, count);
            min = Math.min(min, count);
        }
        return counts.isEmpty() ? 0 : max - min;
    }
}
