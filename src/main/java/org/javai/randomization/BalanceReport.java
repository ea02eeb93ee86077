package org.javai.randomization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Group sizes derived from an {@link Allocation}.
 *
 * @param sizes group label to member count, in declared group order
 */
public record BalanceReport(Map<String, Integer> sizes) {

    public BalanceReport {
        Objects.requireNonNull(sizes, "sizes must not be null");
        sizes = Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
    }

    /**
     * Builds the report for an allocation.
     */
    public static BalanceReport of(Allocation<?> allocation) {
        Objects.requireNonNull(allocation, "allocation must not be null");
        return new BalanceReport(allocation.sizes());
    }

    /**
     * Number of members in a group, or zero for a group not in the report.
     */
    public int sizeOf(String group) {
        return sizes.getOrDefault(group, 0);
    }

    public int total() {
        return sizes.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Difference between the largest and the smallest group. Round-robin strategies keep this at most 1.
     */
    public int spread() {
        if (sizes.isEmpty()) {
            return 0;
        }
        int max = sizes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        int min = sizes.values().stream().mapToInt(Integer::intValue).min().orElse(0);
        return max - min;
    }

    public boolean isBalanced() {
        return spread() <= 1;
    }

    @Override
    public String toString() {
        return "Group sizes: " + sizes;
    }
}
