package org.javai.randomization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The result of one strategy call: every declared group, in declared order, mapped to the
 * participants assigned to it, in assignment order.
 *
 * <p>Allocations are immutable. Each strategy call builds a fresh one; the engine keeps no
 * reference to it.</p>
 *
 * @param assignments group label to ordered members
 * @param <P> the participant identifier type
 */
public record Allocation<P>(Map<String, List<P>> assignments) {

    /**
     * Canonical constructor with validation.
     */
    public Allocation {
        Objects.requireNonNull(assignments, "assignments must not be null");
        Map<String, List<P>> copy = new LinkedHashMap<>();
        assignments.forEach((group, members) -> {
            Objects.requireNonNull(group, "group must not be null");
            Objects.requireNonNull(members, "members of " + group + " must not be null");
            copy.put(group, List.copyOf(members));
        });
        assignments = Collections.unmodifiableMap(copy);
    }

    /**
     * Group labels in declared order.
     */
    public List<String> groups() {
        return List.copyOf(assignments.keySet());
    }

    /**
     * Members of a group, in the order they were assigned.
     *
     * @throws IllegalArgumentException if the group is not part of this allocation
     */
    public List<P> members(String group) {
        List<P> members = assignments.get(group);
        if (members == null) {
            throw new IllegalArgumentException("unknown group: " + group);
        }
        return members;
    }

    /**
     * Number of members per group, in declared group order.
     */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        assignments.forEach((group, members) -> sizes.put(group, members.size()));
        return Collections.unmodifiableMap(sizes);
    }

    /**
     * Total number of assignments across all groups.
     */
    public int totalAssigned() {
        int total = 0;
        for (List<P> members : assignments.values()) {
            total += members.size();
        }
        return total;
    }

    /**
     * All assigned participants, group by group in declared order.
     */
    public List<P> participants() {
        List<P> all = new ArrayList<>(totalAssigned());
        assignments.values().forEach(all::addAll);
        return all;
    }
}
