package org.javai.randomization;

import org.javai.randomization.config.RandomizerSettings;
import org.javai.randomization.random.RandomSource;
import org.javai.randomization.report.BalanceCheck;
import org.javai.randomization.report.BalanceReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Allocates a fixed universe of participants to a fixed, ordered set of groups.
 *
 * <p>Each strategy method builds and returns a fresh {@link Allocation}. Round-robin dealing
 * sends the i-th item of a prepared sequence to group {@code i mod G}, so the first
 * {@code N mod G} groups receive one extra item.</p>
 *
 * <p>The engine keeps the participant order as mutable state: {@link #simpleRandomization()}
 * shuffles it in place, and the order-dependent strategies ({@link #blockRandomization},
 * {@link #permutedBlockRandomization}, {@link #minimization}) read whatever order is current.
 * The engine is not safe for concurrent use; give each caller its own {@link #fork()}.</p>
 *
 * <pre>{@code
 * Randomizer<String> randomizer = Randomizer.seeded(
 *     List.of("P1", "P2", "P3", "P4"), List.of("Treatment", "Control"), 42L);
 * Allocation<String> allocation = randomizer.blockRandomization(2);
 * randomizer.randomizationCheck(allocation);
 * }</pre>
 *
 * @param <P> the participant identifier type
 */
public final class Randomizer<P> {

    private static final Logger log = LoggerFactory.getLogger(Randomizer.class);

    private final List<P> participants;
    private final Set<P> universe;
    private final List<String> groups;
    private final RandomSource random;
    private final BalanceCheck balanceCheck;
    private int forks;

    private Randomizer(List<P> participants, List<String> groups, RandomSource random, BalanceCheck balanceCheck) {
        this.participants = new ArrayList<>(participants);
        this.universe = new HashSet<>(participants);
        this.groups = List.copyOf(groups);
        this.random = random;
        this.balanceCheck = balanceCheck;
    }

    /**
     * Creates an engine drawing from system entropy.
     */
    public static <P> Randomizer<P> of(List<P> participants, List<String> groups) {
        return builder(participants, groups).build();
    }

    /**
     * Creates an engine whose draws are fixed by {@code seed}.
     */
    public static <P> Randomizer<P> seeded(List<P> participants, List<String> groups, long seed) {
        return builder(participants, groups).seed(seed).build();
    }

    /**
     * Creates an engine seeded from {@link RandomizerSettings}, or unseeded if no seed is configured.
     */
    public static <P> Randomizer<P> fromEnvironment(List<P> participants, List<String> groups) {
        Builder<P> builder = builder(participants, groups);
        OptionalLong seed = RandomizerSettings.seed();
        if (seed.isPresent()) {
            builder.seed(seed.getAsLong());
        }
        return builder.build();
    }

    public static <P> Builder<P> builder(List<P> participants, List<String> groups) {
        return new Builder<>(participants, groups);
    }

    /**
     * The current participant order. Reflects shuffles made by {@link #simpleRandomization()}.
     */
    public List<P> participants() {
        return Collections.unmodifiableList(participants);
    }

    public List<String> groups() {
        return groups;
    }

    /**
     * Returns an engine over a copy of the current participant order, drawing from a child of
     * this engine's random source. Calls on the fork leave this engine's order and draw
     * sequence untouched; forks of a seeded engine are themselves reproducible.
     */
    public Randomizer<P> fork() {
        forks++;
        return new Randomizer<>(participants, groups, random.createChild("fork-" + forks), balanceCheck);
    }

    /**
     * Shuffles the stored participant order in place, then deals it round robin.
     */
    public Allocation<P> simpleRandomization() {
        random.shuffle(participants);
        return dealt("simple", participants);
    }

    /**
     * Shuffles consecutive blocks of {@code blockSize} participants independently, keeping
     * block order, then deals the result round robin. The final block may be shorter.
     * The stored order is not changed.
     *
     * @throws ConfigurationException if {@code blockSize < 1}
     */
    public Allocation<P> blockRandomization(int blockSize) {
        requireBlockSize(blockSize);
        List<P> sequence = new ArrayList<>(participants.size());
        for (List<P> block : partition(participants, blockSize)) {
            random.shuffle(block);
            sequence.addAll(block);
        }
        return dealt("block", sequence);
    }

    /**
     * Randomizes each stratum on its own, in map iteration order, and appends each stratum's
     * round-robin allocation to the running per-group lists.
     *
     * <p>Participants that appear in no stratum are left out of the result; covering the
     * universe is the caller's responsibility. The member lists passed in are not modified.</p>
     *
     * @param strata stratum name to members
     * @throws ParticipantLookupException if a stratum names a participant this engine does not know
     * @throws ConfigurationException if a participant appears in more than one stratum
     */
    public Allocation<P> stratifiedRandomization(Map<String, ? extends List<P>> strata) {
        Objects.requireNonNull(strata, "strata must not be null");
        requireDisjointKnownMembers("stratum", strata);

        Map<String, List<P>> combined = emptyGroups();
        strata.forEach((stratum, members) -> {
            List<P> shuffled = new ArrayList<>(members);
            random.shuffle(shuffled);
            deal(shuffled).forEach((group, assigned) -> combined.get(group).addAll(assigned));
            log.debug("Stratum [{}] dealt {} participant(s)", stratum, shuffled.size());
        });
        return finish("stratified", combined);
    }

    /**
     * Alias of {@link #minimization(Map)}.
     */
    public Allocation<P> covariateAdaptiveRandomization(Map<P, ?> covariates) {
        return minimize("covariate-adaptive", covariates);
    }

    /**
     * Assigns participants one at a time, in the stored order, each to the group holding the
     * fewest members with the same covariate value. Ties go to the group declared first.
     *
     * <p>Covariate values are compared with {@code equals}. Balance over several
     * characteristics requires a composite value such as {@link CovariateProfile}.</p>
     *
     * @throws ParticipantLookupException if a participant has no covariate entry
     */
    public Allocation<P> minimization(Map<P, ?> covariates) {
        return minimize("minimization", covariates);
    }

    /**
     * For every size in {@code blockSizes}, partitions the full stored order into consecutive
     * blocks of that size. All blocks from all sizes are shuffled and concatenated in the order
     * produced, then dealt round robin.
     *
     * <p>Because every size partitions the whole sequence, each participant appears once per
     * listed size.</p>
     *
     * @throws ConfigurationException if {@code blockSizes} is empty or holds a size below 1
     */
    public Allocation<P> permutedBlockRandomization(List<Integer> blockSizes) {
        Objects.requireNonNull(blockSizes, "blockSizes must not be null");
        if (blockSizes.isEmpty()) {
            throw new ConfigurationException("block_sizes", "blockSizes must not be empty");
        }
        for (Integer blockSize : blockSizes) {
            requireBlockSize(Objects.requireNonNull(blockSize, "block size must not be null"));
        }

        List<List<P>> blocks = new ArrayList<>();
        for (int blockSize : blockSizes) {
            blocks.addAll(partition(participants, blockSize));
        }
        List<P> sequence = new ArrayList<>(participants.size() * blockSizes.size());
        for (List<P> block : blocks) {
            random.shuffle(block);
            sequence.addAll(block);
        }
        return dealt("permuted-block", sequence);
    }

    /**
     * Shuffles the cluster names, deals them round robin, and expands each cluster into its
     * members. Members keep their order within a cluster; clusters keep the order in which
     * they were dealt to a group.
     *
     * @param clusters cluster name to members
     * @throws ParticipantLookupException if a cluster names a participant this engine does not know
     * @throws ConfigurationException if a participant appears in more than one cluster
     */
    public Allocation<P> clusterRandomization(Map<String, ? extends List<P>> clusters) {
        Allocation<String> byCluster = clusterAssignment(clusters);

        Map<String, List<P>> expanded = emptyGroups();
        byCluster.assignments().forEach((group, names) -> {
            for (String name : names) {
                expanded.get(group).addAll(clusters.get(name));
            }
        });
        return finish("cluster", expanded);
    }

    /**
     * The cluster-level allocation behind {@link #clusterRandomization(Map)}: group to the
     * names of the clusters dealt to it.
     */
    public Allocation<String> clusterAssignment(Map<String, ? extends List<P>> clusters) {
        Objects.requireNonNull(clusters, "clusters must not be null");
        requireDisjointKnownMembers("cluster", clusters);

        List<String> names = new ArrayList<>(clusters.keySet());
        random.shuffle(names);
        Allocation<String> allocation = new Allocation<>(deal(names));
        log.debug("cluster assignment: {} cluster(s) -> {}", names.size(), allocation.sizes());
        return allocation;
    }

    /**
     * Reports and returns the group sizes of an allocation.
     */
    public BalanceReport randomizationCheck(Allocation<?> allocation) {
        return balanceCheck.randomizationCheck(allocation);
    }

    private Allocation<P> minimize(String strategy, Map<P, ?> covariates) {
        Objects.requireNonNull(covariates, "covariates must not be null");
        for (P participant : participants) {
            if (!covariates.containsKey(participant)) {
                throw new ParticipantLookupException("covariate", participant,
                        "no covariate value for participant " + participant);
            }
        }

        Map<String, List<P>> assigned = emptyGroups();
        Map<String, Map<Object, Integer>> valueCounts = new HashMap<>();
        for (String group : groups) {
            valueCounts.put(group, new HashMap<>());
        }

        for (P participant : participants) {
            Object value = covariates.get(participant);
            String target = null;
            int lowest = Integer.MAX_VALUE;
            for (String group : groups) {
                int score = valueCounts.get(group).getOrDefault(value, 0);
                if (score < lowest) {
                    lowest = score;
                    target = group;
                }
            }
            assigned.get(target).add(participant);
            valueCounts.get(target).merge(value, 1, Integer::sum);
        }
        return finish(strategy, assigned);
    }

    private void requireDisjointKnownMembers(String kind, Map<String, ? extends List<P>> units) {
        Set<P> claimed = new HashSet<>();
        units.forEach((name, members) -> {
            Objects.requireNonNull(members, kind + " " + name + " must not be null");
            for (P member : members) {
                if (!universe.contains(member)) {
                    throw new ParticipantLookupException(kind, member,
                            kind + " " + name + " references unknown participant " + member);
                }
                if (!claimed.add(member)) {
                    throw new ConfigurationException(kind,
                            "participant " + member + " appears in more than one " + kind);
                }
            }
        });
    }

    private Allocation<P> dealt(String strategy, List<P> sequence) {
        return finish(strategy, deal(sequence));
    }

    private Allocation<P> finish(String strategy, Map<String, List<P>> assignments) {
        Allocation<P> allocation = new Allocation<>(assignments);
        log.debug("{} randomization: {} assignment(s) -> {}", strategy, allocation.totalAssigned(), allocation.sizes());
        return allocation;
    }

    private <T> Map<String, List<T>> deal(List<T> items) {
        Map<String, List<T>> dealt = emptyGroups();
        for (int i = 0; i < items.size(); i++) {
            dealt.get(groups.get(i % groups.size())).add(items.get(i));
        }
        return dealt;
    }

    private <T> Map<String, List<T>> emptyGroups() {
        Map<String, List<T>> empty = new LinkedHashMap<>();
        for (String group : groups) {
            empty.put(group, new ArrayList<>());
        }
        return empty;
    }

    private static <T> List<List<T>> partition(List<T> items, int blockSize) {
        List<List<T>> blocks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += blockSize) {
            blocks.add(new ArrayList<>(items.subList(start, Math.min(start + blockSize, items.size()))));
        }
        return blocks;
    }

    private static void requireBlockSize(int blockSize) {
        if (blockSize < 1) {
            throw new ConfigurationException("block_size", "block size must be >= 1, got " + blockSize);
        }
    }

    /**
     * Builder for a {@link Randomizer}. Validates participants and groups on {@link #build()}.
     */
    public static final class Builder<P> {
        private final List<P> participants;
        private final List<String> groups;
        private RandomSource randomSource;
        private BalanceReporter reporter = BalanceReporter.noOp();

        private Builder(List<P> participants, List<String> groups) {
            this.participants = Objects.requireNonNull(participants, "participants must not be null");
            this.groups = Objects.requireNonNull(groups, "groups must not be null");
        }

        /**
         * Fixes every draw of the engine. Replaces any source set with {@link #randomSource}.
         */
        public Builder<P> seed(long seed) {
            this.randomSource = RandomSource.seeded(seed);
            return this;
        }

        public Builder<P> randomSource(RandomSource randomSource) {
            this.randomSource = Objects.requireNonNull(randomSource, "randomSource must not be null");
            return this;
        }

        /**
         * Where {@link Randomizer#randomizationCheck} sends its reports. Defaults to a no-op reporter.
         */
        public Builder<P> reporter(BalanceReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Randomizer<P> build() {
            if (participants.isEmpty()) {
                throw new ConfigurationException("participants", "participants must not be empty");
            }
            Set<P> unique = new LinkedHashSet<>();
            for (P participant : participants) {
                Objects.requireNonNull(participant, "participant must not be null");
                if (!unique.add(participant)) {
                    throw new ConfigurationException("participants", "duplicate participant: " + participant);
                }
            }

            if (groups.size() < 2) {
                throw new ConfigurationException("groups", "at least two groups are required, got " + groups.size());
            }
            Set<String> labels = new HashSet<>();
            for (String group : groups) {
                Objects.requireNonNull(group, "group must not be null");
                if (group.isBlank()) {
                    throw new ConfigurationException("groups", "group labels must not be blank");
                }
                if (!labels.add(group)) {
                    throw new ConfigurationException("groups", "duplicate group: " + group);
                }
            }

            RandomSource source = randomSource != null ? randomSource : RandomSource.system();
            log.debug("Randomizer over {} participant(s) and groups {} using {}", participants.size(), groups, source);
            return new Randomizer<>(participants, groups, source, BalanceCheck.withReporter(reporter));
        }
    }
}
