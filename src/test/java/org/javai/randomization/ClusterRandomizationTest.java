package org.javai.randomization;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ClusterRandomizationTest {

    private static final List<String> PARTICIPANTS = List.of("P1", "P2", "P3", "P4", "P5", "P6", "P7", "P8");
    private static final List<String> GROUPS = List.of("Treatment", "Control");

    private static Map<String, List<String>> fourClusters() {
        Map<String, List<String>> clusters = new LinkedHashMap<>();
        clusters.put("cluster1", List.of("P1", "P2"));
        clusters.put("cluster2", List.of("P3", "P4"));
        clusters.put("cluster3", List.of("P5", "P6"));
        clusters.put("cluster4", List.of("P7", "P8"));
        return clusters;
    }

    @Test
    void cluster_fourClusters_twoPerGroup() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        Allocation<String> allocation = randomizer.clusterRandomization(fourClusters());

        assertThat(allocation.sizes()).containsExactly(entry("Treatment", 4), entry("Control", 4));
        assertThat(allocation.participants()).containsExactlyInAnyOrderElementsOf(PARTICIPANTS);
    }

    @Test
    void cluster_keepsClustersTogetherAndInOrder() {
        Map<String, List<String>> clusters = fourClusters();
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        Allocation<String> allocation = randomizer.clusterRandomization(clusters);

        for (List<String> members : clusters.values()) {
            String group = allocation.members("Treatment").contains(members.get(0)) ? "Treatment" : "Control";
            List<String> assigned = allocation.members(group);
            int first = assigned.indexOf(members.get(0));
            assertThat(assigned.get(first + 1)).isEqualTo(members.get(1));
        }
    }

    @Test
    void cluster_expansionFollowsClusterAssignment() {
        Allocation<String> byCluster = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L).clusterAssignment(fourClusters());
        Allocation<String> expanded = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L).clusterRandomization(fourClusters());

        for (String group : GROUPS) {
            List<String> expected = byCluster.members(group).stream()
                    .flatMap(name -> fourClusters().get(name).stream())
                    .toList();
            assertThat(expanded.members(group)).containsExactlyElementsOf(expected);
        }
    }

    @Test
    void clusterAssignment_clusterCountsDifferByAtMostOne() {
        Map<String, List<String>> clusters = new LinkedHashMap<>();
        clusters.put("a", List.of("P1", "P2", "P3"));
        clusters.put("b", List.of("P4"));
        clusters.put("c", List.of("P5", "P6", "P7", "P8"));

        Allocation<String> byCluster = Randomizer.seeded(PARTICIPANTS, GROUPS, 3L).clusterAssignment(clusters);

        assertThat(byCluster.sizes()).containsExactly(entry("Treatment", 2), entry("Control", 1));
        assertThat(byCluster.participants()).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void cluster_singleCluster_leavesSecondGroupEmpty() {
        Allocation<String> allocation = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L)
                .clusterRandomization(Map.of("all", PARTICIPANTS));

        assertThat(allocation.members("Treatment")).containsExactlyElementsOf(PARTICIPANTS);
        assertThat(allocation.members("Control")).isEmpty();
    }

    @Test
    void cluster_sameSeedReproducesAllocation() {
        Allocation<String> first = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L).clusterRandomization(fourClusters());
        Allocation<String> second = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L).clusterRandomization(fourClusters());

        assertThat(first).isEqualTo(second);
    }

    @Test
    void cluster_unknownParticipant_throwsLookupError() {
        Map<String, List<String>> clusters = fourClusters();
        clusters.put("cluster5", List.of("P9"));
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        assertThatThrownBy(() -> randomizer.clusterRandomization(clusters))
                .isInstanceOf(ParticipantLookupException.class)
                .extracting(e -> ((ParticipantLookupException) e).participant())
                .isEqualTo("P9");
    }

    @Test
    void cluster_sharedParticipant_throwsConfigurationError() {
        Map<String, List<String>> clusters = fourClusters();
        clusters.put("cluster5", List.of("P8"));
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        assertThatThrownBy(() -> randomizer.clusterRandomization(clusters))
                .isInstanceOf(ConfigurationException.class)
                .extracting(e -> ((ConfigurationException) e).code().toString())
                .isEqualTo("config:cluster");
    }
}
