package org.javai.randomization;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StratifiedRandomizationTest {

    private static final List<String> PARTICIPANTS = List.of("P1", "P2", "P3", "P4", "P5", "P6", "P7", "P8");
    private static final List<String> GROUPS = List.of("Treatment", "Control");
    private static final List<String> YOUNG = List.of("P1", "P2", "P3", "P4");
    private static final List<String> OLD = List.of("P5", "P6", "P7", "P8");

    private static Map<String, List<String>> strata(List<String> young, List<String> old) {
        Map<String, List<String>> strata = new LinkedHashMap<>();
        strata.put("young", young);
        strata.put("old", old);
        return strata;
    }

    @Test
    void stratified_balancesWithinEachStratum() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        Allocation<String> allocation = randomizer.stratifiedRandomization(strata(YOUNG, OLD));

        for (String group : GROUPS) {
            List<String> members = allocation.members(group);
            assertThat(members).hasSize(4);
            assertThat(members.subList(0, 2)).isSubsetOf(YOUNG);
            assertThat(members.subList(2, 4)).isSubsetOf(OLD);
        }
        assertThat(allocation.participants()).containsExactlyInAnyOrderElementsOf(PARTICIPANTS);
    }

    @Test
    void stratified_sameSeedReproducesAllocation() {
        Allocation<String> first = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L)
                .stratifiedRandomization(strata(YOUNG, OLD));
        Allocation<String> second = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L)
                .stratifiedRandomization(strata(YOUNG, OLD));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void stratified_doesNotModifyCallerLists() {
        List<String> young = new ArrayList<>(YOUNG);
        List<String> old = new ArrayList<>(OLD);

        Randomizer.seeded(PARTICIPANTS, GROUPS, 42L).stratifiedRandomization(strata(young, old));

        assertThat(young).containsExactlyElementsOf(YOUNG);
        assertThat(old).containsExactlyElementsOf(OLD);
    }

    @Test
    void stratified_oddStrata_imbalanceIsSumOfStrata() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        Allocation<String> allocation = randomizer.stratifiedRandomization(
                strata(List.of("P1", "P2", "P3"), List.of("P4", "P5", "P6")));

        assertThat(allocation.sizes()).containsExactly(entry("Treatment", 4), entry("Control", 2));
    }

    @Test
    void stratified_excludesParticipantsOutsideEveryStratum() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        Allocation<String> allocation = randomizer.stratifiedRandomization(
                strata(List.of("P1", "P2", "P3"), List.of("P5", "P6", "P7")));

        assertThat(allocation.totalAssigned()).isEqualTo(6);
        assertThat(allocation.participants()).doesNotContain("P4", "P8");
    }

    @Test
    void stratified_noStrata_yieldsEmptyGroups() {
        Allocation<String> allocation = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L)
                .stratifiedRandomization(Map.of());

        assertThat(allocation.sizes()).containsExactly(entry("Treatment", 0), entry("Control", 0));
    }

    @Test
    void stratified_unknownParticipant_throwsLookupError() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        assertThatThrownBy(() -> randomizer.stratifiedRandomization(strata(YOUNG, List.of("P5", "P9"))))
                .isInstanceOf(ParticipantLookupException.class)
                .hasMessageContaining("stratum old references unknown participant P9")
                .extracting(e -> ((ParticipantLookupException) e).code().toString())
                .isEqualTo("lookup:stratum");
    }

    @Test
    void stratified_overlappingStrata_throwsConfigurationError() {
        Randomizer<String> randomizer = Randomizer.seeded(PARTICIPANTS, GROUPS, 42L);

        assertThatThrownBy(() -> randomizer.stratifiedRandomization(strata(YOUNG, List.of("P4", "P5"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("P4 appears in more than one stratum");
    }
}
