package org.javai.randomization.report;

import org.javai.randomization.Allocation;
import org.javai.randomization.BalanceReport;
import org.javai.randomization.CovariateBalance;
import org.javai.randomization.DataIntegrityException;
import org.javai.randomization.ParticipantLookupException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Summarizes allocations and hands the summaries to a {@link BalanceReporter}.
 *
 * <pre>{@code
 * BalanceCheck check = BalanceCheck.withReporter(new Log4jBalanceReporter());
 * BalanceReport report = check.randomizationCheck(allocation);
 * check.verify(allocation, participants);
 * }</pre>
 */
public final class BalanceCheck {

	private final BalanceReporter reporter;

	private BalanceCheck(BalanceReporter reporter) {
		this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
	}

	/**
	 * A check that computes reports without emitting them anywhere.
	 */
	public static BalanceCheck silent() {
		return new BalanceCheck(BalanceReporter.noOp());
	}

	public static BalanceCheck withReporter(BalanceReporter reporter) {
		return new BalanceCheck(reporter);
	}

	/**
	 * Computes the group sizes of an allocation, reports them, and returns them.
	 */
	public BalanceReport randomizationCheck(Allocation<?> allocation) {
		BalanceReport report = BalanceReport.of(allocation);
		reporter.report(report);
		return report;
	}

	/**
	 * Checks that an allocation holds every member of {@code universe} exactly once and nothing
	 * else, then reports and returns its group sizes.
	 *
	 * <p>Duplicates are checked first, then participants unknown to the universe, then missing
	 * ones. The first violation found is reported and thrown.</p>
	 *
	 * @throws DataIntegrityException if the allocation loses, duplicates or invents participants
	 */
	public <P> BalanceReport verify(Allocation<P> allocation, Collection<P> universe) {
		Objects.requireNonNull(allocation, "allocation must not be null");
		Objects.requireNonNull(universe, "universe must not be null");

		Set<P> seen = new LinkedHashSet<>();
		Set<P> duplicates = new LinkedHashSet<>();
		for (P participant : allocation.participants()) {
			if (!seen.add(participant)) {
				duplicates.add(participant);
			}
		}
		if (!duplicates.isEmpty()) {
			throw reported(new DataIntegrityException("duplicate", new ArrayList<>(duplicates),
					duplicates.size() + " participant(s) assigned more than once: " + duplicates));
		}

		Set<P> expected = new LinkedHashSet<>(universe);
		List<P> unknown = new ArrayList<>();
		for (P participant : seen) {
			if (!expected.contains(participant)) {
				unknown.add(participant);
			}
		}
		if (!unknown.isEmpty()) {
			throw reported(new DataIntegrityException("unknown", unknown,
					unknown.size() + " assigned participant(s) not in the universe: " + unknown));
		}

		List<P> missing = new ArrayList<>();
		for (P participant : expected) {
			if (!seen.contains(participant)) {
				missing.add(participant);
			}
		}
		if (!missing.isEmpty()) {
			throw reported(new DataIntegrityException("missing", missing,
					missing.size() + " participant(s) never assigned: " + missing));
		}

		return randomizationCheck(allocation);
	}

	/**
	 * Counts each covariate value per group.
	 *
	 * @throws ParticipantLookupException if an assigned participant has no covariate entry
	 */
	public <P> CovariateBalance covariateBalance(Allocation<P> allocation, Map<P, ?> covariates) {
		Objects.requireNonNull(allocation, "allocation must not be null");
		Objects.requireNonNull(covariates, "covariates must not be null");

		Map<String, Map<Object, Integer>> counts = new LinkedHashMap<>();
		for (String group : allocation.groups()) {
			Map<Object, Integer> byValue = new LinkedHashMap<>();
			for (P participant : allocation.members(group)) {
				if (!covariates.containsKey(participant)) {
					throw new ParticipantLookupException("covariate", participant,
							"no covariate value for participant " + participant);
				}
				byValue.merge(covariates.get(participant), 1, Integer::sum);
			}
			counts.put(group, byValue);
		}
		return new CovariateBalance(counts);
	}

	private DataIntegrityException reported(DataIntegrityException violation) {
		reporter.reportIntegrityViolation(violation);
		return violation;
	}
}
