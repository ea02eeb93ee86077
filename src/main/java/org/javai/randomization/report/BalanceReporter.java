package org.javai.randomization.report;

import org.javai.randomization.BalanceReport;
import org.javai.randomization.DataIntegrityException;

/**
 * Receives balance summaries for observation.
 * Implementations might write log lines, emit metrics, or collect reports in tests.
 */
public interface BalanceReporter {

	/**
	 * Reports the group sizes of an allocation.
	 */
	void report(BalanceReport report);

	/**
	 * Reports an allocation that failed an integrity check, just before the violation is thrown.
	 *
	 * @param violation the violation about to be raised
	 */
	default void reportIntegrityViolation(DataIntegrityException violation) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static BalanceReporter noOp() {
		return report -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static BalanceReporter composite(BalanceReporter... reporters) {
		return CompositeBalanceReporter.of(reporters);
	}
}
