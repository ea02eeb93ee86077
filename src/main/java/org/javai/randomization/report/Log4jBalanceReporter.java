package org.javai.randomization.report;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.randomization.BalanceReport;
import org.javai.randomization.DataIntegrityException;

/**
 * Reports balance summaries using Log4j2.
 *
 * <p>Balanced allocations (group sizes differ by at most one) are logged at INFO,
 * anything wider at WARN. Integrity violations are logged at ERROR.</p>
 */
public class Log4jBalanceReporter implements BalanceReporter {

	private static final Marker BALANCE_MARKER = MarkerManager.getMarker("BALANCE");
	private static final Marker INTEGRITY_MARKER = MarkerManager.getMarker("INTEGRITY");

	private final Logger logger;

	/**
	 * Creates a Log4jBalanceReporter using the default logger name.
	 */
	public Log4jBalanceReporter() {
		this(LogManager.getLogger("org.javai.randomization.Balance"));
	}

	/**
	 * Creates a Log4jBalanceReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jBalanceReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jBalanceReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jBalanceReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(BalanceReport report) {
		logger.atLevel(levelFor(report))
			.withMarker(BALANCE_MARKER)
			.log("Group sizes: {} | total={}, spread={}", report.sizes(), report.total(), report.spread());
	}

	@Override
	public void reportIntegrityViolation(DataIntegrityException violation) {
		logger.atError()
			.withMarker(INTEGRITY_MARKER)
			.log("Allocation failed integrity check. Code: {}, Message: {}, Offending: {}",
				violation.code(),
				violation.getMessage(),
				violation.offending());
	}

	static Level levelFor(BalanceReport report) {
		return report.isBalanced() ? Level.INFO : Level.WARN;
	}
}
