package org.javai.randomization.report;

import org.javai.randomization.BalanceReport;
import org.javai.randomization.DataIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link BalanceReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the error is logged
 * and the remaining reporters still run.
 *
 * <pre>{@code
 * BalanceReporter reporter = CompositeBalanceReporter.builder()
 *     .add(new Log4jBalanceReporter())
 *     .addIf(metricsEnabled, new MetricsBalanceReporter("trial42"))
 *     .build();
 * }</pre>
 */
public final class CompositeBalanceReporter implements BalanceReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeBalanceReporter.class);

	private final List<BalanceReporter> reporters;

	private CompositeBalanceReporter(List<BalanceReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeBalanceReporter of(BalanceReporter... reporters) {
		return new CompositeBalanceReporter(Arrays.asList(reporters));
	}

	public static CompositeBalanceReporter of(Collection<? extends BalanceReporter> reporters) {
		return new CompositeBalanceReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(BalanceReport report) {
		for (BalanceReporter reporter : reporters) {
			try {
				reporter.report(report);
			} catch (RuntimeException e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportIntegrityViolation(DataIntegrityException violation) {
		for (BalanceReporter reporter : reporters) {
			try {
				reporter.reportIntegrityViolation(violation);
			} catch (RuntimeException e) {
				logReporterError("reportIntegrityViolation", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, BalanceReporter reporter, RuntimeException e) {
		log.warn("BalanceReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeBalanceReporter}.
	 */
	public static final class Builder {
		private final List<BalanceReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(BalanceReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 */
		public Builder addIf(boolean condition, BalanceReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeBalanceReporter build() {
			return new CompositeBalanceReporter(reporters);
		}
	}
}
