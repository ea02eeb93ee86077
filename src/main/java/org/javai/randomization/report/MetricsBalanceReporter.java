package org.javai.randomization.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.randomization.BalanceReport;
import org.javai.randomization.DataIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports balance summaries as JSON lines via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"balance","timestamp":"2024-01-20T10:30:00Z","trackingKey":"trial42.balance","sizes":{"Treatment":4,"Control":4},"total":8,"spread":0}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jBalanceReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsBalanceReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsBalanceReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsBalanceReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsBalanceReporter implements BalanceReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.randomization.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;
	private final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Creates a MetricsBalanceReporter with no namespace and the default logger.
	 */
	public MetricsBalanceReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsBalanceReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsBalanceReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsBalanceReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsBalanceReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsBalanceReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(BalanceReport report) {
		Map<String, Object> event = newEvent("balance");
		event.put("sizes", report.sizes());
		event.put("total", report.total());
		event.put("spread", report.spread());
		emit(event);
	}

	@Override
	public void reportIntegrityViolation(DataIntegrityException violation) {
		Map<String, Object> event = newEvent("integrity_violation");
		event.put("code", violation.code().toString());
		event.put("message", violation.getMessage());
		event.put("offending", violation.offending().stream().map(String::valueOf).toList());
		emit(event);
	}

	String trackingKey(String eventType) {
		if (namespace == null) {
			return eventType;
		}
		return namespace + "." + eventType;
	}

	private Map<String, Object> newEvent(String eventType) {
		Map<String, Object> event = new LinkedHashMap<>();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", trackingKey(eventType));
		return event;
	}

	private void emit(Map<String, Object> event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize {} event", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
