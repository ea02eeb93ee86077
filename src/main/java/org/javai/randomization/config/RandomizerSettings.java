package org.javai.randomization.config;

import org.javai.randomization.ConfigurationException;

import java.util.OptionalLong;

/**
 * Resolves engine settings from system properties and environment variables.
 *
 * <p>A system property wins over the environment variable. A blank value counts as unset.</p>
 */
public final class RandomizerSettings {

	public static final String SEED_PROPERTY = "javai.randomization.seed";
	public static final String SEED_ENV = "JAVAI_RANDOMIZATION_SEED";

	private RandomizerSettings() {
		// Utility class
	}

	/**
	 * The configured seed, or empty when neither the property nor the variable is set.
	 *
	 * @throws ConfigurationException if the configured value is not a whole number
	 */
	public static OptionalLong seed() {
		String value = resolveOptional(SEED_PROPERTY, SEED_ENV);
		if (value == null) {
			return OptionalLong.empty();
		}
		try {
			return OptionalLong.of(Long.parseLong(value.trim()));
		} catch (NumberFormatException e) {
			throw new ConfigurationException("seed",
				"seed must be a whole number, got '" + value + "' (set via '" + SEED_PROPERTY +
				"' or '" + SEED_ENV + "')");
		}
	}

	/**
	 * Resolves a value from a system property, falling back to an environment variable.
	 *
	 * @return the value, or null if neither is set
	 */
	static String resolveOptional(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value;
	}
}
