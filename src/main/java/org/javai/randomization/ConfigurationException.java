package org.javai.randomization;

/**
 * Thrown when an engine is constructed, or a strategy invoked, with invalid parameters:
 * too few groups, duplicate labels, a non-positive block size, and the like.
 */
public class ConfigurationException extends RandomizationException {

    public ConfigurationException(String name, String message) {
        super(ErrorCode.of("config", name), message);
    }
}
