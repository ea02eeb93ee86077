package org.javai.randomization;

import java.util.List;

/**
 * Thrown by {@link org.javai.randomization.report.BalanceCheck#verify} when an allocation
 * loses, duplicates or invents participants relative to the universe it was built from.
 */
public class DataIntegrityException extends RandomizationException {

    private final List<Object> offending;

    public DataIntegrityException(String name, List<?> offending, String message) {
        super(ErrorCode.of("integrity", name), message);
        this.offending = List.copyOf(offending);
    }

    /**
     * The participants that violate the check (missing, duplicated or unknown).
     */
    public List<Object> offending() {
        return offending;
    }
}
