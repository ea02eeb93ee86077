package org.javai.randomization;

import java.util.Objects;

/**
 * Base type for every error raised while allocating participants.
 *
 * <p>All randomization errors are unchecked: they signal a violated precondition
 * (bad parameters, missing side mappings, a broken allocation) that the caller
 * must fix rather than retry.</p>
 */
public abstract class RandomizationException extends RuntimeException {

    private final ErrorCode code;

    protected RandomizationException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /**
     * The stable identifier of this error, e.g. {@code config:block_size}.
     */
    public ErrorCode code() {
        return code;
    }
}
