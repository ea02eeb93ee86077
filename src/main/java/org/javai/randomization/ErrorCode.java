package org.javai.randomization;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a kind of randomization error.
 *
 * @param namespace The error family (e.g., "config", "lookup", "integrity")
 * @param name The specific error within that family (e.g., "block_size", "covariate")
 */
public record ErrorCode(String namespace, String name) {

    public ErrorCode {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /**
     * Creates an ErrorCode with the given namespace and name.
     */
    public static ErrorCode of(String namespace, String name) {
        return new ErrorCode(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
