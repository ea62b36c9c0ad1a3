package io.surfworks.qhal.job;

import java.util.Objects;

/**
 * Opaque, backend-issued job identifier.
 *
 * <p>Callers must not interpret the value; equality is by value.
 *
 * @param value the identifier as issued by the backend
 */
public record JobId(String value) {

    public JobId {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value cannot be blank");
        }
    }

    public static JobId of(String value) {
        return new JobId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
