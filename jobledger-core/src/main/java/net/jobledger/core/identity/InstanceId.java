package net.jobledger.core.identity;

import java.util.Objects;
import java.util.UUID;

/**
 * Random per-process token. Only written to logs for correlation; never part of the
 * claim protocol.
 */
public final class InstanceId {
    private final String value;

    private InstanceId(String value) {
        this.value = value;
    }

    public static InstanceId random() {
        return new InstanceId(UUID.randomUUID().toString().substring(0, 8));
    }

    public static InstanceId of(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("instance id must not be blank");
        return new InstanceId(value);
    }

    public String value() {
        return value;
    }

    @Override public boolean equals(Object o) {
        return o instanceof InstanceId other && value.equals(other.value);
    }

    @Override public int hashCode() {
        return value.hashCode();
    }

    @Override public String toString() {
        return value;
    }
}
