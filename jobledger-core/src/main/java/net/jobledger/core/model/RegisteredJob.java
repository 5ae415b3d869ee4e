package net.jobledger.core.model;

import net.jobledger.core.spi.JobHandler;

import java.time.Duration;
import java.util.Objects;

public record RegisteredJob(
        String name,
        long intervalMs,
        JobHandler handler
) {
    public RegisteredJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        if (intervalMs <= 0) throw new IllegalArgumentException("intervalMs must be positive: " + name + "=" + intervalMs);
    }

    public static RegisteredJob of(String name, Duration interval, JobHandler handler) {
        Objects.requireNonNull(interval, "interval");
        return new RegisteredJob(name, interval.toMillis(), handler);
    }

    public Duration interval() {
        return Duration.ofMillis(intervalMs);
    }

    public RegisteredJob withIntervalMs(long newIntervalMs) {
        return new RegisteredJob(name, newIntervalMs, handler);
    }
}
