package net.jobledger.core.model;

import java.time.Duration;
import java.time.Instant;

/** One ledger row (CRON_JOBS), shared by every process that registers the job name. */
public record CronJob(
        String name,
        long intervalMs,
        boolean enabled,
        Instant lastRunAt,          // null = never run, immediately due
        Long lastRunDurationMs,
        String lastError,
        Instant updatedAt
) {
    public boolean neverRun() {
        return lastRunAt == null;
    }

    /** Same predicate the claim statement evaluates, for read-side views only. */
    public boolean dueAt(Instant now) {
        if (!enabled) return false;
        return lastRunAt == null || !lastRunAt.isAfter(now.minus(Duration.ofMillis(intervalMs)));
    }
}
