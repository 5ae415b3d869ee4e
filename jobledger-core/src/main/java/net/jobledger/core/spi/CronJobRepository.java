package net.jobledger.core.spi;

import net.jobledger.core.model.CronJob;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CronJobRepository {
    /**
     * Conditional claim: sets LAST_RUN_AT to the ledger's current time only when the row is
     * enabled and LAST_RUN_AT is null or at least {@code interval} old by that same time.
     * One statement; the affected row count is the result.
     * <p>
     * "Now" is read from the store, never from the caller, so processes with skewed clocks
     * still agree on whether a cycle has been taken.
     */
    boolean tryClaim(String name, Duration interval) throws Exception;

    /** Inserts an enabled row if absent, otherwise touches only INTERVAL_MS and UPDATED_AT. */
    void upsert(String name, long intervalMs, Instant now) throws Exception;

    /** Post-run write: duration, and LAST_ERROR (null on success). */
    void recordRun(String name, long durationMs, String lastError, Instant now) throws Exception;

    /** @return false when no row exists for {@code name} */
    boolean setEnabled(String name, boolean enabled, Instant now) throws Exception;

    Optional<CronJob> findByName(String name) throws Exception;

    List<CronJob> findAll() throws Exception;
}
