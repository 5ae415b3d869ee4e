package net.jobledger.core.service;

import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings ledger rows in line with the registered intervals without touching run history.
 * Each job is upserted in its own transaction so one bad row cannot hold back the rest.
 */
public final class LedgerReconciler {
    private static final Logger log = LoggerFactory.getLogger(LedgerReconciler.class);

    private final CronJobRepository cronJobs;
    private final TxRunner tx;
    private final Clock clock;
    private final InstanceId instanceId;

    public LedgerReconciler(CronJobRepository cronJobs, TxRunner tx, Clock clock, InstanceId instanceId) {
        this.cronJobs = cronJobs;
        this.tx = tx;
        this.clock = clock;
        this.instanceId = instanceId;
    }

    /** @return number of jobs reconciled successfully */
    public int reconcile(JobRegistry registry) {
        int ok = 0;
        for (RegisteredJob job : registry.jobs()) {
            try {
                tx.requiresNew(() -> {
                    cronJobs.upsert(job.name(), job.intervalMs(), clock.now());
                    return null;
                });
                ok++;
                log.debug("reconciled job={} intervalMs={} instance={}", job.name(), job.intervalMs(), instanceId);
            } catch (Exception e) {
                log.warn("reconcile failed job={} instance={} cause={}", job.name(), instanceId, e.toString(), e);
            }
        }
        log.info("ledger reconciled {}/{} jobs instance={}", ok, registry.size(), instanceId);
        return ok;
    }
}
