package net.jobledger.core.service;

import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/** Claim protocol entry point. A claim that cannot reach the ledger counts as not claimed. */
public final class ClaimService {
    private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

    private final CronJobRepository cronJobs;
    private final TxRunner tx;
    private final InstanceId instanceId;

    public ClaimService(CronJobRepository cronJobs, TxRunner tx, InstanceId instanceId) {
        this.cronJobs = cronJobs;
        this.tx = tx;
        this.instanceId = instanceId;
    }

    public boolean tryClaim(String name, long intervalMs) {
        Duration interval = Duration.ofMillis(intervalMs);
        try {
            boolean claimed = tx.requiresNew(() -> cronJobs.tryClaim(name, interval));
            if (claimed) {
                log.debug("claimed job={} instance={}", name, instanceId);
            }
            return claimed;
        } catch (Exception e) {
            log.warn("claim failed job={} instance={} cause={}", name, instanceId, e.toString());
            return false;
        }
    }
}
