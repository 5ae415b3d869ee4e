package net.jobledger.core.service;

import net.jobledger.core.model.CronJob;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/** Operator-side view of the ledger: listing rows and switching jobs on or off. */
public final class JobLedgerQueryService {
    private static final Logger log = LoggerFactory.getLogger(JobLedgerQueryService.class);

    private final CronJobRepository cronJobs;
    private final TxRunner tx;
    private final Clock clock;

    public JobLedgerQueryService(CronJobRepository cronJobs, TxRunner tx, Clock clock) {
        this.cronJobs = cronJobs;
        this.tx = tx;
        this.clock = clock;
    }

    public List<CronJob> listJobs() throws Exception {
        return tx.required(cronJobs::findAll);
    }

    public Optional<CronJob> findJob(String name) throws Exception {
        return tx.required(() -> cronJobs.findByName(name));
    }

    /** Takes effect on the next claim attempt of any process. */
    public boolean setEnabled(String name, boolean enabled) throws Exception {
        boolean found = tx.required(() -> cronJobs.setEnabled(name, enabled, clock.now()));
        if (found) {
            log.info("job {} job={}", enabled ? "enabled" : "disabled", name);
        } else {
            log.warn("setEnabled on unknown job={}", name);
        }
        return found;
    }
}
