package net.jobledger.bootstrap.catalog;

import net.jobledger.bootstrap.props.JobLedgerProperties;
import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.service.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the application's {@link RegisteredJob} beans into one registry, applying
 * {@code jobledger.jobs.<name>.interval} overrides on the way.
 */
public class JobCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogRegistrar.class);

    private final Map<String, JobLedgerProperties.JobOverride> overrides;

    public JobCatalogRegistrar(Map<String, JobLedgerProperties.JobOverride> overrides) {
        this.overrides = overrides == null ? Map.of() : overrides;
    }

    public JobRegistry register(Iterable<RegisteredJob> jobs) {
        var registry = new JobRegistry();
        Set<String> seen = new HashSet<>();
        for (var job : jobs) {
            var effective = applyOverride(job);
            registry.register(effective);
            seen.add(effective.name());
            log.info("Job registered: job='{}' intervalMs={}", effective.name(), effective.intervalMs());
        }
        for (var name : overrides.keySet()) {
            if (!seen.contains(name)) {
                log.warn("Override for unknown job ignored: job='{}'", name);
            }
        }
        log.info("Job catalog ready: {} job(s)", registry.size());
        return registry;
    }

    private RegisteredJob applyOverride(RegisteredJob job) {
        var o = overrides.get(job.name());
        if (o == null || o.getInterval() == null) return job;
        long ms = o.getInterval().toMillis();
        if (ms <= 0) {
            throw new IllegalArgumentException("jobledger.jobs." + job.name() + ".interval must be positive: " + o.getInterval());
        }
        log.info("Interval override: job='{}' {}ms -> {}ms", job.name(), job.intervalMs(), ms);
        return job.withIntervalMs(ms);
    }
}
