package net.jobledger.core.service;

import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.spi.JobHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process job table, kept in registration order. Filled before the scheduler starts and
 * frozen once it does.
 */
public final class JobRegistry {
    private final Map<String, RegisteredJob> jobs = new LinkedHashMap<>();
    private volatile boolean frozen;

    public synchronized RegisteredJob register(String name, long intervalMs, JobHandler handler) {
        return register(new RegisteredJob(name, intervalMs, handler));
    }

    public RegisteredJob register(String name, Duration interval, JobHandler handler) {
        return register(RegisteredJob.of(name, interval, handler));
    }

    public synchronized RegisteredJob register(RegisteredJob job) {
        if (frozen) {
            throw new IllegalStateException("scheduler already started, cannot register job: " + job.name());
        }
        if (jobs.containsKey(job.name())) {
            throw new IllegalArgumentException("job already registered: " + job.name());
        }
        jobs.put(job.name(), job);
        return job;
    }

    /** Called by the scheduler on start. */
    synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public synchronized List<RegisteredJob> jobs() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    public synchronized int size() {
        return jobs.size();
    }
}
