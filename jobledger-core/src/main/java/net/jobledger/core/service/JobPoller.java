package net.jobledger.core.service;

import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * One poll tick: offers every registered job a claim, in registration order, and runs the
 * winners inline. Nothing a handler does can abort the tick.
 */
public final class JobPoller {
    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    static final int MAX_ERROR_LENGTH = 4000;
    static final String MDC_JOB = "job";

    private final JobRegistry registry;
    private final ClaimService claims;
    private final CronJobRepository cronJobs;
    private final TxRunner tx;
    private final Clock clock;
    private final InstanceId instanceId;

    public JobPoller(JobRegistry registry,
                     ClaimService claims,
                     CronJobRepository cronJobs,
                     TxRunner tx,
                     Clock clock,
                     InstanceId instanceId) {
        this.registry = registry;
        this.claims = claims;
        this.cronJobs = cronJobs;
        this.tx = tx;
        this.clock = clock;
        this.instanceId = instanceId;
    }

    public PollReport pollOnce() {
        PollReport r = new PollReport();
        r.timestamp = clock.now();
        for (RegisteredJob job : registry.jobs()) {
            r.attempted++;
            if (!claims.tryClaim(job.name(), job.intervalMs())) {
                continue;   // not due, disabled, or another process won
            }
            r.claimed++;
            if (runClaimed(job)) r.succeeded++; else r.failed++;
        }
        if (r.claimed > 0) {
            log.info("poll tick done instance={} {}", instanceId, r);
        }
        return r;
    }

    private boolean runClaimed(RegisteredJob job) {
        MDC.put(MDC_JOB, job.name());
        long started = System.nanoTime();
        String error = null;
        try {
            log.info("job started job={} instance={}", job.name(), instanceId);
            await(job.handler().execute());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = describe(e);
        } catch (Throwable t) {
            error = describe(unwrap(t));
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        try {
            if (error == null) {
                log.info("job succeeded job={} durationMs={} instance={}", job.name(), durationMs, instanceId);
            } else {
                log.warn("job failed job={} durationMs={} instance={} error={}", job.name(), durationMs, instanceId, error);
            }
            writeOutcome(job.name(), durationMs, error);
        } finally {
            MDC.remove(MDC_JOB);
        }
        return error == null;
    }

    private void writeOutcome(String name, long durationMs, String error) {
        try {
            tx.requiresNew(() -> {
                cronJobs.recordRun(name, durationMs, error, clock.now());
                return null;
            });
        } catch (Exception e) {
            // run already happened; the claim keeps other processes off until the interval passes
            log.warn("status write failed job={} instance={} cause={}", name, instanceId, e.toString());
        }
    }

    private static void await(CompletionStage<Void> stage) throws Exception {
        if (stage == null) return;
        try {
            stage.toCompletableFuture().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        String s = msg == null ? t.getClass().getName() : t.getClass().getName() + ": " + msg;
        if (s.length() <= MAX_ERROR_LENGTH) return s;
        int end = MAX_ERROR_LENGTH;
        // never leave half a surrogate pair behind
        if (Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    /** Per-tick counters. */
    public static final class PollReport {
        public Instant timestamp;
        public int attempted;
        public int claimed;
        public int succeeded;
        public int failed;

        @Override public String toString() {
            return "PollReport{" +
                    "timestamp=" + timestamp +
                    ", attempted=" + attempted +
                    ", claimed=" + claimed +
                    ", succeeded=" + succeeded +
                    ", failed=" + failed +
                    '}';
        }
    }
}
