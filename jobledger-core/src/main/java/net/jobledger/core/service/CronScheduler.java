package net.jobledger.core.service;

import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-process scheduler: UNSTARTED -> RUNNING -> STOPPED.
 * <p>
 * {@link #start()} freezes the registry, reconciles the ledger, polls once right away and then
 * keeps polling at a fixed rate on a single timer thread, so ticks of one process never overlap.
 * {@link #stop()} cancels the timer and lets an in-flight handler finish. A stopped scheduler
 * cannot be restarted.
 */
public final class CronScheduler {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    static final String MDC_INSTANCE = "instance";

    public enum State { UNSTARTED, RUNNING, STOPPED }

    private final JobRegistry registry;
    private final LedgerReconciler reconciler;
    private final JobPoller poller;
    private final Duration pollInterval;
    private final InstanceId instanceId;

    private final Object lock = new Object();
    private State state = State.UNSTARTED;
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> loop;

    public CronScheduler(JobRegistry registry,
                         LedgerReconciler reconciler,
                         JobPoller poller,
                         Duration pollInterval,
                         InstanceId instanceId) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    /** Wires reconciler, claim service and poller around one repository. */
    public static CronScheduler create(JobRegistry registry,
                                       CronJobRepository cronJobs,
                                       TxRunner tx,
                                       Clock clock,
                                       InstanceId instanceId,
                                       Duration pollInterval) {
        var reconciler = new LedgerReconciler(cronJobs, tx, clock, instanceId);
        var claims = new ClaimService(cronJobs, tx, instanceId);
        var poller = new JobPoller(registry, claims, cronJobs, tx, clock, instanceId);
        return new CronScheduler(registry, reconciler, poller, pollInterval, instanceId);
    }

    public void start() {
        synchronized (lock) {
            if (state == State.RUNNING) {
                log.debug("scheduler already running instance={}", instanceId);
                return;
            }
            if (state == State.STOPPED) {
                throw new IllegalStateException("scheduler was stopped, create a new instance: " + instanceId);
            }
            registry.freeze();
            reconciler.reconcile(registry);

            timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "jobledger-poller-" + instanceId);
                t.setDaemon(true);
                return t;
            });
            loop = timer.scheduleAtFixedRate(this::tick, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            state = State.RUNNING;
            log.info("scheduler started instance={} jobs={} pollInterval={}", instanceId, registry.size(), pollInterval);
        }
    }

    public void stop() {
        synchronized (lock) {
            if (state == State.STOPPED) return;
            if (state == State.RUNNING) {
                loop.cancel(false);
                timer.shutdown();
            }
            state = State.STOPPED;
            log.info("scheduler stopped instance={}", instanceId);
        }
    }

    /**
     * Waits for a handler that was running when {@link #stop()} was called.
     *
     * @return true if the timer thread is gone (or was never started)
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ScheduledExecutorService t;
        synchronized (lock) {
            t = timer;
        }
        return t == null || t.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public InstanceId instanceId() {
        return instanceId;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public JobPoller poller() {
        return poller;
    }

    private void tick() {
        MDC.put(MDC_INSTANCE, instanceId.value());
        try {
            poller.pollOnce();
        } catch (Throwable t) {
            // an escaped exception would silently cancel the fixed-rate loop
            log.error("poll tick failed instance={}", instanceId, t);
        } finally {
            MDC.remove(MDC_INSTANCE);
        }
    }
}
