package net.jobledger.integration.spring.sched;

import net.jobledger.core.service.CronScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Ties a {@link CronScheduler} to the application context: started once all singletons
 * (and therefore every job bean) exist, stopped on context close.
 * <p>
 * A scheduler cannot be restarted, so a context {@code stop()} followed by {@code start()}
 * leaves polling off until the context is recreated.
 */
public class CronSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CronSchedulerLifecycle.class);

    private final CronScheduler scheduler;
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public CronSchedulerLifecycle(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        if (scheduler.state() == CronScheduler.State.STOPPED) {
            log.warn("scheduler cannot be restarted, polling stays off instance={}", scheduler.instanceId());
            return;
        }
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
        try {
            if (!scheduler.awaitTermination(shutdownGrace)) {
                log.warn("job still running after {} grace, leaving it to finish instance={}", shutdownGrace, scheduler.instanceId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler.state() == CronScheduler.State.RUNNING;
    }

    @Override
    public int getPhase() {
        // after the DataSource/Flyway beans, before web servers
        return Integer.MAX_VALUE - 2048;
    }

    public CronScheduler getScheduler() {
        return scheduler;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }
}
