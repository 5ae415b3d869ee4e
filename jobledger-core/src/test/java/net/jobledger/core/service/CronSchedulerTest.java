package net.jobledger.core.service;

import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.JobHandler;
import net.jobledger.core.support.DirectTxRunner;
import net.jobledger.core.support.InMemoryCronJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CronSchedulerTest {

    InMemoryCronJobRepository repo = new InMemoryCronJobRepository();
    CronScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.stop();
    }

    private CronScheduler newScheduler(JobRegistry registry, Duration pollInterval) {
        return CronScheduler.create(registry, repo, new DirectTxRunner(), Clock.system(), InstanceId.random(), pollInterval);
    }

    @Test
    void firstPollRunsImmediatelyOnStart() {
        var registry = new JobRegistry();
        var runs = new AtomicInteger();
        registry.register("cache-cleanup", Duration.ofDays(1), JobHandler.blocking(runs::incrementAndGet));
        scheduler = newScheduler(registry, Duration.ofHours(1));

        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
        assertThat(repo.findByName("cache-cleanup")).hasValueSatisfying(r -> assertThat(r.lastRunAt()).isNotNull());
        assertThat(scheduler.state()).isEqualTo(CronScheduler.State.RUNNING);
    }

    @Test
    void keepsPollingAtFixedCadence() {
        var registry = new JobRegistry();
        var runs = new AtomicInteger();
        registry.register("tight", 1L, JobHandler.blocking(runs::incrementAndGet));
        scheduler = newScheduler(registry, Duration.ofMillis(20));

        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);
    }

    @Test
    void secondStartIsNoOp() {
        var registry = new JobRegistry();
        var runs = new AtomicInteger();
        registry.register("hourly", Duration.ofHours(1), JobHandler.blocking(runs::incrementAndGet));
        scheduler = newScheduler(registry, Duration.ofMillis(20));

        scheduler.start();
        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() == 1);
        assertThat(scheduler.state()).isEqualTo(CronScheduler.State.RUNNING);
    }

    @Test
    void registrationAfterStartIsRejected() {
        var registry = new JobRegistry();
        scheduler = newScheduler(registry, Duration.ofHours(1));
        scheduler.start();

        assertThatThrownBy(() -> registry.register("late", 1000L, JobHandler.blocking(() -> { })))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stoppedSchedulerCannotRestart() {
        scheduler = newScheduler(new JobRegistry(), Duration.ofHours(1));
        scheduler.start();
        scheduler.stop();
        scheduler.stop();

        assertThat(scheduler.state()).isEqualTo(CronScheduler.State.STOPPED);
        assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopBeforeStartIsTerminal() {
        scheduler = newScheduler(new JobRegistry(), Duration.ofHours(1));
        scheduler.stop();

        assertThat(scheduler.state()).isEqualTo(CronScheduler.State.STOPPED);
        assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopLetsInFlightHandlerFinishAndEndsLoop() throws Exception {
        var registry = new JobRegistry();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var interrupted = new AtomicBoolean();
        var runs = new AtomicInteger();
        registry.register("long", 1L, JobHandler.blocking(() -> {
            runs.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
        }));
        scheduler = newScheduler(registry, Duration.ofMillis(10));
        scheduler.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.stop();
        release.countDown();

        assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(interrupted).isFalse();
        assertThat(runs.get()).isEqualTo(1);
        assertThat(repo.findByName("long").orElseThrow().lastError()).isNull();
    }

    @Test
    void independentSchedulersShareOneLedger() {
        var runs = new AtomicInteger();
        var r1 = new JobRegistry();
        var r2 = new JobRegistry();
        r1.register("session-cleanup", 3_600_000L, JobHandler.blocking(runs::incrementAndGet));
        r2.register("session-cleanup", 3_600_000L, JobHandler.blocking(runs::incrementAndGet));
        var s1 = newScheduler(r1, Duration.ofMillis(10));
        var s2 = newScheduler(r2, Duration.ofMillis(10));
        try {
            s1.start();
            s2.start();
            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 1);
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> runs.get() == 1);
        } finally {
            s1.stop();
            s2.stop();
        }
    }

    @Test
    void rejectsNonPositivePollInterval() {
        assertThatThrownBy(() -> newScheduler(new JobRegistry(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
