package net.jobledger.app.config;

import net.jobledger.app.jobs.CacheCleanupJob;
import net.jobledger.app.jobs.SessionCleanupJob;
import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.JobHandler;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Jobs this application contributes to the shared ledger. Bean order is poll order.
 */
@Configuration(proxyBeanMethods = false)
public class AppJobsConfig {

    @Bean
    public SessionCleanupJob sessionCleanupJob(JdbcTemplate jdbc, Clock clock) {
        return new SessionCleanupJob(jdbc, clock);
    }

    @Bean
    public CacheCleanupJob cacheCleanupJob(CacheManager caches) {
        return new CacheCleanupJob(caches);
    }

    @Bean
    @Order(1)
    public RegisteredJob sessionCleanup(SessionCleanupJob job) {
        return RegisteredJob.of(SessionCleanupJob.NAME, Duration.ofHours(1), JobHandler.blocking(job::purgeExpired));
    }

    @Bean
    @Order(2)
    public RegisteredJob cacheCleanup(CacheCleanupJob job) {
        return RegisteredJob.of(CacheCleanupJob.NAME, Duration.ofDays(1), JobHandler.blocking(job::clearAll));
    }
}
