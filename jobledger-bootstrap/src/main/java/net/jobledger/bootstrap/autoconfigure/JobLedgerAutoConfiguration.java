package net.jobledger.bootstrap.autoconfigure;

import net.jobledger.bootstrap.catalog.JobCatalogRegistrar;
import net.jobledger.bootstrap.props.JobLedgerProperties;
import net.jobledger.core.identity.InstanceId;
import net.jobledger.core.model.RegisteredJob;
import net.jobledger.core.service.CronScheduler;
import net.jobledger.core.service.JobRegistry;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import net.jobledger.integration.spring.JobLedgerSpringConfig;
import net.jobledger.integration.spring.sched.CronSchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"})
@ConditionalOnBean(PlatformTransactionManager.class)
@EnableConfigurationProperties(JobLedgerProperties.class)
@Import(JobLedgerSpringConfig.class) // integration-spring: repo/tx/clock wiring
public class JobLedgerAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JobLedgerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public InstanceId jobLedgerInstanceId(JobLedgerProperties props) {
        var id = props.getInstanceId() == null || props.getInstanceId().isBlank()
                ? InstanceId.random()
                : InstanceId.of(props.getInstanceId());
        log.info("JobLedger instance id: {}", id);
        return id;
    }

    @Bean
    public JobCatalogRegistrar jobCatalogRegistrar(JobLedgerProperties props) {
        return new JobCatalogRegistrar(props.getJobs());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(JobCatalogRegistrar registrar, ObjectProvider<RegisteredJob> jobs) {
        return registrar.register(jobs.orderedStream()::iterator);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronScheduler cronScheduler(JobRegistry registry,
                                       CronJobRepository cronJobs,
                                       TxRunner tx,
                                       Clock clock,
                                       InstanceId instanceId,
                                       JobLedgerProperties props) {
        return CronScheduler.create(registry, cronJobs, tx, clock, instanceId, props.getScheduler().getPollInterval());
    }

    // --- lifecycle (jobledger.scheduler.enabled=false keeps the ledger API but never polls) ---
    @Bean
    @ConditionalOnProperty(prefix = "jobledger.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CronSchedulerLifecycle cronSchedulerLifecycle(CronScheduler scheduler, JobLedgerProperties props) {
        var lifecycle = new CronSchedulerLifecycle(scheduler);
        lifecycle.setShutdownGrace(props.getScheduler().getShutdownGrace());
        return lifecycle;
    }
}
