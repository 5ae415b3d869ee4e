package net.jobledger.integration.spring;

import net.jobledger.adapter.jdbc.repo.JdbcCronJobRepository;
import net.jobledger.core.service.JobLedgerQueryService;
import net.jobledger.core.spi.Clock;
import net.jobledger.core.spi.CronJobRepository;
import net.jobledger.core.spi.TxRunner;
import net.jobledger.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration(proxyBeanMethods = false)
public class JobLedgerSpringConfig {

    @Bean
    public TxRunner jobLedgerTxRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public CronJobRepository cronJobRepository() {
        return new JdbcCronJobRepository();
    }

    @Bean
    public Clock jobLedgerClock() {
        return Clock.system();
    }

    @Bean
    public JobLedgerQueryService jobLedgerQueryService(CronJobRepository cronJobs, TxRunner tx, Clock clock) {
        return new JobLedgerQueryService(cronJobs, tx, clock);
    }
}
