package net.kairo.integration.spring;

import net.kairo.adapter.jdbc.repo.JdbcJobStore;
import net.kairo.core.spi.Clock;
import net.kairo.core.spi.JobStore;
import net.kairo.core.spi.TxRunner;
import net.kairo.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** JDBC-backed SPI beans, sharing Spring's transaction manager. */
@Configuration(proxyBeanMethods = false)
public class KairoSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public JobStore jobStore() {
        return new JdbcJobStore();
    }

    @Bean
    public Clock systemClock() {
        return Clock.system();
    }
}
