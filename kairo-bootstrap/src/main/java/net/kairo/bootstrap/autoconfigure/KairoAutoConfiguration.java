package net.kairo.bootstrap.autoconfigure;

import net.kairo.bootstrap.catalog.CatalogRegistrar;
import net.kairo.bootstrap.props.KairoProperties;
import net.kairo.core.cron.CronEvaluator;
import net.kairo.core.executor.EmailJobExecutor;
import net.kairo.core.executor.GenericJobExecutor;
import net.kairo.core.executor.JobExecutor;
import net.kairo.core.executor.JobExecutorRegistry;
import net.kairo.core.executor.JobType;
import net.kairo.core.executor.NotificationJobExecutor;
import net.kairo.core.executor.ReportJobExecutor;
import net.kairo.core.service.DueJobSelector;
import net.kairo.core.service.JobAdminService;
import net.kairo.core.service.JobTickService;
import net.kairo.core.service.LoggingJobEventListener;
import net.kairo.core.service.SchedulerLoop;
import net.kairo.core.service.SchedulerSettings;
import net.kairo.core.spi.Clock;
import net.kairo.core.spi.JobEventListener;
import net.kairo.core.spi.JobStore;
import net.kairo.core.spi.TxRunner;
import net.kairo.core.store.InMemoryJobStore;
import net.kairo.integration.spring.KairoSpringConfig;
import net.kairo.integration.spring.sched.KairoSchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(KairoProperties.class)
public class KairoAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairoAutoConfiguration.class);

    // --- job store: JDBC when a DataSource exists, otherwise in memory ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean(JobStore.class)
    @Import(KairoSpringConfig.class)
    static class JdbcStoreConfiguration {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean({DataSource.class, JobStore.class})
    static class InMemoryStoreConfiguration {

        @Bean
        public JobStore jobStore() {
            log.warn("No DataSource configured, jobs are kept in memory only");
            return new InMemoryJobStore();
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public TxRunner txRunner() {
        return TxRunner.direct();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() {
        return Clock.system();
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator(KairoProperties props) {
        return new CronEvaluator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DueJobSelector dueJobSelector() {
        return new DueJobSelector();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutorRegistry jobExecutorRegistry(KairoProperties props) {
        var ex = props.getExecutors();
        Map<JobType, JobExecutor> executors = new EnumMap<>(JobType.class);
        executors.put(JobType.EMAIL, new EmailJobExecutor(ex.latencyOf(JobType.EMAIL)));
        executors.put(JobType.NOTIFICATION, new NotificationJobExecutor(ex.latencyOf(JobType.NOTIFICATION)));
        executors.put(JobType.REPORT, new ReportJobExecutor(ex.latencyOf(JobType.REPORT)));
        executors.put(JobType.GENERIC, new GenericJobExecutor(ex.latencyOf(JobType.GENERIC)));
        return JobExecutorRegistry.of(executors, ex.getUnknownTypePolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingJobEventListener loggingJobEventListener() {
        return new LoggingJobEventListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(KairoProperties props) {
        var s = props.getScheduler();
        String owner = s.getOwner() != null && !s.getOwner().isBlank()
                ? s.getOwner()
                : "kairo-" + ManagementFactory.getRuntimeMXBean().getName();
        return new SchedulerSettings(
                s.getTickInterval(),
                s.getInitialDelay(),
                s.getExecutionTimeout(),
                s.getGracePeriod(),
                s.getMaxConcurrentDispatches(),
                s.isClaimEnabled(),
                owner,
                s.getShutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobTickService jobTickService(JobStore jobs,
                                         TxRunner tx,
                                         Clock clock,
                                         CronEvaluator cron,
                                         DueJobSelector selector,
                                         JobExecutorRegistry registry,
                                         ObjectProvider<JobEventListener> listeners,
                                         SchedulerSettings settings) {
        List<JobEventListener> all = listeners.orderedStream().toList();
        return new JobTickService(jobs, tx, clock, cron, selector, registry,
                JobEventListener.composite(all), settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLoop schedulerLoop(JobTickService ticks, SchedulerSettings settings) {
        return new SchedulerLoop(ticks, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public KairoSchedulerLifecycle kairoSchedulerLifecycle(SchedulerLoop loop, KairoProperties props) {
        return new KairoSchedulerLifecycle(loop, props.getScheduler().isEnabled());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdminService jobAdminService(JobStore jobs, TxRunner tx, Clock clock, CronEvaluator cron) {
        return new JobAdminService(jobs, tx, clock, cron);
    }

    // --- startup catalog ---

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(JobAdminService admin) {
        return new CatalogRegistrar(admin);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairo.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner kairoCatalogRunner(CatalogRegistrar registrar, KairoProperties props) {
        log.debug("Catalog runner registered with {} job(s)", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }
}
