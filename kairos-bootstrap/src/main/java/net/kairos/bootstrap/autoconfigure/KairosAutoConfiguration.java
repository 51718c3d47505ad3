package net.kairos.bootstrap.autoconfigure;

import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.cron.ScanningCronCalculator;
import net.kairos.core.job.CronHandler;
import net.kairos.core.job.CronScheduler;
import net.kairos.core.maintenance.MaintenanceService;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.CronStore;
import net.kairos.core.spi.EventLog;
import net.kairos.integration.spring.KairosSpringConfig;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.sched.KairosSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class})
@EnableScheduling
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: store/tx/clock wiring
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator(KairosProperties props) {
        String engine = props.getScheduler().getCronEngine();
        if ("cron-utils".equalsIgnoreCase(engine)) {
            return new CronUtilsCalculator();
        }
        if (!"scanning".equalsIgnoreCase(engine)) {
            throw new IllegalArgumentException("Unknown kairos.scheduler.cron-engine: " + engine);
        }
        return new ScanningCronCalculator(props.getScheduler().getMaxSearchMinutes());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLog eventLog() {
        return EventLog.discarding();
    }

    // --- 코어 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public CronScheduler cronScheduler() {
        return new CronScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(CronStore store, Clock clock) {
        return new MaintenanceService(store.leases(), store.executions(), store.tx(), clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "kairos.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KairosSchedulers kairosSchedulers(MaintenanceService maintenance, KairosProperties props) {
        var s = new KairosSchedulers(maintenance);
        // 주기(maintenance-delay-ms)는 @Scheduled 가 직접 읽음
        s.setStaleAfter(props.getScheduler().getStaleAfter());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(CronStore store,
                                             CronCalculator calculator,
                                             Clock clock,
                                             EventLog eventLog,
                                             CronScheduler scheduler,
                                             ListableBeanFactory beans,
                                             KairosProperties props) {
        Map<String, CronHandler<?>> handlers = new LinkedHashMap<>();
        beans.getBeansOfType(CronHandler.class).forEach(handlers::put);

        String instanceId = props.getInstanceId() == null || props.getInstanceId().isBlank()
                ? UUID.randomUUID().toString()
                : props.getInstanceId();
        return new CatalogRegistrar(store, calculator, clock, eventLog, scheduler, handlers,
                props.getScheduler().toSettings(), instanceId, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairos.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, KairosProperties props) {
        return args -> {
            log.info("Kairos catalog: {} job(s) declared, scheduler enabled={}",
                    props.getCatalog().getJobs().size(), props.getScheduler().isEnabled());
            if (props.getScheduler().isEnabled()) {
                registrar.registerAndStart(props.getCatalog());
            } else {
                registrar.register(props.getCatalog());
            }
        };
    }
}
