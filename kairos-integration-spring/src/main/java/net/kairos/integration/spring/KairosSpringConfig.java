package net.kairos.integration.spring;

import net.kairos.adapter.jdbc.JdbcCronStore;
import net.kairos.core.service.JacksonOutputCodec;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronStore;
import net.kairos.core.spi.OutputCodec;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class KairosSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public OutputCodec outputCodec() {
        return new JacksonOutputCodec();
    }

    // 저장소 묶음 (adapter-jdbc 재사용, 트랜잭션은 Spring이 관리)
    @Bean
    public CronStore cronStore(DataSource ds, TxRunner tx, OutputCodec codec) {
        return new JdbcCronStore(ds, tx, codec);
    }

    @Bean
    public Clock systemClock() {
        return Clock.system();
    }
}
