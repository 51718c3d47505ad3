package net.kairos.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.kairos.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.sql.Statement;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * KAIROS_JDBC_URL 이 있으면 그 DB를, 없으면 Testcontainers PostgreSQL을 띄운다.
 * 둘 다 불가하면 (Docker 없음) 클래스 전체를 건너뛴다.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    protected static PostgreSQLContainer<?> postgres;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("KAIROS_JDBC_URL");
        String user = System.getenv("KAIROS_JDBC_USERNAME");
        String pass = System.getenv("KAIROS_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            assumeTrue(DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
            postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"));
            postgres.start();

            url = postgres.getJdbcUrl();
            user = postgres.getUsername();
            pass = postgres.getPassword();
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(10);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/postgresql")
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    /** 테스트 간 격리: 모든 cron 테이블 비우기 */
    protected static void truncateAll(TxRunner tx) throws Exception {
        tx.required(() -> {
            try (Statement st = TxContext.require().createStatement()) {
                st.execute("TRUNCATE TABLE TB_CRON_EXECUTION, TB_CRON_LOCK, TB_CRON_JOB");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (postgres != null) postgres.stop();
        ds = null;
        postgres = null;
    }
}
