package net.kairos.adapter.jdbc;

import net.kairos.adapter.jdbc.repo.JdbcExecutionRepository;
import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.adapter.jdbc.repo.JdbcLeaseRepository;
import net.kairos.core.service.JacksonOutputCodec;
import net.kairos.core.spi.CronStore;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.LeaseRepository;
import net.kairos.core.spi.OutputCodec;
import net.kairos.core.spi.SqlOperations;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * PostgreSQL 위의 CronStore. 스키마는 Flyway 마이그레이션(db/migration/postgresql)으로 준비되어 있어야 한다.
 */
public final class JdbcCronStore implements CronStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCronStore.class);

    private final DataSource ds;
    private final TxRunner tx;
    private final OutputCodec codec;
    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final LeaseRepository leases;
    private final SqlOperations sql;

    public JdbcCronStore(DataSource ds) {
        this(ds, new JdbcTxRunner(ds), new JacksonOutputCodec());
    }

    /** Spring 등 외부 트랜잭션 관리자를 쓸 때 */
    public JdbcCronStore(DataSource ds, TxRunner tx, OutputCodec codec) {
        this.ds = ds;
        this.tx = tx;
        this.codec = codec;
        this.jobs = new JdbcJobRepository();
        this.executions = new JdbcExecutionRepository(codec);
        this.leases = new JdbcLeaseRepository();
        this.sql = new JdbcSqlOperations(tx);
    }

    @Override public TxRunner tx() { return tx; }
    @Override public JobRepository jobs() { return jobs; }
    @Override public ExecutionRepository executions() { return executions; }
    @Override public LeaseRepository leases() { return leases; }
    @Override public SqlOperations sql() { return sql; }
    @Override public OutputCodec codec() { return codec; }

    @Override
    public void verify() {
        String product;
        try (Connection c = ds.getConnection()) {
            product = c.getMetaData().getDatabaseProductName();
        } catch (SQLException e) {
            throw new IllegalStateException("Cron store is not reachable: " + e.getMessage(), e);
        }
        if (!"PostgreSQL".equalsIgnoreCase(product)) {
            throw new IllegalStateException("Cron store requires PostgreSQL, connected to " + product);
        }
        log.debug("Cron store verified ({})", product);
    }
}
