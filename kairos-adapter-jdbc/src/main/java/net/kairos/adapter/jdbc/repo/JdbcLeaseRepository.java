package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Lease;
import net.kairos.core.spi.LeaseRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.util.Optional;

/** 만료 판정은 DB 시계(CURRENT_TIMESTAMP) 기준 */
public final class JdbcLeaseRepository implements LeaseRepository {

    /** 없음 → 삽입, 있음 → 만료됐거나 같은 holder일 때만 덮어씀. 아니면 0건 */
    @Override
    public boolean tryAcquire(String jobName, String holderId, Duration lease) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            INSERT INTO TB_CRON_LOCK (JOB_NAME, LOCKED_BY, LOCKED_AT, EXPIRES_AT)
            VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP + (? * INTERVAL '1 millisecond'))
            ON CONFLICT (JOB_NAME) DO UPDATE
               SET LOCKED_BY  = EXCLUDED.LOCKED_BY,
                   LOCKED_AT  = EXCLUDED.LOCKED_AT,
                   EXPIRES_AT = EXCLUDED.EXPIRES_AT
             WHERE TB_CRON_LOCK.EXPIRES_AT < CURRENT_TIMESTAMP
                OR TB_CRON_LOCK.LOCKED_BY = EXCLUDED.LOCKED_BY
        """)) {
            ps.setString(1, jobName);
            ps.setString(2, holderId);
            ps.setLong(3, lease.toMillis());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean renew(String jobName, String holderId, Duration lease) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            UPDATE TB_CRON_LOCK
               SET EXPIRES_AT = CURRENT_TIMESTAMP + (? * INTERVAL '1 millisecond')
             WHERE JOB_NAME = ?
               AND LOCKED_BY = ?
        """)) {
            ps.setLong(1, lease.toMillis());
            ps.setString(2, jobName);
            ps.setString(3, holderId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean release(String jobName, String holderId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "DELETE FROM TB_CRON_LOCK WHERE JOB_NAME = ? AND LOCKED_BY = ?")) {
            ps.setString(1, jobName);
            ps.setString(2, holderId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<Lease> findByJob(String jobName) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_CRON_LOCK WHERE JOB_NAME = ?")) {
            ps.setString(1, jobName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLease(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public int deleteExpired() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "DELETE FROM TB_CRON_LOCK WHERE EXPIRES_AT < CURRENT_TIMESTAMP")) {
            return ps.executeUpdate();
        }
    }
}
