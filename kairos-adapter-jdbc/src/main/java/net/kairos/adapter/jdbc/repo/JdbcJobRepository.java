package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Job;
import net.kairos.core.spi.JobRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.ts;

public final class JdbcJobRepository implements JobRepository {

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_CRON_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    /** ENABLED, LAST_SCHEDULED_TIME, CREATED_AT 은 기존 값 유지 */
    @Override
    public Job upsert(String name,
                      String schedule,
                      String timezone,
                      boolean catchUp,
                      int maxCatchUp,
                      Instant nextScheduledTime) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            INSERT INTO TB_CRON_JOB (NAME, SCHEDULE, TIMEZONE, CATCH_UP, MAX_CATCH_UP, ENABLED,
                                     NEXT_SCHEDULED_TIME, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, TRUE, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (NAME) DO UPDATE
               SET SCHEDULE            = EXCLUDED.SCHEDULE,
                   TIMEZONE            = EXCLUDED.TIMEZONE,
                   CATCH_UP            = EXCLUDED.CATCH_UP,
                   MAX_CATCH_UP        = EXCLUDED.MAX_CATCH_UP,
                   NEXT_SCHEDULED_TIME = EXCLUDED.NEXT_SCHEDULED_TIME,
                   UPDATED_AT          = CURRENT_TIMESTAMP
            RETURNING *
        """)) {
            ps.setString(1, name);
            ps.setString(2, schedule);
            ps.setString(3, timezone);
            ps.setBoolean(4, catchUp);
            ps.setInt(5, maxCatchUp);
            ps.setTimestamp(6, ts(nextScheduledTime));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return RowMappers.toJob(rs);
            }
        }
    }

    @Override
    public boolean advance(String name, Instant handled, Instant next, Instant expectedNext) throws Exception {
        String sql = """
            UPDATE TB_CRON_JOB
               SET LAST_SCHEDULED_TIME = ?,
                   NEXT_SCHEDULED_TIME = ?,
                   UPDATED_AT          = CURRENT_TIMESTAMP
             WHERE NAME = ?
        """ + (expectedNext != null ? " AND NEXT_SCHEDULED_TIME = ?" : "");
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            ps.setTimestamp(1, ts(handled));
            ps.setTimestamp(2, ts(next));
            ps.setString(3, name);
            if (expectedNext != null) ps.setTimestamp(4, ts(expectedNext));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void markLastScheduled(String name, Instant lastScheduledTime) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            UPDATE TB_CRON_JOB
               SET LAST_SCHEDULED_TIME = ?,
                   UPDATED_AT          = CURRENT_TIMESTAMP
             WHERE NAME = ?
               AND (LAST_SCHEDULED_TIME IS NULL OR LAST_SCHEDULED_TIME < ?)
        """)) {
            ps.setTimestamp(1, ts(lastScheduledTime));
            ps.setString(2, name);
            ps.setTimestamp(3, ts(lastScheduledTime));
            ps.executeUpdate();
        }
    }

    @Override
    public void setEnabled(String name, boolean enabled) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "UPDATE TB_CRON_JOB SET ENABLED = ?, UPDATED_AT = CURRENT_TIMESTAMP WHERE NAME = ?")) {
            ps.setBoolean(1, enabled);
            ps.setString(2, name);
            ps.executeUpdate();
        }
    }
}
