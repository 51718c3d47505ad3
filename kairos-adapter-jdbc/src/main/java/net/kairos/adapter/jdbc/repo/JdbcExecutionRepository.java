package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Execution;
import net.kairos.core.model.HistoryQuery;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.OutputCodec;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.ts;

public final class JdbcExecutionRepository implements ExecutionRepository {
    private final OutputCodec codec;

    public JdbcExecutionRepository(OutputCodec codec) {
        this.codec = codec;
    }

    /** (JOB_NAME, SCHEDULED_TIME) 유니크 충돌이면 0건 → false */
    @Override
    public boolean insertRunning(String executionId, String jobName, Instant scheduledTime, Instant actualTime) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            INSERT INTO TB_CRON_EXECUTION (EXECUTION_ID, JOB_NAME, SCHEDULED_TIME, ACTUAL_TIME, STATUS, CREATED_AT)
            VALUES (?, ?, ?, ?, 'RUNNING', CURRENT_TIMESTAMP)
            ON CONFLICT DO NOTHING
        """)) {
            ps.setString(1, executionId);
            ps.setString(2, jobName);
            ps.setTimestamp(3, ts(scheduledTime));
            ps.setTimestamp(4, ts(actualTime));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean complete(String executionId, Execution.Status status, String outputJson, String error, long durationMs) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            UPDATE TB_CRON_EXECUTION
               SET STATUS       = ?,
                   OUTPUT       = CAST(? AS JSONB),
                   ERROR        = ?,
                   DURATION_MS  = ?,
                   COMPLETED_AT = CURRENT_TIMESTAMP
             WHERE EXECUTION_ID = ?
               AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, status.code());
            if (outputJson == null) ps.setNull(2, Types.VARCHAR); else ps.setString(2, outputJson);
            ps.setString(3, error);
            ps.setLong(4, durationMs);
            ps.setString(5, executionId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean exists(String jobName, Instant scheduledTime) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT 1 FROM TB_CRON_EXECUTION WHERE JOB_NAME = ? AND SCHEDULED_TIME = ?")) {
            ps.setString(1, jobName);
            ps.setTimestamp(2, ts(scheduledTime));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<Execution> findById(String executionId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_CRON_EXECUTION WHERE EXECUTION_ID = ?")) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toExecution(rs, codec)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Execution> history(String jobName, HistoryQuery query) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT * FROM TB_CRON_EXECUTION WHERE JOB_NAME = ?");
        if (query.since() != null) sql.append(" AND SCHEDULED_TIME >= ?");
        sql.append(" ORDER BY SCHEDULED_TIME DESC");
        if (query.limit() != null) sql.append(" LIMIT ?");

        try (PreparedStatement ps = TxContext.require().prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, jobName);
            if (query.since() != null) ps.setTimestamp(i++, ts(query.since()));
            if (query.limit() != null) ps.setInt(i, query.limit());
            try (ResultSet rs = ps.executeQuery()) {
                List<Execution> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toExecution(rs, codec));
                return out;
            }
        }
    }

    @Override
    public int failAbandoned(Instant startedBefore, String reason) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
            UPDATE TB_CRON_EXECUTION
               SET STATUS       = 'FAILED',
                   ERROR        = ?,
                   COMPLETED_AT = CURRENT_TIMESTAMP
             WHERE STATUS = 'RUNNING'
               AND ACTUAL_TIME < ?
        """)) {
            ps.setString(1, reason);
            ps.setTimestamp(2, ts(startedBefore));
            return ps.executeUpdate();
        }
    }
}
