package net.kairos.adapter.jdbc.mapper;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.core.model.Execution;
import net.kairos.core.model.Job;
import net.kairos.core.model.Lease;
import net.kairos.core.spi.OutputCodec;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getString("NAME"),
                rs.getString("SCHEDULE"),
                rs.getString("TIMEZONE"),
                rs.getBoolean("CATCH_UP"),
                rs.getInt("MAX_CATCH_UP"),
                rs.getBoolean("ENABLED"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_SCHEDULED_TIME")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_SCHEDULED_TIME")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Execution (OUTPUT 은 JSON 문자열로 저장) ---
    public static Execution toExecution(ResultSet rs, OutputCodec codec) throws SQLException {
        String json = rs.getString("OUTPUT");
        Object output;
        try {
            output = codec.decode(json);
        } catch (Exception e) {
            throw new SQLException("Cannot decode OUTPUT of execution " + rs.getString("EXECUTION_ID"), e);
        }
        long duration = rs.getLong("DURATION_MS");
        Long durationMs = rs.wasNull() ? null : duration;
        return new Execution(
                rs.getString("EXECUTION_ID"),
                rs.getString("JOB_NAME"),
                rs.getTimestamp("SCHEDULED_TIME").toInstant(),
                rs.getTimestamp("ACTUAL_TIME").toInstant(),
                Execution.Status.from(rs.getString("STATUS")),
                output,
                rs.getString("ERROR"),
                durationMs,
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT"))
        );
    }

    // --- Lease ---
    public static Lease toLease(ResultSet rs) throws SQLException {
        return new Lease(
                rs.getString("JOB_NAME"),
                rs.getString("LOCKED_BY"),
                rs.getTimestamp("LOCKED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant()
        );
    }
}
