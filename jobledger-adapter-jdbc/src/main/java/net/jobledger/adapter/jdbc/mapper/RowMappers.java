package net.jobledger.adapter.jdbc.mapper;

import net.jobledger.adapter.jdbc.JdbcUtil;
import net.jobledger.core.model.CronJob;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    public static CronJob toCronJob(ResultSet rs) throws SQLException {
        return new CronJob(
                rs.getString("NAME"),
                rs.getLong("INTERVAL_MS"),
                rs.getBoolean("ENABLED"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN_AT")),
                JdbcUtil.nullableLong(rs, "LAST_RUN_DURATION_MS"),
                rs.getString("LAST_ERROR"),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
