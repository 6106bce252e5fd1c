package net.kairo.adapter.jdbc.mapper;

import net.kairo.adapter.jdbc.JdbcUtil;
import net.kairo.core.model.Job;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                rs.getString("SCHEDULE"),
                rs.getBoolean("IS_ACTIVE"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN")),
                rs.getString("LEASE_OWNER"),
                JdbcUtil.toInstant(rs.getTimestamp("LEASE_UNTIL")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
