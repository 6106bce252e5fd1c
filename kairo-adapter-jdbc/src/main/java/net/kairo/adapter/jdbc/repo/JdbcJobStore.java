package net.kairo.adapter.jdbc.repo;

import net.kairo.adapter.jdbc.JdbcUtil;
import net.kairo.adapter.jdbc.TxContext;
import net.kairo.adapter.jdbc.mapper.RowMappers;
import net.kairo.core.model.Job;
import net.kairo.core.model.JobDraft;
import net.kairo.core.model.JobPatch;
import net.kairo.core.spi.JobStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// TB_JOB. Calls need an open TxContext (JdbcTxRunner or SpringTxRunner).
public final class JdbcJobStore implements JobStore {

    @Override
    public List<Job> listActive() throws Exception {
        return query("SELECT * FROM TB_JOB WHERE IS_ACTIVE = TRUE ORDER BY ID");
    }

    @Override
    public List<Job> findAll() throws Exception {
        return query("SELECT * FROM TB_JOB ORDER BY ID");
    }

    @Override
    public Optional<Job> get(long id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        // names are not unique; the oldest row wins
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE UPPER(NAME) = UPPER(?)
                 ORDER BY ID
                 LIMIT 1
            """)) {
            ps.setString(1, name);
            return single(ps);
        }
    }

    @Override
    public Optional<Job> updateRunTimestamps(long id, Instant lastRun, Instant nextRun, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET LAST_RUN    = ?,
                       NEXT_RUN    = ?,
                       LEASE_OWNER = NULL,
                       LEASE_UNTIL = NULL,
                       UPDATED_AT  = ?
                 WHERE ID = ?
                RETURNING *
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(lastRun));
            ps.setTimestamp(2, JdbcUtil.ts(nextRun));
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setLong(4, id);
            return single(ps);
        }
    }

    @Override
    public Job create(JobDraft draft, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                INSERT INTO TB_JOB (NAME, DESCRIPTION, SCHEDULE, IS_ACTIVE, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, draft.name());
            ps.setString(2, draft.description());
            ps.setString(3, draft.schedule());
            ps.setBoolean(4, draft.activeOrDefault());
            ps.setTimestamp(5, JdbcUtil.ts(now));
            ps.setTimestamp(6, JdbcUtil.ts(now));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("INSERT into TB_JOB returned no key");
                return RowMappers.toJob(keys);
            }
        }
    }

    @Override
    public Optional<Job> update(long id, JobPatch patch, Instant now) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME        = COALESCE(?, NAME),
                       DESCRIPTION = COALESCE(?, DESCRIPTION),
                       SCHEDULE    = COALESCE(?, SCHEDULE),
                       IS_ACTIVE   = COALESCE(?, IS_ACTIVE),
                       NEXT_RUN    = COALESCE(?, NEXT_RUN),
                       UPDATED_AT  = ?
                 WHERE ID = ?
                RETURNING *
            """)) {
            int i = 1;
            ps.setString(i++, patch.name());
            ps.setString(i++, patch.description());
            ps.setString(i++, patch.schedule());
            if (patch.active() == null) ps.setNull(i++, Types.BOOLEAN);
            else ps.setBoolean(i++, patch.active());
            ps.setTimestamp(i++, JdbcUtil.ts(patch.nextRun()));
            ps.setTimestamp(i++, JdbcUtil.ts(now));
            ps.setLong(i, id);
            return single(ps);
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean tryClaim(long id, String owner, Instant now, Instant until) throws Exception {
        // the row lock serializes competing schedulers; a row written back by another node is no longer due
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET LEASE_OWNER = ?,
                       LEASE_UNTIL = ?
                 WHERE ID = ?
                   AND IS_ACTIVE = TRUE
                   AND (LAST_RUN IS NULL OR NEXT_RUN <= ?)
                   AND (LEASE_UNTIL IS NULL OR LEASE_UNTIL <= ? OR LEASE_OWNER = ?)
            """)) {
            ps.setString(1, owner);
            ps.setTimestamp(2, JdbcUtil.ts(until));
            ps.setLong(3, id);
            ps.setTimestamp(4, JdbcUtil.ts(now));
            ps.setTimestamp(5, JdbcUtil.ts(now));
            ps.setString(6, owner);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void release(long id, String owner) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_JOB
                   SET LEASE_OWNER = NULL,
                       LEASE_UNTIL = NULL
                 WHERE ID = ? AND LEASE_OWNER = ?
            """)) {
            ps.setLong(1, id);
            ps.setString(2, owner);
            ps.executeUpdate();
        }
    }

    private List<Job> query(String sql) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    private static Optional<Job> single(PreparedStatement ps) throws Exception {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJob(rs));
        }
    }

    private static Connection mustConn() {
        return TxContext.require();
    }
}
