package net.jobledger.adapter.jdbc.repo;

import net.jobledger.adapter.jdbc.JdbcUtil;
import net.jobledger.adapter.jdbc.TxContext;
import net.jobledger.adapter.jdbc.mapper.RowMappers;
import net.jobledger.core.model.CronJob;
import net.jobledger.core.spi.CronJobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Savepoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CRON_JOBS on plain JDBC. Statements run on the {@link TxContext} connection; the SQL sticks
 * to what PostgreSQL and H2 both accept, except for the claim cutoff.
 */
public final class JdbcCronJobRepository implements CronJobRepository {

    // "now" is the database's CURRENT_TIMESTAMP, never an app-server clock.
    // Only the cutoff arithmetic differs per product; the parameter is the interval in ms.
    private static final String CLAIM = """
            UPDATE CRON_JOBS
               SET LAST_RUN_AT = CURRENT_TIMESTAMP,
                   UPDATED_AT  = CURRENT_TIMESTAMP
             WHERE NAME = ?
               AND ENABLED = TRUE
               AND (LAST_RUN_AT IS NULL OR LAST_RUN_AT <= %s)
            """;

    private static final String CLAIM_POSTGRES =
            CLAIM.formatted("CURRENT_TIMESTAMP - CAST(? AS DOUBLE PRECISION) * INTERVAL '1 millisecond'");
    private static final String CLAIM_H2 =
            CLAIM.formatted("DATEADD(MILLISECOND, -CAST(? AS BIGINT), CURRENT_TIMESTAMP)");

    private static final String UPDATE_INTERVAL = """
            UPDATE CRON_JOBS
               SET INTERVAL_MS = ?,
                   UPDATED_AT  = ?
             WHERE NAME = ?
            """;

    private static final String INSERT = """
            INSERT INTO CRON_JOBS (NAME, INTERVAL_MS, ENABLED, UPDATED_AT)
            VALUES (?, ?, TRUE, ?)
            """;

    // ------------------------------------------------------------------ claim

    @Override
    public boolean tryClaim(String name, Duration interval) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement(claimSql(c))) {
            ps.setString(1, name);
            ps.setLong(2, interval.toMillis());
            return ps.executeUpdate() == 1;
        }
    }

    private static String claimSql(Connection c) throws SQLException {
        String product = c.getMetaData().getDatabaseProductName();
        if ("H2".equalsIgnoreCase(product)) return CLAIM_H2;
        if ("PostgreSQL".equalsIgnoreCase(product)) return CLAIM_POSTGRES;
        throw new SQLFeatureNotSupportedException("CRON_JOBS claim not available for " + product);
    }

    // ------------------------------------------------------------------ reconcile

    @Override
    public void upsert(String name, long intervalMs, Instant now) throws Exception {
        Connection c = TxContext.require();
        if (updateInterval(c, name, intervalMs, now) > 0) return;

        // another process may insert the same name between our UPDATE and INSERT
        Savepoint sp = c.setSavepoint();
        try (PreparedStatement ps = c.prepareStatement(INSERT)) {
            ps.setString(1, name);
            ps.setLong(2, intervalMs);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (!JdbcUtil.isIntegrityViolation(e)) throw e;
            c.rollback(sp);
            if (updateInterval(c, name, intervalMs, now) == 0) {
                throw new IllegalStateException("CRON_JOBS row vanished during upsert: " + name, e);
            }
            return;
        }
        c.releaseSavepoint(sp);
    }

    private static int updateInterval(Connection c, String name, long intervalMs, Instant now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(UPDATE_INTERVAL)) {
            ps.setLong(1, intervalMs);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setString(3, name);
            return ps.executeUpdate();
        }
    }

    // ------------------------------------------------------------------ post-run

    @Override
    public void recordRun(String name, long durationMs, String lastError, Instant now) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE CRON_JOBS
                   SET LAST_RUN_DURATION_MS = ?,
                       LAST_ERROR           = ?,
                       UPDATED_AT           = ?
                 WHERE NAME = ?
                """)) {
            ps.setLong(1, durationMs);
            ps.setString(2, lastError);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setString(4, name);
            ps.executeUpdate();
        }
    }

    // ------------------------------------------------------------------ operator

    @Override
    public boolean setEnabled(String name, boolean enabled, Instant now) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE CRON_JOBS
                   SET ENABLED    = ?,
                       UPDATED_AT = ?
                 WHERE NAME = ?
                """)) {
            ps.setBoolean(1, enabled);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setString(3, name);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<CronJob> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM CRON_JOBS WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toCronJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<CronJob> findAll() throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM CRON_JOBS ORDER BY NAME");
             ResultSet rs = ps.executeQuery()) {
            List<CronJob> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toCronJob(rs));
            return out;
        }
    }
}
