package net.jobledger.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Database for the adapter tests, picked in this order:
 * JOBLEDGER_JDBC_URL (+ _USERNAME/_PASSWORD), PostgreSQL in Testcontainers when
 * {@code -Djobledger.it.postgres=true}, otherwise in-memory H2 in PostgreSQL mode.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    protected static PostgreSQLContainer<?> postgres;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("JOBLEDGER_JDBC_URL");
        String user = System.getenv("JOBLEDGER_JDBC_USERNAME");
        String pass = System.getenv("JOBLEDGER_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            if (Boolean.getBoolean("jobledger.it.postgres")) {
                postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"))
                        .withStartupTimeout(Duration.ofMinutes(2));
                postgres.start();
                url = postgres.getJdbcUrl();
                user = postgres.getUsername();
                pass = postgres.getPassword();
            } else {
                url = "jdbc:h2:mem:" + getClass().getSimpleName()
                        + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
                user = "sa";
                pass = "";
            }
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/jobledger")
                .cleanDisabled(false)
                .load()
                .migrate();
    }

    protected void truncateLedger() throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("DELETE FROM CRON_JOBS");
        }
    }

    /** The database clock as seen by {@code c}; fixed for the rest of c's transaction. */
    protected static Instant dbNow(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT CURRENT_TIMESTAMP");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getTimestamp(1).toInstant();
        }
    }

    protected static void setLastRun(Connection c, String name, Instant lastRunAt) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE CRON_JOBS SET LAST_RUN_AT = ? WHERE NAME = ?")) {
            ps.setTimestamp(1, JdbcUtil.ts(lastRunAt));
            ps.setString(2, name);
            ps.executeUpdate();
        }
    }

    /** Moves LAST_RUN_AT into the past, which to the claim looks like time passing. */
    protected void backdateLastRun(String name, Duration by) throws SQLException {
        try (Connection c = ds.getConnection()) {
            Timestamp last;
            try (PreparedStatement ps = c.prepareStatement("SELECT LAST_RUN_AT FROM CRON_JOBS WHERE NAME = ?")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) throw new IllegalStateException("no CRON_JOBS row: " + name);
                    last = rs.getTimestamp(1);
                }
            }
            setLastRun(c, name, last.toInstant().minus(by));
        }
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (postgres != null) postgres.stop();
    }
}
