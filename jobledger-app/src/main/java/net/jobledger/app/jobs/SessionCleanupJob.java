package net.jobledger.app.jobs;

import net.jobledger.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;

/** Hourly purge of expired login sessions. */
public class SessionCleanupJob {
    private static final Logger log = LoggerFactory.getLogger(SessionCleanupJob.class);

    public static final String NAME = "session-cleanup";

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public SessionCleanupJob(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public int purgeExpired() {
        var now = clock.now();
        int deleted = jdbc.update("DELETE FROM USER_SESSIONS WHERE EXPIRES_AT <= ?", Timestamp.from(now));
        log.info("Expired sessions purged: {} row(s) as of {}", deleted, now);
        return deleted;
    }
}
