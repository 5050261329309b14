package com.selfmx.gateway.cron;

import com.selfmx.auth.AdminSessionStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drops expired admin sessions from memory.
 */
public class AdminSessionPurgeCron extends CronJob {
    private static final Logger log = LogManager.getLogger(AdminSessionPurgeCron.class);

    private final AdminSessionStore sessions;

    public AdminSessionPurgeCron(AdminSessionStore sessions, long initialDelaySeconds, long periodSeconds) {
        super("admin-session-purge-cron", initialDelaySeconds, periodSeconds);
        this.sessions = sessions;
    }

    @Override
    protected void execute() {
        int purged = sessions.purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired admin sessions", purged);
        }
    }
}
