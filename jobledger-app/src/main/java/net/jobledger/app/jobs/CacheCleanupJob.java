package net.jobledger.app.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;

public class CacheCleanupJob {
    private static final Logger log = LoggerFactory.getLogger(CacheCleanupJob.class);

    public static final String NAME = "cache-cleanup";

    private final CacheManager caches;

    public CacheCleanupJob(CacheManager caches) {
        this.caches = caches;
    }

    public int clearAll() {
        int cleared = 0;
        for (var name : caches.getCacheNames()) {
            var cache = caches.getCache(name);
            if (cache == null) continue;
            cache.clear();
            cleared++;
        }
        log.info("Caches cleared: {}", cleared);
        return cleared;
    }
}
