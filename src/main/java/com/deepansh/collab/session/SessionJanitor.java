package com.deepansh.collab.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: completes idle sessions and purges retired ones.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionJanitor {

    private final SessionLifecycleManager lifecycleManager;

    @Scheduled(fixedDelayString = "${collab.sessions.janitor-interval-ms:30000}",
            initialDelayString = "${collab.sessions.janitor-interval-ms:30000}")
    public void sweep() {
        try {
            int expired = lifecycleManager.expireIdleSessions();
            int purged = lifecycleManager.purgeRetired();
            if (expired > 0 || purged > 0) {
                log.info("Janitor sweep [expired={}, purged={}]", expired, purged);
            }
        } catch (Exception e) {
            log.error("Janitor sweep failed: {}", e.getMessage(), e);
        }
    }
}
