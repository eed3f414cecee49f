package com.authgate.backend.modules.auth.application;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes expired rows from every token ledger. Expiry is already enforced on
 * lookup; this only keeps the tables small.
 */
@Component
public class TokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(TokenCleanupScheduler.class);

    private final List<TokenStore<?>> tokenStores;

    public TokenCleanupScheduler(List<TokenStore<?>> tokenStores) {
        this.tokenStores = List.copyOf(tokenStores);
    }

    @Scheduled(
            fixedDelayString = "${auth.cleanup.interval:PT1H}",
            initialDelayString = "${auth.cleanup.initial-delay:PT1M}"
    )
    public void purgeExpiredTokens() {
        int total = 0;
        for (TokenStore<?> store : tokenStores) {
            try {
                int deleted = store.cleanupExpired();
                total += deleted;
                if (deleted > 0) {
                    log.info("Deleted {} expired rows from {}", deleted, store.name());
                }
            } catch (DataAccessException ex) {
                log.error("Expired token cleanup failed for {}", store.name(), ex);
            }
        }
        log.debug("Expired token cleanup finished, {} rows deleted", total);
    }
}
