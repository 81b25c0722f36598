package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Deletes expired authorization codes and tokens.
 *
 * Expiry is already enforced at read time; this only reclaims storage.
 */
@ApplicationScoped
public class OAuthJanitor {

    private static final Logger LOG = Logger.getLogger(OAuthJanitor.class);

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    AccessTokenRepository accessTokenRepo;

    @Inject
    RefreshTokenRepository refreshTokenRepo;

    @Inject
    AuthConfig authConfig;

    @Scheduled(every = "${lionreader.auth.oauth.janitor-interval}", identity = "oauth-janitor",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledCleanup() {
        purgeExpired();
    }

    /**
     * @return number of rows deleted
     */
    @Transactional
    public long purgeExpired() {
        Instant cutoff = Instant.now().minus(authConfig.oauth().janitorRetention());
        long codes = codeRepo.deleteExpiredBefore(cutoff);
        long access = accessTokenRepo.deleteExpiredBefore(cutoff);
        long refresh = refreshTokenRepo.deleteExpiredBefore(cutoff);
        if (codes + access + refresh > 0) {
            LOG.infof("Purged %d authorization codes, %d access tokens, %d refresh tokens expired before %s",
                codes, access, refresh, cutoff);
        }
        return codes + access + refresh;
    }
}
