package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.SecureTokens;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Records which scopes each user has approved for each client.
 *
 * Approving again merges the new scopes into the existing grant. Revoking
 * a grant also revokes the user's tokens for that client.
 */
@ApplicationScoped
public class ConsentLedger {

    private static final Logger LOG = Logger.getLogger(ConsentLedger.class);

    @Inject
    ConsentGrantRepository consentRepo;

    @Inject
    TokenIssuer tokenIssuer;

    /**
     * True when an active grant for the pair covers every requested scope.
     */
    public boolean hasConsent(String userId, String clientId, Collection<String> scopes) {
        return consentRepo.findByUserAndClient(userId, clientId)
            .map(grant -> grant.covers(scopes))
            .orElse(false);
    }

    /**
     * Merge scopes into the user's grant for the client, reactivating a revoked one.
     *
     * The first approval for a pair inserts a revoked, empty placeholder row in its
     * own transaction; concurrent approvals then lock and merge into that one row.
     */
    @Transactional
    public ConsentGrant recordConsent(String userId, String clientId, Collection<String> scopes) {
        Instant now = Instant.now();
        Optional<ConsentGrant> existing = consentRepo.findByUserAndClientForUpdate(userId, clientId);
        if (existing.isEmpty()) {
            insertPlaceholder(userId, clientId, now);
            existing = consentRepo.findByUserAndClientForUpdate(userId, clientId);
        }
        ConsentGrant grant = existing.orElseThrow(() -> new IllegalStateException(
            "Consent row missing after insert for client " + SecureTokens.truncate(clientId)));

        Set<String> merged = new LinkedHashSet<>();
        if (grant.isActive()) {
            merged.addAll(grant.scopes);
        }
        merged.addAll(scopes);
        grant.scopes = new ArrayList<>(merged);
        grant.revokedAt = null;
        grant.updatedAt = now;
        consentRepo.update(grant);
        LOG.infof("User %s granted client %s: %s",
            SecureTokens.truncate(userId), SecureTokens.truncate(clientId), grant.scopes);
        return grant;
    }

    private void insertPlaceholder(String userId, String clientId, Instant now) {
        ConsentGrant placeholder = new ConsentGrant();
        placeholder.userId = userId;
        placeholder.clientId = clientId;
        placeholder.scopes = new ArrayList<>();
        placeholder.createdAt = now;
        placeholder.updatedAt = now;
        placeholder.revokedAt = now;
        try {
            QuarkusTransaction.requiringNew().run(() -> consentRepo.persist(placeholder));
        } catch (QuarkusTransactionException | PersistenceException e) {
            // another approval inserted the row first
            if (consentRepo.findByUserAndClient(userId, clientId).isEmpty()) {
                throw e;
            }
            LOG.debugf("Consent row for client %s created concurrently", SecureTokens.truncate(clientId));
        }
    }

    public List<ConsentGrant> listConsents(String userId) {
        return consentRepo.findActiveByUser(userId);
    }

    /**
     * Revoke the grant and every token the user holds for the client.
     *
     * @return false if there was no active grant
     */
    @Transactional
    public boolean revokeConsent(String userId, String clientId) {
        boolean revoked = consentRepo.revoke(userId, clientId, Instant.now());
        if (revoked) {
            tokenIssuer.revokeClientTokens(userId, clientId);
            LOG.infof("User %s revoked consent for client %s",
                SecureTokens.truncate(userId), SecureTokens.truncate(clientId));
        }
        return revoked;
    }
}
