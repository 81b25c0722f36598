package com.lionreader.platform.authentication.oauth;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.lionreader.platform.authentication.oauth.OAuthTestFixtures.REDIRECT_URI;
import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for AuthorizationCodeStore against the database.
 */
@Tag("integration")
@QuarkusTest
class AuthorizationCodeStoreTest {

    @Inject
    AuthorizationCodeStore codeStore;

    @Inject
    PkceService pkceService;

    @Inject
    OAuthTestFixtures fixtures;

    private OAuthClient client;
    private String userId;
    private String verifier;
    private String challenge;

    @BeforeEach
    void setUp() {
        client = fixtures.registerClient();
        userId = OAuthTestFixtures.uniqueUserId();
        verifier = OAuthTestFixtures.codeVerifier();
        challenge = pkceService.computeCodeChallenge(verifier);
    }

    private String issueCode() {
        return codeStore.issue(client.clientId, userId, REDIRECT_URI, List.of("mcp"), challenge,
            "https://lionreader.example.com/mcp", "state-1");
    }

    @Test
    void consume_shouldReturnGrant_whenEverythingMatches() {
        String code = issueCode();

        Optional<AuthorizationCodeGrant> grant = codeStore.consume(code, client.clientId, REDIRECT_URI, verifier);

        assertThat(grant).isPresent();
        assertThat(grant.get().userId()).isEqualTo(userId);
        assertThat(grant.get().clientId()).isEqualTo(client.clientId);
        assertThat(grant.get().scopes()).containsExactly("mcp");
        assertThat(grant.get().resource()).isEqualTo("https://lionreader.example.com/mcp");
    }

    @Test
    void issue_shouldStoreOnlyTheHash() {
        String code = issueCode();

        assertThat(code).hasSize(43);
        assertThat(fixtures.authorizationCodeExists(code)).isTrue();
    }

    @Test
    @DisplayName("A code can be consumed exactly once")
    void consume_shouldFailOnSecondUse() {
        String code = issueCode();

        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI, verifier)).isPresent();
        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI, verifier)).isEmpty();
    }

    @Test
    void consume_shouldFail_whenExpired() {
        String code = issueCode();
        fixtures.expireAuthorizationCode(code);

        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI, verifier)).isEmpty();
    }

    @Test
    void consume_shouldFail_whenClientDiffers() {
        String code = issueCode();
        OAuthClient other = fixtures.registerClient();

        assertThat(codeStore.consume(code, other.clientId, REDIRECT_URI, verifier)).isEmpty();
    }

    @Test
    void consume_shouldFail_whenRedirectUriDiffers() {
        String code = issueCode();

        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI + "/", verifier)).isEmpty();
    }

    @Test
    void consume_shouldFail_whenVerifierDoesNotMatch_andKeepCodeUsable() {
        String code = issueCode();

        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI, OAuthTestFixtures.codeVerifier())).isEmpty();
        assertThat(codeStore.consume(code, client.clientId, REDIRECT_URI, verifier)).isPresent();
    }

    @Test
    void consume_shouldFail_whenCodeUnknown() {
        assertThat(codeStore.consume("unknown-code", client.clientId, REDIRECT_URI, verifier)).isEmpty();
        assertThat(codeStore.consume(null, client.clientId, REDIRECT_URI, verifier)).isEmpty();
    }

    @Test
    @DisplayName("Concurrent redemptions of one code: exactly one succeeds")
    void consume_shouldLetExactlyOneConcurrentAttemptWin() throws Exception {
        String code = issueCode();
        int attempts = 4;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<AuthorizationCodeGrant>>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return codeStore.consume(code, client.clientId, REDIRECT_URI, verifier);
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<Optional<AuthorizationCodeGrant>> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
