package com.purchasingpower.appcommit.client.auth;

import com.purchasingpower.appcommit.client.GitHubRequestExecutor;
import com.purchasingpower.appcommit.client.GitHubResponse;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties;
import com.purchasingpower.appcommit.exception.ResponseParseException;
import com.purchasingpower.appcommit.model.CallContext;
import com.purchasingpower.appcommit.model.ServiceType;
import com.purchasingpower.appcommit.model.github.AccessTokenResponse;
import com.purchasingpower.appcommit.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out installation access tokens, renewing them shortly before they expire.
 *
 * <p>Check-and-renew runs under a lock so concurrent callers never trigger two renewals.
 * The cached {@link AccessToken} is replaced on renewal, never mutated.
 */
@Slf4j
@Component
public class GitHubAppTokenProvider {

    private static final String OPERATION = "creating an installation access token";

    private final GitHubRequestExecutor executor;
    private final AppJwtFactory jwtFactory;
    private final GitHubProperties github;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile AccessToken cached;

    public GitHubAppTokenProvider(GitHubRequestExecutor executor, AppJwtFactory jwtFactory,
                                  AppProperties appProperties, Clock clock) {
        this.executor = executor;
        this.jwtFactory = jwtFactory;
        this.github = appProperties.getGithub();
        this.clock = clock;
    }

    public AccessToken getAccessToken(boolean forceRenewal) {
        lock.lock();
        try {
            AccessToken current = cached;
            if (!forceRenewal && current != null
                    && !current.expiresWithin(github.getTokenRenewalMargin(), clock.instant())) {
                return current;
            }
            log.debug("Renewing installation token (forced={}, cached={})", forceRenewal, current);
            AccessToken renewed = requestToken();
            cached = renewed;
            return renewed;
        } finally {
            lock.unlock();
        }
    }

    public AccessToken getAccessToken() {
        return getAccessToken(false);
    }

    private AccessToken requestToken() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GITHUB_AUTH, OPERATION, log);
        String uri = "/app/installations/" + github.getInstallationId() + "/access_tokens";

        GitHubResponse response = executor.execute(HttpMethod.POST, uri, jwtFactory.createJwt(), true,
                null, github.getTokenTimeout(), ctx);
        String body = executor.expectStatus(response, 201, OPERATION);
        AccessTokenResponse token = executor.readBody(body, AccessTokenResponse.class, OPERATION);

        if (token.token() == null || token.expiresAt() == null) {
            throw new ResponseParseException(OPERATION, body, null);
        }
        Instant expiresAt;
        try {
            expiresAt = OffsetDateTime.parse(token.expiresAt()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ResponseParseException(OPERATION, body, e);
        }
        log.info("Installation token obtained, expires at {}", expiresAt);
        return new AccessToken(token.token(), expiresAt);
    }
}
