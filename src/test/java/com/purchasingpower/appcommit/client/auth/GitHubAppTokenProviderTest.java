package com.purchasingpower.appcommit.client.auth;

import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.exception.ResponseParseException;
import com.purchasingpower.appcommit.exception.UnexpectedStatusException;
import com.purchasingpower.appcommit.support.GitHubTestFixtures;
import com.purchasingpower.appcommit.support.MutableClock;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static com.purchasingpower.appcommit.support.GitHubTestFixtures.TOKEN_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("GitHub App token provider")
class GitHubAppTokenProviderTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private MutableClock clock;
    private GitHubAppTokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        AppProperties properties = GitHubTestFixtures.appProperties(wireMock.baseUrl());
        tokenProvider = GitHubTestFixtures.tokenProvider(properties, clock);
    }

    private static void stubTokens(String firstToken, String firstExpiry, String secondToken, String secondExpiry) {
        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
                .inScenario("tokens").whenScenarioStateIs(STARTED).willSetStateTo("renewed")
                .willReturn(tokenResponse(firstToken, firstExpiry)));
        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
                .inScenario("tokens").whenScenarioStateIs("renewed")
                .willReturn(tokenResponse(secondToken, secondExpiry)));
    }

    private static ResponseDefinitionBuilder tokenResponse(String token, String expiresAt) {
        return aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"token\":\"" + token + "\",\"expires_at\":\"" + expiresAt + "\",\"permissions\":{}}");
    }

    @Test
    @DisplayName("Should reuse a cached token that is not close to expiry")
    void testGetAccessToken_ShouldReuseCachedToken() {
        // Given
        stubTokens("ghs_first", "2024-01-01T01:00:00Z", "ghs_second", "2024-01-01T02:00:00Z");

        // When
        AccessToken first = tokenProvider.getAccessToken(false);
        clock.advance(Duration.ofMinutes(30));
        AccessToken second = tokenProvider.getAccessToken(false);

        // Then
        assertSame(first, second);
        assertEquals("ghs_first", first.value());
        assertEquals(Instant.parse("2024-01-01T01:00:00Z"), first.expiresAt());
        wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("Should renew when the token expires within the renewal margin")
    void testGetAccessToken_ShouldRenewNearExpiry() {
        // Given
        stubTokens("ghs_first", "2024-01-01T01:00:00Z", "ghs_second", "2024-01-01T02:00:00Z");
        AccessToken first = tokenProvider.getAccessToken(false);

        // When: 59 minutes later only one minute is left, below the two minute margin
        clock.advance(Duration.ofMinutes(59));
        AccessToken renewed = tokenProvider.getAccessToken(false);

        // Then
        assertNotSame(first, renewed);
        assertEquals("ghs_second", renewed.value());
        assertEquals("ghs_first", first.value(), "old snapshot must be unchanged");
        wireMock.verify(2, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("Should always fetch a new token when renewal is forced")
    void testGetAccessToken_ForcedShouldReturnNewInstance() {
        // Given
        stubTokens("ghs_first", "2024-01-01T01:00:00Z", "ghs_second", "2024-01-01T01:00:00Z");
        AccessToken first = tokenProvider.getAccessToken(false);

        // When
        AccessToken forced = tokenProvider.getAccessToken(true);

        // Then
        assertNotSame(first, forced);
        assertEquals("ghs_second", forced.value());
        assertSame(forced, tokenProvider.getAccessToken(false));
    }

    @Test
    @DisplayName("Should send a JWT signed with the app key and the standard GitHub headers")
    void testGetAccessToken_ShouldSendSignedJwt() {
        // Given
        stubTokens("ghs_first", "2024-01-01T01:00:00Z", "ghs_second", "2024-01-01T02:00:00Z");

        // When
        tokenProvider.getAccessToken(false);

        // Then
        wireMock.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                .withHeader("Accept", equalTo("application/vnd.github+json"))
                .withHeader("User-Agent", equalTo("app-commit"))
                .withHeader("X-GitHub-Api-Version", equalTo("2022-11-28"))
                .withHeader("Authorization", matching("Bearer .+")));

        List<LoggedRequest> requests = wireMock.findAll(postRequestedFor(urlEqualTo(TOKEN_PATH)));
        String jwt = requests.get(0).getHeader("Authorization").substring("Bearer ".length());
        Jws<Claims> parsed = Jwts.parser()
                .verifyWith(GitHubTestFixtures.keyPair().getPublic())
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(jwt);

        assertEquals("RS256", parsed.getHeader().getAlgorithm());
        assertEquals(String.valueOf(GitHubTestFixtures.APP_ID), parsed.getPayload().getIssuer());
        assertEquals(Date.from(NOW), parsed.getPayload().getIssuedAt());
        assertEquals(Date.from(NOW.plus(Duration.ofMinutes(10))), parsed.getPayload().getExpiration());
    }

    @Test
    @DisplayName("Should renew once and hand every concurrent caller the same token")
    void testGetAccessToken_ConcurrentCallersShareOneRenewal() throws Exception {
        // Given: a slow token endpoint
        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
                .willReturn(tokenResponse("ghs_shared", "2024-01-01T01:00:00Z").withFixedDelay(300)));
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<AccessToken>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return tokenProvider.getAccessToken(false);
                }));
            }

            // When
            start.countDown();
            List<AccessToken> tokens = new ArrayList<>();
            for (Future<AccessToken> future : futures) {
                tokens.add(future.get(10, TimeUnit.SECONDS));
            }

            // Then
            AccessToken first = tokens.get(0);
            assertEquals("ghs_shared", first.value());
            assertThat(tokens).allSatisfy(token -> assertSame(first, token));
            wireMock.verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should surface status and body when GitHub refuses the token request")
    void testGetAccessToken_ShouldFailOnUnexpectedStatus() {
        // Given
        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH))
                .willReturn(aResponse().withStatus(401).withBody("{\"message\":\"Bad credentials\"}")));

        // When / Then
        assertThatThrownBy(() -> tokenProvider.getAccessToken(false))
                .isInstanceOf(UnexpectedStatusException.class)
                .hasMessageContaining("401")
                .hasMessageContaining("Bad credentials")
                .satisfies(e -> assertThat(((UnexpectedStatusException) e).getStatusCode()).isEqualTo(401));
    }

    @Test
    @DisplayName("Should fail with the raw body when expires_at is not a timestamp")
    void testGetAccessToken_ShouldFailOnMalformedExpiry() {
        // Given
        wireMock.stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(tokenResponse("ghs_x", "tomorrow")));

        // When / Then
        assertThatThrownBy(() -> tokenProvider.getAccessToken(false))
                .isInstanceOf(ResponseParseException.class)
                .hasMessageContaining("tomorrow");
    }
}
