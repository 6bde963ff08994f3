package com.purchasingpower.appcommit.client.auth;

import com.google.common.base.Suppliers;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Component;

import java.security.interfaces.RSAPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.function.Supplier;

/**
 * Signs the short-lived JWT a GitHub App presents when asking for an installation token.
 * https://docs.github.com/en/apps/creating-github-apps/authenticating-with-a-github-app/generating-a-json-web-token-jwt-for-a-github-app
 */
@Component
public class AppJwtFactory {

    static final Duration JWT_LIFETIME = Duration.ofMinutes(10);

    private final GitHubProperties github;
    private final Clock clock;
    private final Supplier<RSAPrivateKey> privateKey;

    public AppJwtFactory(AppProperties appProperties, Clock clock) {
        this.github = appProperties.getGithub();
        this.clock = clock;
        this.privateKey = Suppliers.memoize(() -> PrivateKeyLoader.load(github.getPrivateKeyPem()));
    }

    public String createJwt() {
        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(String.valueOf(github.getAppId()))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(JWT_LIFETIME)))
                .signWith(privateKey.get(), Jwts.SIG.RS256)
                .compact();
    }
}
