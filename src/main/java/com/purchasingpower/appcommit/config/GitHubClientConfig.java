package com.purchasingpower.appcommit.config;

import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Slf4j
@Configuration
public class GitHubClientConfig {

    static final String GITHUB_JSON = "application/vnd.github+json";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared client for REST, GraphQL and token calls. Per-call deadlines are applied by
     * {@link com.purchasingpower.appcommit.client.GitHubRequestExecutor}.
     */
    @Bean
    public WebClient gitHubWebClient(WebClient.Builder builder, AppProperties appProperties) {
        GitHubProperties github = appProperties.getGithub();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) github.getTokenTimeout().toMillis());

        log.info("GitHub API base URL: {}", github.getApiBaseUrl());
        return builder
                .baseUrl(github.getApiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader(HttpHeaders.USER_AGENT, github.getUserAgent())
                .build();
    }
}
