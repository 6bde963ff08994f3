package com.purchasingpower.appcommit.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Utf8;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.exception.CommitPipelineException;
import com.purchasingpower.appcommit.exception.ResponseParseException;
import com.purchasingpower.appcommit.exception.TransportException;
import com.purchasingpower.appcommit.exception.UnexpectedStatusException;
import com.purchasingpower.appcommit.model.CallContext;
import com.purchasingpower.appcommit.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Sends one request to GitHub and hands back status and body as text.
 * Status checks and JSON parsing happen after the body has been read, so errors can carry it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GitHubRequestExecutor {

    static final String API_VERSION_HEADER = "X-GitHub-Api-Version";

    private final WebClient gitHubWebClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    /**
     * @param uri          path relative to the API base URL, or an absolute URL
     * @param bearerToken  installation token or app JWT
     * @param restApi      adds the REST API version header
     * @param body         serialized as JSON when not null
     */
    public GitHubResponse execute(HttpMethod method, String uri, String bearerToken, boolean restApi,
                                  Object body, Duration timeout, CallContext ctx) {
        String json = body == null ? null : toJson(body, ctx.getOperation());
        ctx.logRequest(method + " " + uri, "body", ExternalCallLogger.truncate(json, 500));

        WebClient.RequestBodySpec spec = gitHubWebClient.method(method)
                .uri(uri)
                .headers(headers -> {
                    headers.setBearerAuth(bearerToken);
                    if (restApi) {
                        headers.set(API_VERSION_HEADER, appProperties.getGithub().getApiVersion());
                    }
                });
        WebClient.RequestHeadersSpec<?> request = json == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(json);

        GitHubResponse response;
        try {
            response = request
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(bytes -> new GitHubResponse(clientResponse.statusCode().value(), decode(bytes))))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String message = cause instanceof TimeoutException
                    ? "Timed out after " + timeout.toMillis() + "ms while " + ctx.getOperation()
                    : "Unable to send request while " + ctx.getOperation() + ": " + cause.getMessage();
            ctx.logError(message, cause);
            throw new TransportException(message, cause);
        }
        if (response == null) {
            throw new TransportException("No response received while " + ctx.getOperation(), null);
        }

        ctx.logResponse("HTTP " + response.statusCode(), "body", ExternalCallLogger.truncate(response.body(), 500));
        return response;
    }

    /**
     * @return the body when the status matches
     * @throws UnexpectedStatusException otherwise, carrying the raw body
     */
    public String expectStatus(GitHubResponse response, int expectedStatus, String operation) {
        if (response.statusCode() != expectedStatus) {
            log.warn("Unexpected status {} (expected {}) while {}", response.statusCode(), expectedStatus, operation);
            throw new UnexpectedStatusException(operation, expectedStatus, response.statusCode(), response.body());
        }
        return response.body();
    }

    public <T> T readBody(String body, Class<T> type, String operation) {
        if (body == null) {
            throw new ResponseParseException(operation, "(body is not valid UTF-8)", null);
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(operation, body, e);
        }
    }

    private String toJson(Object body, String operation) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new CommitPipelineException("Unable to serialize request while " + operation, e);
        }
    }

    private static String decode(byte[] bytes) {
        return Utf8.isWellFormed(bytes) ? new String(bytes, StandardCharsets.UTF_8) : null;
    }
}
