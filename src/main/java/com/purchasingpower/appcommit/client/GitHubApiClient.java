package com.purchasingpower.appcommit.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.appcommit.client.auth.GitHubAppTokenProvider;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties;
import com.purchasingpower.appcommit.exception.RemoteOperationException;
import com.purchasingpower.appcommit.exception.ResponseParseException;
import com.purchasingpower.appcommit.model.CallContext;
import com.purchasingpower.appcommit.model.ServiceType;
import com.purchasingpower.appcommit.model.github.BlobResponse;
import com.purchasingpower.appcommit.model.github.CommitResponse;
import com.purchasingpower.appcommit.model.github.CreateBlobRequest;
import com.purchasingpower.appcommit.model.github.CreateCommitRequest;
import com.purchasingpower.appcommit.model.github.CreateReferenceRequest;
import com.purchasingpower.appcommit.model.github.CreateTreeRequest;
import com.purchasingpower.appcommit.model.github.ReferenceResponse;
import com.purchasingpower.appcommit.model.github.TreeResponse;
import com.purchasingpower.appcommit.model.github.UpdateReferenceRequest;
import com.purchasingpower.appcommit.model.github.graphql.CreateCommitOnBranchInput;
import com.purchasingpower.appcommit.model.github.graphql.GraphQlRequest;
import com.purchasingpower.appcommit.util.ExternalCallLogger;
import com.purchasingpower.appcommit.util.GitInputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Git database and GraphQL operations against the GitHub API, authenticated as the app installation.
 * Every call declares the status it expects; nothing is retried.
 */
@Slf4j
@Component
public class GitHubApiClient {

    static final String CREATE_COMMIT_ON_BRANCH_MUTATION =
            "mutation ($input: CreateCommitOnBranchInput!) { createCommitOnBranch(input: $input) { commit { url } } }";

    private final GitHubRequestExecutor executor;
    private final GitHubAppTokenProvider tokenProvider;
    private final GitHubProperties github;

    public GitHubApiClient(GitHubRequestExecutor executor, GitHubAppTokenProvider tokenProvider,
                           AppProperties appProperties) {
        this.executor = executor;
        this.tokenProvider = tokenProvider;
        this.github = appProperties.getGithub();
    }

    public BlobResponse createBlob(String owner, String repo, CreateBlobRequest request) {
        return post(repoPath(owner, repo) + "/git/blobs", request, 201, "creating a blob", BlobResponse.class);
    }

    public TreeResponse createTree(String owner, String repo, CreateTreeRequest request) {
        return post(repoPath(owner, repo) + "/git/trees", request, 201, "creating a tree", TreeResponse.class);
    }

    public CommitResponse createCommit(String owner, String repo, CreateCommitRequest request) {
        return post(repoPath(owner, repo) + "/git/commits", request, 201, "creating a commit", CommitResponse.class);
    }

    /**
     * @return the branch reference, or empty when GitHub answers 404
     */
    public Optional<ReferenceResponse> getReference(String owner, String repo, String branch) {
        GitInputValidator.validateBranchName(branch);
        String operation = "getting reference heads/" + branch;
        GitHubResponse response = send(HttpMethod.GET, repoPath(owner, repo) + "/git/ref/heads/" + branch,
                null, true, operation);
        if (response.statusCode() == 404) {
            log.info("Branch {} does not exist on {}/{}", branch, owner, repo);
            return Optional.empty();
        }
        String body = executor.expectStatus(response, 200, operation);
        return Optional.of(executor.readBody(body, ReferenceResponse.class, operation));
    }

    public ReferenceResponse createReference(String owner, String repo, CreateReferenceRequest request) {
        return post(repoPath(owner, repo) + "/git/refs", request, 201,
                "creating reference " + request.ref(), ReferenceResponse.class);
    }

    public ReferenceResponse updateReference(String owner, String repo, String branch, UpdateReferenceRequest request) {
        GitInputValidator.validateBranchName(branch);
        String operation = "updating reference heads/" + branch;
        GitHubResponse response = send(HttpMethod.PATCH, repoPath(owner, repo) + "/git/refs/heads/" + branch,
                request, true, operation);
        String body = executor.expectStatus(response, 200, operation);
        return executor.readBody(body, ReferenceResponse.class, operation);
    }

    /**
     * Runs the {@code createCommitOnBranch} mutation.
     *
     * @return URL of the created commit
     * @throws RemoteOperationException when the response carries an {@code errors} array
     */
    public String createCommitOnBranch(CreateCommitOnBranchInput input) {
        String operation = "running createCommitOnBranch";
        GraphQlRequest request = new GraphQlRequest(CREATE_COMMIT_ON_BRANCH_MUTATION, Map.of("input", input));

        GitHubResponse response = send(HttpMethod.POST, github.graphqlUrl(), request, false, operation);
        String body = executor.expectStatus(response, 200, operation);
        JsonNode root = executor.readBody(body, JsonNode.class, operation);

        JsonNode errors = root.get("errors");
        if (errors != null && !errors.isNull()) {
            throw new RemoteOperationException(errors.toString());
        }
        JsonNode url = root.path("data").path("createCommitOnBranch").path("commit").path("url");
        if (!url.isTextual()) {
            throw new ResponseParseException(operation, body, null);
        }
        return url.asText();
    }

    private <T> T post(String uri, Object request, int expectedStatus, String operation, Class<T> responseType) {
        GitHubResponse response = send(HttpMethod.POST, uri, request, true, operation);
        String body = executor.expectStatus(response, expectedStatus, operation);
        return executor.readBody(body, responseType, operation);
    }

    private GitHubResponse send(HttpMethod method, String uri, Object body, boolean restApi, String operation) {
        String token = tokenProvider.getAccessToken().value();
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GITHUB, operation, log);
        return executor.execute(method, uri, token, restApi, body, github.getRequestTimeout(), ctx);
    }

    private static String repoPath(String owner, String repo) {
        GitInputValidator.validateRepoSegment("owner", owner);
        GitInputValidator.validateRepoSegment("name", repo);
        return "/repos/" + owner + "/" + repo;
    }
}
