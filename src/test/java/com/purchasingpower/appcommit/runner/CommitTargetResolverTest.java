package com.purchasingpower.appcommit.runner;

import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.repository.LocalGitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Commit target resolution")
class CommitTargetResolverTest {

    private static final String HEAD = "aa218f56b14c9653891f9e74264a383fa43fefbd";

    @Mock
    private LocalGitRepository localGitRepository;

    private AppProperties appProperties;
    private CommitTargetResolver resolver;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        resolver = new CommitTargetResolver(localGitRepository, appProperties);
    }

    @Test
    @DisplayName("Should take branch and parent from HEAD and the repository from the remote")
    void testResolve_FromRemote() {
        // Given
        when(localGitRepository.currentBranchName()).thenReturn(Optional.of("feature/x"));
        when(localGitRepository.headCommitId()).thenReturn(Optional.of(HEAD));
        when(localGitRepository.remoteUrl("origin")).thenReturn(Optional.of("git@github.com:octo-org/octo-repo.git"));

        // When
        CommitRequest request = resolver.resolve("Fix typo", true, null, null);

        // Then
        assertThat(request.repoOwner()).isEqualTo("octo-org");
        assertThat(request.repoName()).isEqualTo("octo-repo");
        assertThat(request.branchName()).isEqualTo("feature/x");
        assertThat(request.headCommitId()).isEqualTo(HEAD);
        assertThat(request.commitMessage()).isEqualTo("Fix typo");
        assertThat(request.forcePush()).isTrue();
    }

    @Test
    @DisplayName("Should prefer explicit overrides and configuration over the remote")
    void testResolve_Overrides() {
        // Given
        appProperties.getGithub().setRepoOwner("configured-org");
        appProperties.getGithub().setRepoName("configured-repo");
        when(localGitRepository.currentBranchName()).thenReturn(Optional.of("main"));
        when(localGitRepository.headCommitId()).thenReturn(Optional.of(HEAD));

        // When
        CommitRequest request = resolver.resolve("msg", false, "cli-org", "");

        // Then
        assertThat(request.repoOwner()).isEqualTo("cli-org");
        assertThat(request.repoName()).isEqualTo("configured-repo");
        verify(localGitRepository, never()).remoteUrl(anyString());
    }

    @Test
    @DisplayName("Should refuse a detached HEAD")
    void testResolve_DetachedHead() {
        when(localGitRepository.currentBranchName()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve("msg", false, null, null))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("detached");
    }

    @Test
    @DisplayName("Should refuse a remote that is not on GitHub")
    void testResolve_NonGitHubRemote() {
        when(localGitRepository.currentBranchName()).thenReturn(Optional.of("main"));
        when(localGitRepository.headCommitId()).thenReturn(Optional.of(HEAD));
        when(localGitRepository.remoteUrl("origin")).thenReturn(Optional.of("git@gitlab.com:octo-org/octo-repo.git"));

        assertThatThrownBy(() -> resolver.resolve("msg", false, null, null))
                .isInstanceOf(PreconditionException.class);
    }

    @Test
    @DisplayName("Should report a branch name that cannot be used in an API path")
    void testResolve_UnsafeBranch() {
        appProperties.getGithub().setRepoOwner("octo-org");
        appProperties.getGithub().setRepoName("octo-repo");
        when(localGitRepository.currentBranchName()).thenReturn(Optional.of("wip#1"));
        when(localGitRepository.headCommitId()).thenReturn(Optional.of(HEAD));

        assertThatThrownBy(() -> resolver.resolve("msg", false, null, null))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("Invalid branch name");
    }
}
