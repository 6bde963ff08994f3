package com.purchasingpower.appcommit.service.impl;

import com.purchasingpower.appcommit.exception.MappingException;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitAction;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.model.commit.PlannedAction;
import com.purchasingpower.appcommit.model.commit.ResolvedContent;
import com.purchasingpower.appcommit.model.git.ChangeKind;
import com.purchasingpower.appcommit.model.git.LocalFileMode;
import com.purchasingpower.appcommit.model.git.ObjectKind;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.model.github.graphql.CreateCommitOnBranchInput;
import com.purchasingpower.appcommit.model.github.graphql.FileAddition;
import com.purchasingpower.appcommit.model.github.graphql.FileDeletion;
import com.purchasingpower.appcommit.service.ActionResolver;
import com.purchasingpower.appcommit.service.ContentResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.purchasingpower.appcommit.support.PathChangeFixtures.blobChange;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("createCommitOnBranch payload assembly")
class FileChangesPayloadAssemblerTest {

    private static final String HEAD = "aa218f56b14c9653891f9e74264a383fa43fefbd";
    private static final String BLOB_ID = "557db03de997c86a4a028e1ebd3a1ceb225be238";

    @Mock
    private ContentResolver contentResolver;

    private FileChangesPayloadAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new FileChangesPayloadAssembler(contentResolver);
    }

    private static CommitRequest target(String message) {
        return CommitRequest.builder()
                .commitMessage(message)
                .repoOwner("octo-org")
                .repoName("octo-repo")
                .branchName("feature/x")
                .headCommitId(HEAD)
                .build();
    }

    @Test
    @DisplayName("Should send text as base64 and split the message into headline and body")
    void testAssemble_AdditionsAndDeletions() {
        // Given
        PathChange added = blobChange(ChangeKind.ADDED, "foo.txt", LocalFileMode.REGULAR, BLOB_ID);
        when(contentResolver.resolve(added)).thenReturn(ResolvedContent.text("foo\n"));
        List<PlannedAction> actions = ActionResolver.plan(List.of(added, PathChange.deleted("bar.txt")));

        // When
        CreateCommitOnBranchInput input = assembler.assemble(target("Add foo\n\nLonger explanation.\n"), actions);

        // Then
        assertThat(input.branch().repositoryNameWithOwner()).isEqualTo("octo-org/octo-repo");
        assertThat(input.branch().branchName()).isEqualTo("feature/x");
        assertThat(input.expectedHeadOid()).isEqualTo(HEAD);
        assertThat(input.fileChanges().additions()).containsExactly(new FileAddition("foo.txt", "Zm9vCg=="));
        assertThat(input.fileChanges().deletions()).containsExactly(new FileDeletion("bar.txt"));
        assertThat(input.message().headline()).isEqualTo("Add foo");
        assertThat(input.message().body()).isEqualTo("Longer explanation.");
    }

    @Test
    @DisplayName("Should omit the body of a one-line message")
    void testAssemble_HeadlineOnly() {
        List<PlannedAction> actions = ActionResolver.plan(List.of(PathChange.deleted("bar.txt")));

        CreateCommitOnBranchInput input = assembler.assemble(target("Remove bar"), actions);

        assertThat(input.message().headline()).isEqualTo("Remove bar");
        assertThat(input.message().body()).isNull();
        assertThat(input.fileChanges().additions()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an empty change set")
    void testAssemble_Empty() {
        assertThatThrownBy(() -> assembler.assemble(target("msg"), List.of()))
                .isInstanceOf(PreconditionException.class)
                .hasMessage("No changes to commit");
    }

    @Test
    @DisplayName("Should reject a path that is both added and deleted before reading content")
    void testAssemble_Overlap() {
        PathChange change = blobChange(ChangeKind.MODIFIED, "same.txt", LocalFileMode.REGULAR, BLOB_ID);
        List<PlannedAction> actions = List.of(
                new PlannedAction(CommitAction.ADD_PATH, "same.txt", change),
                new PlannedAction(CommitAction.DELETE_PATH, "same.txt", PathChange.deleted("same.txt")));

        assertThatThrownBy(() -> assembler.assemble(target("msg"), actions))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("same.txt");
        verifyNoInteractions(contentResolver);
    }

    @Test
    @DisplayName("Should reject a path added twice")
    void testAssemble_DuplicateAddition() {
        PathChange change = blobChange(ChangeKind.MODIFIED, "dup.txt", LocalFileMode.REGULAR, BLOB_ID);
        List<PlannedAction> actions = List.of(
                new PlannedAction(CommitAction.ADD_PATH, "dup.txt", change),
                new PlannedAction(CommitAction.ADD_PATH, "dup.txt", change));

        assertThatThrownBy(() -> assembler.assemble(target("msg"), actions))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("Should reject a path deleted twice")
    void testAssemble_DuplicateDeletion() {
        PathChange deleted = PathChange.deleted("gone.txt");
        List<PlannedAction> actions = List.of(
                new PlannedAction(CommitAction.DELETE_PATH, "gone.txt", deleted),
                new PlannedAction(CommitAction.DELETE_PATH, "gone.txt", deleted));

        assertThatThrownBy(() -> assembler.assemble(target("msg"), actions))
                .isInstanceOf(MappingException.class)
                .hasMessage("Path gone.txt is deleted more than once");
        verifyNoInteractions(contentResolver);
    }

    @Test
    @DisplayName("Should reject submodules, which the mutation cannot express")
    void testAssemble_Submodule() {
        PathChange submodule = new PathChange(ChangeKind.ADDED, LocalFileMode.SUBMODULE,
                "0123456789abcdef0123456789abcdef01234567", ObjectKind.COMMIT, "vendor/lib", "vendor/lib");

        assertThatThrownBy(() -> assembler.assemble(target("msg"), ActionResolver.plan(List.of(submodule))))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("vendor/lib");
        verifyNoInteractions(contentResolver);
    }
}
