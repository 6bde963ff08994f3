package com.purchasingpower.appcommit.service.impl;

import com.purchasingpower.appcommit.client.GitHubApiClient;
import com.purchasingpower.appcommit.exception.MappingException;
import com.purchasingpower.appcommit.model.commit.CommitAction;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.model.commit.PlannedAction;
import com.purchasingpower.appcommit.model.commit.ResolvedContent;
import com.purchasingpower.appcommit.model.git.LocalFileMode;
import com.purchasingpower.appcommit.model.git.ObjectKind;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.model.github.BlobEncoding;
import com.purchasingpower.appcommit.model.github.BlobResponse;
import com.purchasingpower.appcommit.model.github.CreateBlobRequest;
import com.purchasingpower.appcommit.model.github.CreateTreeRequest;
import com.purchasingpower.appcommit.model.github.GitHubFileMode;
import com.purchasingpower.appcommit.model.github.GitHubNodeType;
import com.purchasingpower.appcommit.model.github.TreeNode;
import com.purchasingpower.appcommit.model.github.TreeNodeSource;
import com.purchasingpower.appcommit.service.ContentResolver;
import com.purchasingpower.appcommit.service.PayloadAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a create-a-tree request on top of the prior commit's tree.
 * Binary files are uploaded as blobs first and referenced by sha; text is inlined.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TreePayloadAssembler implements PayloadAssembler<CreateTreeRequest> {

    private final ContentResolver contentResolver;
    private final GitHubApiClient gitHubApiClient;

    @Override
    public CreateTreeRequest assemble(CommitRequest target, List<PlannedAction> actions) {
        List<TreeNode> nodes = new ArrayList<>(actions.size());
        for (PlannedAction planned : actions) {
            if (planned.action() == CommitAction.ADD_PATH) {
                nodes.add(additionNode(target, planned));
            } else if (planned.action().isDeletion()) {
                // GitHub ignores mode and type when sha is null, but both must be present
                nodes.add(new TreeNode(planned.targetPath(), GitHubFileMode.BLOB, GitHubNodeType.BLOB,
                        TreeNodeSource.deletion()));
            }
        }
        log.info("Assembled tree with {} node(s) on base {}", nodes.size(), target.headCommitId());
        return new CreateTreeRequest(target.headCommitId(), nodes);
    }

    private TreeNode additionNode(CommitRequest target, PlannedAction planned) {
        PathChange change = planned.change();
        String path = planned.targetPath();
        GitHubFileMode mode = toGitHubMode(path, change.mode());
        GitHubNodeType type = toNodeType(path, change.objectKind());

        if (type != GitHubNodeType.BLOB) {
            // submodule commits and trees are referenced, not uploaded
            return new TreeNode(path, mode, type, TreeNodeSource.sha(change.contentId()));
        }

        ResolvedContent content = contentResolver.resolve(change);
        if (content.isText()) {
            return new TreeNode(path, mode, type, TreeNodeSource.content(content.getValue()));
        }
        BlobResponse blob = gitHubApiClient.createBlob(target.repoOwner(), target.repoName(),
                new CreateBlobRequest(content.getValue(), BlobEncoding.BASE64));
        log.debug("Uploaded binary {} as blob {}", path, blob.sha());
        return new TreeNode(path, mode, type, TreeNodeSource.sha(blob.sha()));
    }

    static GitHubFileMode toGitHubMode(String path, LocalFileMode mode) {
        return switch (mode) {
            case REGULAR -> GitHubFileMode.BLOB;
            case EXECUTABLE -> GitHubFileMode.EXECUTABLE;
            case SYMLINK -> GitHubFileMode.SYMLINK;
            case SUBMODULE -> GitHubFileMode.SUBMODULE;
            case TREE -> GitHubFileMode.SUBDIRECTORY;
            case GROUP_WRITABLE, UNREADABLE -> throw new MappingException(path,
                    "Unsupported file mode " + mode + " for " + path);
        };
    }

    static GitHubNodeType toNodeType(String path, ObjectKind kind) {
        if (kind == null) {
            throw new MappingException(path, "Unable to determine the object type staged for " + path);
        }
        return switch (kind) {
            case BLOB -> GitHubNodeType.BLOB;
            case TREE -> GitHubNodeType.TREE;
            case COMMIT -> GitHubNodeType.COMMIT;
        };
    }
}
