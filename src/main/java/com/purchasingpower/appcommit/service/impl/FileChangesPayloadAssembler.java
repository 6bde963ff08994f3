package com.purchasingpower.appcommit.service.impl;

import com.purchasingpower.appcommit.exception.MappingException;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitAction;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.model.commit.PlannedAction;
import com.purchasingpower.appcommit.model.git.ObjectKind;
import com.purchasingpower.appcommit.model.github.graphql.CommitMessage;
import com.purchasingpower.appcommit.model.github.graphql.CommittableBranch;
import com.purchasingpower.appcommit.model.github.graphql.CreateCommitOnBranchInput;
import com.purchasingpower.appcommit.model.github.graphql.FileAddition;
import com.purchasingpower.appcommit.model.github.graphql.FileChanges;
import com.purchasingpower.appcommit.model.github.graphql.FileDeletion;
import com.purchasingpower.appcommit.service.ContentResolver;
import com.purchasingpower.appcommit.service.PayloadAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the input of the {@code createCommitOnBranch} mutation. All contents are sent as base64.
 * Paths are validated before any content is read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileChangesPayloadAssembler implements PayloadAssembler<CreateCommitOnBranchInput> {

    private final ContentResolver contentResolver;

    @Override
    public CreateCommitOnBranchInput assemble(CommitRequest target, List<PlannedAction> actions) {
        List<PlannedAction> additions = new ArrayList<>();
        List<PlannedAction> deletions = new ArrayList<>();
        for (PlannedAction planned : actions) {
            if (planned.action() == CommitAction.ADD_PATH) {
                additions.add(planned);
            } else if (planned.action().isDeletion()) {
                deletions.add(planned);
            }
        }
        validate(additions, deletions);

        List<FileAddition> fileAdditions = new ArrayList<>(additions.size());
        for (PlannedAction planned : additions) {
            if (planned.change().objectKind() != ObjectKind.BLOB) {
                throw new MappingException(planned.targetPath(), "Cannot commit " + planned.targetPath()
                        + " through createCommitOnBranch: only regular files are supported, found "
                        + planned.change().mode());
            }
            String contents = contentResolver.resolve(planned.change()).toBase64();
            fileAdditions.add(new FileAddition(planned.targetPath(), contents));
        }
        List<FileDeletion> fileDeletions = deletions.stream()
                .map(planned -> new FileDeletion(planned.targetPath()))
                .toList();

        log.info("Assembled file changes: {} addition(s), {} deletion(s)", fileAdditions.size(), fileDeletions.size());
        return new CreateCommitOnBranchInput(
                new CommittableBranch(target.repositoryNameWithOwner(), target.branchName()),
                target.headCommitId(),
                new FileChanges(fileAdditions, fileDeletions),
                CommitMessage.fromText(target.commitMessage()));
    }

    private static void validate(List<PlannedAction> additions, List<PlannedAction> deletions) {
        if (additions.isEmpty() && deletions.isEmpty()) {
            throw new PreconditionException("No changes to commit");
        }
        Set<String> added = uniquePaths(additions, "added");
        Set<String> deleted = uniquePaths(deletions, "deleted");
        for (String path : added) {
            if (deleted.contains(path)) {
                throw new MappingException(path, "Path " + path + " is both added and deleted");
            }
        }
    }

    private static Set<String> uniquePaths(List<PlannedAction> actions, String verb) {
        Set<String> paths = new HashSet<>();
        for (PlannedAction planned : actions) {
            if (!paths.add(planned.targetPath())) {
                throw new MappingException(planned.targetPath(),
                        "Path " + planned.targetPath() + " is " + verb + " more than once");
            }
        }
        return paths;
    }
}
