package com.purchasingpower.appcommit.service.impl;

import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.repository.LocalGitRepository;
import com.purchasingpower.appcommit.service.ChangeSetReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeSetReaderImpl implements ChangeSetReader {

    private static final Comparator<PathChange> BY_PATH = Comparator
            .comparing(PathChange::path)
            .thenComparing(PathChange::originalPath, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final LocalGitRepository localGitRepository;

    @Override
    public List<PathChange> readChanges() {
        List<String> conflicted = localGitRepository.conflictedPaths();
        if (!conflicted.isEmpty()) {
            throw new PreconditionException(
                    "Cannot commit with unresolved conflicts in the index: " + String.join(", ", conflicted));
        }

        List<PathChange> changes = localGitRepository.diffHeadToIndex().stream()
                .sorted(BY_PATH)
                .toList();

        log.info("Found {} staged change(s)", changes.size());
        changes.forEach(change -> log.debug("  {} {}{}", change.kind(), change.path(),
                change.originalPath() != null && !change.originalPath().equals(change.path())
                        ? " (from " + change.originalPath() + ")" : ""));
        return changes;
    }
}
