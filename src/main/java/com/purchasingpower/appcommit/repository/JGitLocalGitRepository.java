package com.purchasingpower.appcommit.repository;

import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.exception.ContentException;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.CallContext;
import com.purchasingpower.appcommit.model.ServiceType;
import com.purchasingpower.appcommit.model.git.ChangeKind;
import com.purchasingpower.appcommit.model.git.LoadedObject;
import com.purchasingpower.appcommit.model.git.LocalFileMode;
import com.purchasingpower.appcommit.model.git.ObjectKind;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.errors.CanceledException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RenameDetector;
import org.eclipse.jgit.dircache.DirCache;
import org.eclipse.jgit.dircache.DirCacheEntry;
import org.eclipse.jgit.dircache.DirCacheIterator;
import org.eclipse.jgit.errors.MissingObjectException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.NullProgressMonitor;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Component
public class JGitLocalGitRepository implements LocalGitRepository {

    private final Repository repository;
    private final boolean detectRenames;

    public JGitLocalGitRepository(Repository repository, AppProperties appProperties) {
        this.repository = repository;
        this.detectRenames = appProperties.getGit().isDetectRenames();
    }

    @Override
    public List<PathChange> diffHeadToIndex() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GIT, "diff HEAD..index", log);
        ctx.logRequest(repository.getDirectory().getPath(), "detectRenames", detectRenames);
        try {
            ObjectId headTree = repository.resolve(Constants.HEAD + "^{tree}");
            if (headTree == null) {
                throw new PreconditionException("HEAD does not point at a commit; create an initial commit first");
            }
            DirCache index = repository.readDirCache();

            List<DiffEntry> entries = new ArrayList<>();
            List<DiffEntry> typeChanges = new ArrayList<>();
            try (ObjectReader reader = repository.newObjectReader();
                 DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
                formatter.setRepository(repository);
                formatter.setDetectRenames(false);
                CanonicalTreeParser headParser = new CanonicalTreeParser();
                headParser.reset(reader, headTree);

                List<DiffEntry> scanned = formatter.scan(headParser, new DirCacheIterator(index));
                Set<String> typeChangedPaths = typeChangedPaths(scanned);

                // type changes must not reach RenameDetector, which pairs deletes and adds by content
                List<DiffEntry> candidates = new ArrayList<>();
                for (DiffEntry entry : scanned) {
                    switch (entry.getChangeType()) {
                        case ADD -> {
                            if (typeChangedPaths.contains(entry.getNewPath())) {
                                typeChanges.add(entry);
                            } else {
                                candidates.add(entry);
                            }
                        }
                        case DELETE -> {
                            if (!typeChangedPaths.contains(entry.getOldPath())) {
                                candidates.add(entry);
                            }
                        }
                        case MODIFY -> {
                            if (isTypeChange(entry)) {
                                typeChanges.add(entry);
                            } else {
                                candidates.add(entry);
                            }
                        }
                        default -> candidates.add(entry);
                    }
                }
                if (detectRenames) {
                    RenameDetector renameDetector = new RenameDetector(repository);
                    renameDetector.addAll(candidates);
                    entries.addAll(renameDetector.compute(reader, NullProgressMonitor.INSTANCE));
                } else {
                    entries.addAll(candidates);
                }
            }

            List<PathChange> changes = new ArrayList<>(entries.size() + typeChanges.size());
            for (DiffEntry entry : entries) {
                changes.add(toPathChange(entry, index));
            }
            for (DiffEntry entry : typeChanges) {
                changes.add(typeChange(entry, index));
            }
            ctx.logResponse(changes.size() + " changed path(s)");
            return changes;
        } catch (IOException | CanceledException e) {
            ctx.logError(e.getMessage(), e);
            throw new PreconditionException("Unable to diff HEAD against the index: " + e.getMessage(), e);
        }
    }

    private PathChange toPathChange(DiffEntry entry, DirCache index) {
        String newId = entry.getNewId().name();
        LocalFileMode newMode = LocalFileMode.fromBits(entry.getNewMode().getBits());

        return switch (entry.getChangeType()) {
            case ADD -> new PathChange(ChangeKind.ADDED, newMode, newId,
                    stagedObjectKind(index, entry.getNewPath()), entry.getNewPath(), entry.getNewPath());
            case MODIFY -> new PathChange(ChangeKind.MODIFIED,
                    newMode, newId, stagedObjectKind(index, entry.getNewPath()), entry.getNewPath(), entry.getNewPath());
            case DELETE -> PathChange.deleted(entry.getOldPath());
            case RENAME -> new PathChange(ChangeKind.RENAMED, newMode, newId,
                    stagedObjectKind(index, entry.getNewPath()), entry.getNewPath(), entry.getOldPath());
            case COPY -> new PathChange(ChangeKind.COPIED, newMode, newId,
                    stagedObjectKind(index, entry.getNewPath()), entry.getNewPath(), entry.getOldPath());
        };
    }

    /**
     * Paths that JGit reports as a delete plus an add because the staged object type differs
     * from the committed one (file to symlink, file to submodule, ...).
     */
    private static Set<String> typeChangedPaths(List<DiffEntry> scanned) {
        Set<String> deleted = new HashSet<>();
        for (DiffEntry entry : scanned) {
            if (entry.getChangeType() == DiffEntry.ChangeType.DELETE) {
                deleted.add(entry.getOldPath());
            }
        }
        Set<String> paths = new HashSet<>();
        for (DiffEntry entry : scanned) {
            if (entry.getChangeType() == DiffEntry.ChangeType.ADD && deleted.contains(entry.getNewPath())) {
                paths.add(entry.getNewPath());
            }
        }
        return paths;
    }

    private PathChange typeChange(DiffEntry entry, DirCache index) {
        return new PathChange(ChangeKind.TYPE_CHANGED, LocalFileMode.fromBits(entry.getNewMode().getBits()),
                entry.getNewId().name(), stagedObjectKind(index, entry.getNewPath()),
                entry.getNewPath(), entry.getNewPath());
    }

    private static boolean isTypeChange(DiffEntry entry) {
        return (entry.getOldMode().getBits() & FileMode.TYPE_MASK)
                != (entry.getNewMode().getBits() & FileMode.TYPE_MASK);
    }

    private static ObjectKind stagedObjectKind(DirCache index, String path) {
        DirCacheEntry staged = index.getEntry(path);
        if (staged == null || staged.getStage() != DirCacheEntry.STAGE_0) {
            return null;
        }
        return toObjectKind(staged.getFileMode().getObjectType());
    }

    private static ObjectKind toObjectKind(int objectType) {
        return switch (objectType) {
            case Constants.OBJ_BLOB -> ObjectKind.BLOB;
            case Constants.OBJ_TREE -> ObjectKind.TREE;
            case Constants.OBJ_COMMIT -> ObjectKind.COMMIT;
            default -> null;
        };
    }

    @Override
    public Optional<LoadedObject> readObject(String objectId) {
        if (objectId == null || !ObjectId.isId(objectId)) {
            return Optional.empty();
        }
        try (ObjectReader reader = repository.newObjectReader()) {
            ObjectLoader loader = reader.open(ObjectId.fromString(objectId));
            return Optional.of(new LoadedObject(objectId, toObjectKind(loader.getType()),
                    loader.getCachedBytes(Integer.MAX_VALUE)));
        } catch (MissingObjectException e) {
            log.debug("Object {} not found in the local object database", objectId);
            return Optional.empty();
        } catch (IOException e) {
            throw new ContentException(objectId, "Unable to read object " + objectId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> currentBranchName() {
        try {
            Ref head = repository.exactRef(Constants.HEAD);
            if (head == null || !head.isSymbolic()) {
                return Optional.empty();
            }
            return Optional.of(Repository.shortenRefName(head.getTarget().getName()));
        } catch (IOException e) {
            throw new PreconditionException("Unable to read HEAD: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> headCommitId() {
        try {
            ObjectId head = repository.resolve(Constants.HEAD + "^{commit}");
            return Optional.ofNullable(head).map(ObjectId::name);
        } catch (IOException e) {
            throw new PreconditionException("Unable to resolve HEAD: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> conflictedPaths() {
        try {
            DirCache index = repository.readDirCache();
            if (!index.hasUnmergedPaths()) {
                return List.of();
            }
            TreeSet<String> paths = new TreeSet<>();
            for (int i = 0; i < index.getEntryCount(); i++) {
                DirCacheEntry entry = index.getEntry(i);
                if (entry.getStage() != DirCacheEntry.STAGE_0) {
                    paths.add(entry.getPathString());
                }
            }
            return List.copyOf(paths);
        } catch (IOException e) {
            throw new PreconditionException("Unable to read the index: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> remoteUrl(String remoteName) {
        StoredConfig config = repository.getConfig();
        String pushUrl = config.getString("remote", remoteName, "pushurl");
        if (pushUrl != null && !pushUrl.isBlank()) {
            return Optional.of(pushUrl);
        }
        return Optional.ofNullable(config.getString("remote", remoteName, "url"));
    }
}
