package com.purchasingpower.appcommit.service;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.purchasingpower.appcommit.exception.MappingException;
import com.purchasingpower.appcommit.model.commit.CommitAction;
import com.purchasingpower.appcommit.model.commit.PlannedAction;
import com.purchasingpower.appcommit.model.git.ChangeKind;
import com.purchasingpower.appcommit.model.git.PathChange;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each kind of staged change to the commit actions that reproduce it remotely.
 */
public final class ActionResolver {

    private static final ImmutableMap<ChangeKind, Set<CommitAction>> ACTIONS;

    static {
        Map<ChangeKind, Set<CommitAction>> table = new EnumMap<>(ChangeKind.class);
        table.put(ChangeKind.MODIFIED, Sets.immutableEnumSet(CommitAction.ADD_PATH));
        table.put(ChangeKind.ADDED, Sets.immutableEnumSet(CommitAction.ADD_PATH));
        table.put(ChangeKind.COPIED, Sets.immutableEnumSet(CommitAction.ADD_PATH));
        table.put(ChangeKind.TYPE_CHANGED, Sets.immutableEnumSet(CommitAction.ADD_PATH));
        table.put(ChangeKind.RENAMED, Sets.immutableEnumSet(CommitAction.ADD_PATH, CommitAction.DELETE_ORIGINAL_PATH));
        table.put(ChangeKind.DELETED, Sets.immutableEnumSet(CommitAction.DELETE_PATH));
        table.put(ChangeKind.UNMODIFIED, Sets.immutableEnumSet(CommitAction.NOP));
        table.put(ChangeKind.IGNORED, Sets.immutableEnumSet(CommitAction.NOP));
        table.put(ChangeKind.UNTRACKED, Sets.immutableEnumSet(CommitAction.NOP));
        table.put(ChangeKind.UNREADABLE, Sets.immutableEnumSet(CommitAction.UNSUPPORTED));
        table.put(ChangeKind.CONFLICTED, Sets.immutableEnumSet(CommitAction.UNSUPPORTED));
        ACTIONS = Maps.immutableEnumMap(table);
    }

    private ActionResolver() {
    }

    /**
     * @return the actions for a change kind, in declaration order of {@link CommitAction}
     */
    public static Set<CommitAction> actionsFor(ChangeKind kind) {
        Set<CommitAction> actions = ACTIONS.get(kind);
        if (actions == null) {
            throw new IllegalStateException("No commit actions defined for " + kind);
        }
        return actions;
    }

    /**
     * Expands changes into path-bound actions. No-ops are dropped; for a rename the addition of the
     * new path precedes the deletion of the original one.
     *
     * @throws MappingException for unsupported change kinds or a rename without an original path
     */
    public static List<PlannedAction> plan(List<PathChange> changes) {
        List<PlannedAction> planned = new ArrayList<>();
        for (PathChange change : changes) {
            for (CommitAction action : actionsFor(change.kind())) {
                switch (action) {
                    case ADD_PATH, DELETE_PATH -> planned.add(new PlannedAction(action, change.path(), change));
                    case DELETE_ORIGINAL_PATH -> {
                        if (change.originalPath() == null || change.originalPath().isBlank()) {
                            throw new MappingException(change.path(),
                                    "Change " + change.kind() + " for " + change.path() + " has no original path");
                        }
                        planned.add(new PlannedAction(action, change.originalPath(), change));
                    }
                    case NOP -> {
                    }
                    case UNSUPPORTED -> throw new MappingException(change.path(),
                            "Unsupported change " + change.kind() + " for " + change.path());
                }
            }
        }
        return planned;
    }
}
