package com.purchasingpower.appcommit.model.github.graphql;

import java.util.List;

public record FileChanges(List<FileAddition> additions, List<FileDeletion> deletions) {
}
