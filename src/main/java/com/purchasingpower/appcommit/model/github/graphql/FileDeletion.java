package com.purchasingpower.appcommit.model.github.graphql;

public record FileDeletion(String path) {
}
