package com.purchasingpower.appcommit.model.github.graphql;

import java.util.Map;

public record GraphQlRequest(String query, Map<String, Object> variables) {
}
