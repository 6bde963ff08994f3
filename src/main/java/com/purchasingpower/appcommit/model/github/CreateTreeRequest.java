package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * https://docs.github.com/en/rest/git/trees#create-a-tree
 */
public record CreateTreeRequest(
        @JsonProperty("base_tree") String baseTree,
        List<TreeNode> tree
) {
}
