package com.purchasingpower.appcommit.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates names that end up inside GitHub API paths and payloads.
 *
 * Branch names are concatenated into {@code /git/ref/heads/<branch>} without URL encoding,
 * so only characters that are safe in a path segment are accepted.
 * Ref: https://git-scm.com/docs/git-check-ref-format
 */
@Slf4j
public final class GitInputValidator {

    private static final Pattern BRANCH_NAME = Pattern.compile("^[a-zA-Z0-9/_.-]+$");
    private static final Pattern REPO_SEGMENT = Pattern.compile("^[a-zA-Z0-9_.-]+$");
    private static final Pattern OBJECT_ID = Pattern.compile("^[a-fA-F0-9]{40}([a-fA-F0-9]{24})?$");

    private GitInputValidator() {
    }

    /**
     * @throws IllegalArgumentException if the branch name is blank, too long or not a valid ref component
     */
    public static void validateBranchName(String branchName) {
        if (branchName == null || branchName.isBlank()) {
            throw new IllegalArgumentException("Branch name cannot be null or blank");
        }
        if (branchName.length() > 200) {
            throw new IllegalArgumentException("Branch name too long (max 200 characters): " + branchName.length());
        }
        if (!BRANCH_NAME.matcher(branchName).matches()) {
            log.warn("⚠️ Rejected branch name: {}", sanitizeForLogging(branchName));
            throw new IllegalArgumentException(
                    "Invalid branch name. Only alphanumeric characters, dash, underscore, slash, and dot are allowed. "
                            + "Received: " + sanitizeForLogging(branchName));
        }
        if (branchName.startsWith("/") || branchName.endsWith("/")) {
            throw new IllegalArgumentException("Branch name cannot start or end with '/': " + branchName);
        }
        if (branchName.startsWith(".") || branchName.endsWith(".")) {
            throw new IllegalArgumentException("Branch name cannot start or end with '.': " + branchName);
        }
        if (branchName.contains("//") || branchName.contains("..")) {
            throw new IllegalArgumentException("Branch name cannot contain '//' or '..': " + branchName);
        }
        if (branchName.endsWith(".lock")) {
            throw new IllegalArgumentException("Branch name cannot end with '.lock': " + branchName);
        }
        log.debug("Validated branch name: {}", branchName);
    }

    /**
     * Owner and repository names are single path segments.
     */
    public static void validateRepoSegment(String label, String segment) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException("Repository " + label + " cannot be null or blank");
        }
        if (!REPO_SEGMENT.matcher(segment).matches()) {
            throw new IllegalArgumentException(
                    "Invalid repository " + label + ": " + sanitizeForLogging(segment));
        }
    }

    /**
     * Full SHA-1 (40) or SHA-256 (64) hex object id.
     */
    public static void validateObjectId(String objectId) {
        if (objectId == null || !OBJECT_ID.matcher(objectId).matches()) {
            throw new IllegalArgumentException("Invalid object id: " + sanitizeForLogging(objectId));
        }
    }

    private static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        String sanitized = input.length() > 100 ? input.substring(0, 100) + "..." : input;
        return sanitized.replaceAll("[\\r\\n]", " ");
    }
}
