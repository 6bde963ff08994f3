package com.purchasingpower.appcommit.model;

/**
 * Categories of external calls for unified logging.
 *
 * @see com.purchasingpower.appcommit.util.ExternalCallLogger
 */
public enum ServiceType {
    GITHUB("🐙", "GitHub"),
    GITHUB_AUTH("🔑", "GitHub App Auth"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
