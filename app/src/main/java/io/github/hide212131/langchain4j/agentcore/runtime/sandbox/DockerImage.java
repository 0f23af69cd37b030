package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.util.Locale;

/**
 * よく使うイメージの別名。該当しない名前はそのまま使う。
 */
public enum DockerImage {
    PYTHON_311("python:3.11-slim", "python:3.11", "python:3.11-slim", "python311", "python"),
    NODE_20("node:20-slim", "node:20", "node:20-slim", "node20", "node"),
    SKILL_RUNNER("anycowork/skill-runner:latest", "anycowork", "anycowork/skill-runner", "skill-runner");

    private final String imageName;
    private final String[] aliases;

    DockerImage(String imageName, String... aliases) {
        this.imageName = imageName;
        this.aliases = aliases.clone();
    }

    public String imageName() {
        return imageName;
    }

    public static String resolve(String name) {
        if (name == null || name.isBlank()) {
            return PYTHON_311.imageName;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DockerImage image : values()) {
            for (String alias : image.aliases) {
                if (alias.equals(normalized)) {
                    return image.imageName;
                }
            }
        }
        return name.trim();
    }
}
