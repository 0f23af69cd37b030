package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SKILL.md のフロントマターと本文。
 *
 * @param executionMode スキル側の希望実行モード。sandbox / direct / flexible、未指定なら null
 */
public record ParsedSkill(String name, String description, String license, String category, List<String> triggers,
        boolean requiresSandbox, SkillSandboxConfig sandboxConfig, String executionMode, String body) {

    public ParsedSkill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        body = body == null ? "" : body;
    }

    public Optional<String> licenseValue() {
        return Optional.ofNullable(license);
    }

    public Optional<String> categoryValue() {
        return Optional.ofNullable(category);
    }

    public Optional<SkillSandboxConfig> sandboxConfigValue() {
        return Optional.ofNullable(sandboxConfig);
    }

    public Optional<String> executionModeValue() {
        return Optional.ofNullable(executionMode);
    }
}
