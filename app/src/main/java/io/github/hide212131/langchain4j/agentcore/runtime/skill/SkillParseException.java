package io.github.hide212131.langchain4j.agentcore.runtime.skill;

/**
 * SKILL.md の構文・検証エラー。
 */
public final class SkillParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SkillParseException(String message) {
        super(message);
    }
}
