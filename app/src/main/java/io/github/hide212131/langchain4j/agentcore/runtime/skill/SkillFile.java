package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.Objects;

/** スキルに同梱されたテキストファイル。 */
public record SkillFile(String content, SkillFileType type) {

    public SkillFile {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(type, "type");
    }
}
