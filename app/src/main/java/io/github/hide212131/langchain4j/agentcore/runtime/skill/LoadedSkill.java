package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * マニフェストと同梱ファイルをまとめた読み込み済みスキル。キーはスキル直下からの相対パス。
 */
public record LoadedSkill(ParsedSkill skill, Map<String, SkillFile> files) {

    public LoadedSkill {
        Objects.requireNonNull(skill, "skill");
        files = files == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(files));
    }

    public String name() {
        return skill.name();
    }
}
