package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.List;
import java.util.Locale;

/**
 * スキルに同梱できるファイルの種別。拡張子で判定する。
 */
public enum SkillFileType {
    PYTHON(".py"), JAVASCRIPT(".js"), TYPESCRIPT(".ts"), SHELL(".sh", ".bash", ".zsh"), MARKDOWN(".md"),
    JSON(".json"), YAML(".yaml", ".yml"), TOML(".toml"), HTML(".html"), CSS(".css"), XML(".xml", ".xsd"),
    SQL(".sql"), JINJA(".j2", ".jinja", ".jinja2"), TEXT(".txt", ".rst"), UNKNOWN;

    private final List<String> extensions;

    SkillFileType(String... extensions) {
        this.extensions = List.of(extensions);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SkillFileType detect(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (SkillFileType type : values()) {
            for (String extension : type.extensions) {
                if (lower.endsWith(extension)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }

    /** 取り込み対象の拡張子かどうか。 */
    public static boolean isAllowed(String fileName) {
        return detect(fileName) != UNKNOWN;
    }
}
