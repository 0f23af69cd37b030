package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SKILL.md を行単位で読むパーサ。
 *
 * <p>
 * フロントマターは YAML の部分集合として扱う。トップレベルのキー、{@code triggers:} に続く
 * {@code - item} の並び、{@code sandbox_config:} 配下の入れ子キーのみを解釈し、それ以外のキーは無視する。
 */
@SuppressWarnings({ "PMD.CyclomaticComplexity", "PMD.CognitiveComplexity", "PMD.NPathComplexity" })
public final class SkillManifestParser {

    static final int MAX_NAME_LENGTH = 64;
    static final int MAX_DESCRIPTION_LENGTH = 1024;

    private static final String DELIMITER = "---";
    private static final String CLOSING_DELIMITER = "\n---";

    private SkillManifestParser() {
        throw new AssertionError("インスタンス化できません");
    }

    public static ParsedSkill parse(String content) {
        Objects.requireNonNull(content, "content");
        if (!content.startsWith(DELIMITER)) {
            throw new SkillParseException("SKILL.md must start with YAML frontmatter (---)");
        }
        String afterStart = content.substring(DELIMITER.length());
        int end = afterStart.indexOf(CLOSING_DELIMITER);
        if (end < 0) {
            throw new SkillParseException("Could not find end of YAML frontmatter");
        }
        String frontMatter = afterStart.substring(0, end).trim();
        String body = afterStart.substring(end + CLOSING_DELIMITER.length()).trim();

        FrontMatter fields = new FrontMatter();
        for (String line : frontMatter.split("\n", -1)) {
            fields.accept(line.trim());
        }
        fields.finish();
        ParsedSkill skill = new ParsedSkill(fields.name, fields.description, fields.license, fields.category,
                fields.triggers, fields.requiresSandbox, fields.sandboxConfig, fields.executionMode, body);
        validate(skill);
        return skill;
    }

    static void validate(ParsedSkill skill) {
        String name = skill.name();
        if (name.isEmpty()) {
            throw new SkillParseException("SKILL.md must have a 'name' field in frontmatter");
        }
        if (skill.description().isEmpty()) {
            throw new SkillParseException("SKILL.md must have a 'description' field in frontmatter");
        }
        if (name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            throw new SkillParseException("Skill name must be 64 characters or less");
        }
        boolean validName = name.codePoints().allMatch(cp -> Character.isLetterOrDigit(cp) || cp == '-' || cp == '_');
        if (!validName) {
            throw new SkillParseException(
                    "Skill name must only contain alphanumeric characters, hyphens, and underscores");
        }
        String description = skill.description();
        if (description.codePointCount(0, description.length()) > MAX_DESCRIPTION_LENGTH) {
            throw new SkillParseException("Skill description must be 1024 characters or less");
        }
    }

    /** 前後の引用符を 1 組だけ外す。 */
    static String value(String line, String key) {
        String value = line.substring(key.length()).trim();
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static boolean truthy(String value) {
        return "true".equals(value) || "yes".equals(value);
    }

    private static final class FrontMatter {
        private String name = "";
        private String description = "";
        private String license;
        private String category;
        private List<String> triggers;
        private boolean requiresSandbox;
        private SkillSandboxConfig sandboxConfig;
        private String executionMode;

        private boolean inTriggers;
        private List<String> currentTriggers = new ArrayList<>();
        private boolean inSandboxConfig;
        private String image;
        private String memoryLimit;
        private Double cpuLimit;
        private Integer timeoutSeconds;
        private Boolean networkEnabled;

        void accept(String line) {
            if (inTriggers) {
                if (line.startsWith("- ")) {
                    currentTriggers.add(line.substring(2).trim());
                    return;
                }
                if (!line.isEmpty()) {
                    inTriggers = false;
                    triggers = List.copyOf(currentTriggers);
                }
            }
            if (inSandboxConfig) {
                if (acceptSandboxKey(line)) {
                    return;
                }
                if (!line.isEmpty()) {
                    inSandboxConfig = false;
                    closeSandboxConfig();
                }
            }
            acceptTopLevel(line);
        }

        private void acceptTopLevel(String line) {
            if (line.startsWith("name:")) {
                name = value(line, "name:");
            } else if (line.startsWith("description:")) {
                description = value(line, "description:");
            } else if (line.startsWith("license:")) {
                license = value(line, "license:");
            } else if (line.startsWith("category:")) {
                category = value(line, "category:");
            } else if (line.startsWith("triggers:")) {
                inTriggers = true;
                currentTriggers = new ArrayList<>();
            } else if (line.startsWith("requires_sandbox:")) {
                String flag = value(line, "requires_sandbox:");
                requiresSandbox = truthy(flag) || "1".equals(flag);
            } else if (line.startsWith("sandbox_config:")) {
                inSandboxConfig = true;
            } else if (line.startsWith("execution_mode:")) {
                executionMode = value(line, "execution_mode:");
            }
        }

        private boolean acceptSandboxKey(String line) {
            if (line.startsWith("image:")) {
                image = value(line, "image:");
            } else if (line.startsWith("memory_limit:")) {
                memoryLimit = value(line, "memory_limit:");
            } else if (line.startsWith("cpu_limit:")) {
                cpuLimit = parseDouble(value(line, "cpu_limit:"));
            } else if (line.startsWith("timeout_seconds:")) {
                timeoutSeconds = parseInt(value(line, "timeout_seconds:"));
            } else if (line.startsWith("network_enabled:")) {
                networkEnabled = truthy(value(line, "network_enabled:"));
            } else {
                return false;
            }
            return true;
        }

        void finish() {
            if (inTriggers && !currentTriggers.isEmpty()) {
                triggers = List.copyOf(currentTriggers);
            }
            if (inSandboxConfig) {
                closeSandboxConfig();
            }
        }

        // image / memory_limit / timeout_seconds のいずれもなければブロックごと無視する
        private void closeSandboxConfig() {
            if (image != null || memoryLimit != null || timeoutSeconds != null) {
                sandboxConfig = new SkillSandboxConfig(image, memoryLimit, cpuLimit, timeoutSeconds, networkEnabled);
            }
            image = null;
            memoryLimit = null;
            cpuLimit = null;
            timeoutSeconds = null;
            networkEnabled = null;
        }

        private static Double parseDouble(String value) {
            try {
                return Double.valueOf(value);
            } catch (NumberFormatException ex) {
                return null;
            }
        }

        private static Integer parseInt(String value) {
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
    }
}
