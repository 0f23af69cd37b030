package io.github.hide212131.langchain4j.agentcore.runtime;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * agent.yaml を読み込み {@link AgentConfiguration} を組み立てる。未知のキーは警告として返す。
 */
public final class AgentConfigurationLoader {

    private static final Set<String> KNOWN_KEYS = Set.of("id", "name", "provider", "model", "system_prompt",
            "max_turns", "workspace_path", "execution_mode", "autonomous");

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

    public LoadResult load(Path configPath, Path defaultWorkspace) {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(defaultWorkspace, "defaultWorkspace");
        if (!Files.isRegularFile(configPath)) {
            throw new IllegalArgumentException("設定ファイルが見つかりません: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            Object loaded = yaml.load(reader);
            if (loaded == null) {
                return new LoadResult(AgentConfiguration.defaults(defaultWorkspace), List.of());
            }
            if (!(loaded instanceof Map<?, ?> root)) {
                throw new IllegalArgumentException("設定ファイルの形式が不正です: " + configPath);
            }
            return fromMap(root, configPath, defaultWorkspace);
        } catch (IOException ex) {
            throw new IllegalStateException("設定ファイルの読み込みに失敗しました: " + configPath, ex);
        }
    }

    private LoadResult fromMap(Map<?, ?> root, Path configPath, Path defaultWorkspace) {
        List<String> warnings = new ArrayList<>();
        for (Object key : root.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                warnings.add("未対応のキーを無視しました: " + key + " (" + configPath + ")");
            }
        }
        Path workspace = defaultWorkspace;
        String rawWorkspace = string(root, "workspace_path");
        if (rawWorkspace != null) {
            Path candidate = Path.of(rawWorkspace);
            Path base = configPath.toAbsolutePath().getParent();
            workspace = candidate.isAbsolute() || base == null ? candidate : base.resolve(candidate);
        }
        AgentConfiguration configuration = new AgentConfiguration(
                string(root, "id"),
                string(root, "name"),
                string(root, "provider"),
                string(root, "model"),
                string(root, "system_prompt"),
                integer(root, "max_turns", AgentConfiguration.DEFAULT_MAX_TURNS),
                workspace,
                ExecutionMode.parse(string(root, "execution_mode")),
                Boolean.parseBoolean(string(root, "autonomous")));
        return new LoadResult(configuration, List.copyOf(warnings));
    }

    private static String string(Map<?, ?> root, String key) {
        Object value = root.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static int integer(Map<?, ?> root, String key, int defaultValue) {
        Object value = root.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " は整数で指定してください: " + value, ex);
        }
    }

    public record LoadResult(AgentConfiguration configuration, List<String> warnings) {

        public LoadResult {
            Objects.requireNonNull(configuration, "configuration");
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }
}
