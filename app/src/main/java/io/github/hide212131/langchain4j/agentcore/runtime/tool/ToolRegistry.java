package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 名前でツールを引く登録簿。登録順を保持し、プロンプト用の一覧もここで組み立てる。
 */
public final class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public static ToolRegistry of(Tool... tools) {
        ToolRegistry registry = new ToolRegistry();
        for (Tool tool : tools) {
            registry.register(tool);
        }
        return registry;
    }

    public ToolRegistry register(Tool tool) {
        Objects.requireNonNull(tool, "tool");
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalArgumentException("ツール名が重複しています: " + tool.name());
        }
        return this;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<Tool> tools() {
        return List.copyOf(tools.values());
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    /** プリアンブルに埋め込むツール一覧。 */
    public String describe() {
        List<String> lines = new ArrayList<>();
        for (Tool tool : tools.values()) {
            lines.add("- " + tool.name() + ": " + tool.description());
            lines.add("  parameters: " + ToolJson.write(tool.parametersSchema()));
        }
        return String.join("\n", lines);
    }
}
