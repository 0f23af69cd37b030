package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * モデルの応答から取り出したツール呼び出し。
 */
public record ToolCall(String toolName, JsonNode args) {

    public ToolCall {
        Objects.requireNonNull(toolName, "toolName");
        args = args == null || args.isNull() ? ToolJson.MAPPER.createObjectNode() : args.deepCopy();
    }

    public String argsJson() {
        return ToolJson.write(args);
    }
}
