package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;

/** ツール引数の取り出し。 */
final class ToolArguments {

    private ToolArguments() {
        throw new AssertionError("インスタンス化できません");
    }

    static String requireText(JsonNode args, String name) {
        JsonNode value = args == null ? null : args.get(name);
        if (value == null || value.isNull()) {
            throw ToolException.missingArgument(name);
        }
        if (!value.isTextual()) {
            throw ToolException.invalidArgument(name, "expected a string");
        }
        return value.asText();
    }

    static String optionalText(JsonNode args, String name, String fallback) {
        JsonNode value = args == null ? null : args.get(name);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isTextual()) {
            throw ToolException.invalidArgument(name, "expected a string");
        }
        return value.asText();
    }

    /** ワークスペース相対のパスだけを受け付ける。 */
    static String requireRelativePath(String path) {
        if (path.contains("..") || path.startsWith("/")) {
            throw ToolException.validationFailed("Paths must be relative and cannot contain '..'");
        }
        return path;
    }
}
