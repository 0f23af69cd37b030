package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 応答テキストから {@code {"tool": ..., "args": {...}}} 形式の JSON オブジェクトを拾い出す。
 *
 * <p>
 * 文字列リテラルとエスケープを考慮して波括弧の対応を数えるため、前後に説明文や
 * Markdown のコードフェンスがあっても取り出せる。
 */
public final class ToolCallExtractor {

    private static final String TOOL_FIELD = "tool";
    private static final String ARGS_FIELD = "args";

    private ToolCallExtractor() {
        throw new AssertionError("インスタンス化できません");
    }

    public static Optional<ToolCall> extractFirst(String text) {
        List<ToolCall> calls = extractAll(text);
        return calls.isEmpty() ? Optional.empty() : Optional.of(calls.get(0));
    }

    public static List<ToolCall> extractAll(String text) {
        List<ToolCall> calls = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return calls;
        }
        int index = text.indexOf('{');
        while (index >= 0) {
            int end = matchingBrace(text, index);
            if (end < 0) {
                index = text.indexOf('{', index + 1);
                continue;
            }
            Optional<JsonNode> parsed = parse(text.substring(index, end + 1));
            if (parsed.isEmpty()) {
                index = text.indexOf('{', index + 1);
                continue;
            }
            toToolCall(parsed.get()).ifPresent(calls::add);
            index = text.indexOf('{', end + 1);
        }
        return calls;
    }

    private static Optional<ToolCall> toToolCall(JsonNode node) {
        JsonNode tool = node.get(TOOL_FIELD);
        if (!node.isObject() || tool == null || !tool.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new ToolCall(tool.asText(), node.get(ARGS_FIELD)));
    }

    private static Optional<JsonNode> parse(String candidate) {
        try {
            return Optional.of(ToolJson.MAPPER.readTree(candidate));
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    /** start の '{' に対応する '}' の位置。閉じていなければ -1。 */
    static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
