package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import java.util.Objects;

/** 会話履歴の 1 ターン。 */
public record ChatTurn(ChatRole role, String content) {

    public ChatTurn {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(ChatRole.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ChatRole.ASSISTANT, content);
    }

    public static ChatTurn tool(String content) {
        return new ChatTurn(ChatRole.TOOL, content);
    }

    public ChatTurn withContent(String newContent) {
        return new ChatTurn(role, newContent);
    }
}
