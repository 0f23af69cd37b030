package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import java.util.List;

/**
 * プロバイダへ渡す 1 回分の入力。
 *
 * @param preamble システムプロンプト。null 可
 * @param history  これまでの会話
 * @param prompt   今回のユーザー入力
 */
public record CompletionRequest(String preamble, List<ChatTurn> history, String prompt) {

    public CompletionRequest {
        preamble = preamble == null ? "" : preamble;
        history = history == null ? List.of() : List.copyOf(history);
        prompt = prompt == null ? "" : prompt;
    }

    public static CompletionRequest of(String preamble, String prompt) {
        return new CompletionRequest(preamble, List.of(), prompt);
    }
}
