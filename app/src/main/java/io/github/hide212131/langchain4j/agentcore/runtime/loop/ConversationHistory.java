package io.github.hide212131.langchain4j.agentcore.runtime.loop;

import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 件数とトークン見積もりの上限内に収まるよう、古いものから捨てていく会話履歴。
 * 直近の 1 件は上限を超えていても残す。
 */
public final class ConversationHistory {

    private final Deque<ChatTurn> turns = new ArrayDeque<>();
    private final int maxMessages;
    private final int maxTokens;
    private int tokens;
    private int evicted;

    public ConversationHistory(int maxMessages, int maxTokens) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages は正の値を指定してください: " + maxMessages);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens は正の値を指定してください: " + maxTokens);
        }
        this.maxMessages = maxMessages;
        this.maxTokens = maxTokens;
    }

    public void addAll(List<ChatTurn> initial) {
        initial.forEach(this::add);
    }

    public void add(ChatTurn turn) {
        Objects.requireNonNull(turn, "turn");
        turns.addLast(turn);
        tokens += HistoryTruncator.estimateTokens(turn.content());
        while (turns.size() > 1 && (turns.size() > maxMessages || tokens > maxTokens)) {
            ChatTurn removed = turns.removeFirst();
            tokens -= HistoryTruncator.estimateTokens(removed.content());
            evicted++;
        }
    }

    public List<ChatTurn> turns() {
        return List.copyOf(turns);
    }

    public int size() {
        return turns.size();
    }

    public int estimatedTokens() {
        return tokens;
    }

    /** これまでに捨てた件数。 */
    public int evicted() {
        return evicted;
    }
}
