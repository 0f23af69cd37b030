package io.github.hide212131.langchain4j.agentcore.runtime.loop;

/**
 * 長すぎるテキストの中ほどを省略する。先頭 6 割と末尾 4 割を残す。
 */
public final class HistoryTruncator {

    static final double HEAD_RATIO = 0.6;

    private HistoryTruncator() {
        throw new AssertionError("インスタンス化できません");
    }

    public static String smartTruncate(String text, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars は正の値を指定してください: " + maxChars);
        }
        if (text == null || text.length() <= maxChars) {
            return text == null ? "" : text;
        }
        int head = (int) (maxChars * HEAD_RATIO);
        int tail = maxChars - head;
        int omitted = text.length() - head - tail;
        return text.substring(0, head) + marker(omitted) + text.substring(text.length() - tail);
    }

    static String marker(int omitted) {
        return "\n\n... [truncated " + omitted + " characters] ...\n\n";
    }

    /** 文字数 / 4 で見積もったトークン数。 */
    public static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }
}
