package io.github.hide212131.langchain4j.agentcore.runtime.loop;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ストリームで届くテキストを {@code <think>...</think>} の内側と外側に振り分ける。
 *
 * <p>
 * タグがチャンクの境目で分断されても正しく扱えるよう、タグの先頭らしき末尾は次のチャンクまで保留する。
 * 1 回の応答ごとに新しいインスタンスを使う。
 */
public final class ThinkTagProcessor {

    static final String OPEN_TAG = "<think>";
    static final String CLOSE_TAG = "</think>";

    /** 振り分け結果。 */
    public enum Kind {
        TEXT, THINKING
    }

    public record Chunk(Kind kind, String text) {
        public Chunk {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
        }
    }

    private final StringBuilder buffer = new StringBuilder();
    private boolean inThinking;

    public List<Chunk> process(String token) {
        List<Chunk> chunks = new ArrayList<>();
        if (token == null || token.isEmpty()) {
            return chunks;
        }
        buffer.append(token);
        while (true) {
            if (inThinking) {
                int end = buffer.indexOf(CLOSE_TAG);
                if (end < 0) {
                    int held = partialTagLength(CLOSE_TAG);
                    emit(chunks, Kind.THINKING, buffer.length() - held);
                    break;
                }
                emit(chunks, Kind.THINKING, end);
                buffer.delete(0, CLOSE_TAG.length());
                inThinking = false;
            } else {
                int start = buffer.indexOf(OPEN_TAG);
                if (start < 0) {
                    int held = partialTagLength(OPEN_TAG);
                    emit(chunks, Kind.TEXT, buffer.length() - held);
                    break;
                }
                emit(chunks, Kind.TEXT, start);
                buffer.delete(0, OPEN_TAG.length());
                inThinking = true;
            }
        }
        return chunks;
    }

    /** 保留していた残りを吐き出す。応答の終わりで呼ぶ。 */
    public List<Chunk> flush() {
        List<Chunk> chunks = new ArrayList<>();
        emit(chunks, inThinking ? Kind.THINKING : Kind.TEXT, buffer.length());
        return chunks;
    }

    public boolean inThinking() {
        return inThinking;
    }

    private void emit(List<Chunk> chunks, Kind kind, int length) {
        if (length <= 0) {
            return;
        }
        chunks.add(new Chunk(kind, buffer.substring(0, length)));
        buffer.delete(0, length);
    }

    // バッファ末尾がタグの先頭部分と一致する長さ
    private int partialTagLength(String tag) {
        int max = Math.min(tag.length() - 1, buffer.length());
        for (int length = max; length > 0; length--) {
            if (buffer.substring(buffer.length() - length).equals(tag.substring(0, length))) {
                return length;
            }
        }
        return 0;
    }
}
