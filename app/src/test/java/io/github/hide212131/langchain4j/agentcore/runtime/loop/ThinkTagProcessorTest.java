package io.github.hide212131.langchain4j.agentcore.runtime.loop;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.agentcore.runtime.loop.ThinkTagProcessor.Chunk;
import io.github.hide212131.langchain4j.agentcore.runtime.loop.ThinkTagProcessor.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ThinkTagProcessorTest {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    ThinkTagProcessorTest() {
        // default
    }

    @Test
    @DisplayName("1 チャンク内のタグで本文と思考を分ける")
    void splitsWithinChunk() {
        ThinkTagProcessor processor = new ThinkTagProcessor();

        assertThat(processor.process("before<think>idea</think>after")).containsExactly(
                new Chunk(Kind.TEXT, "before"), new Chunk(Kind.THINKING, "idea"), new Chunk(Kind.TEXT, "after"));
        assertThat(processor.inThinking()).isFalse();
        assertThat(processor.flush()).isEmpty();
    }

    @Test
    @DisplayName("チャンクの境目で分断されたタグも認識する")
    void handlesSplitTags() {
        ThinkTagProcessor processor = new ThinkTagProcessor();

        assertThat(processor.process("Hello <thi")).containsExactly(new Chunk(Kind.TEXT, "Hello "));
        assertThat(processor.process("nk>secret</th")).containsExactly(new Chunk(Kind.THINKING, "secret"));
        assertThat(processor.inThinking()).isTrue();
        assertThat(processor.process("ink> done")).containsExactly(new Chunk(Kind.TEXT, " done"));
        assertThat(processor.inThinking()).isFalse();
    }

    @Test
    @DisplayName("保留していたタグの断片は flush で本文として出す")
    void flushesHeldPrefix() {
        ThinkTagProcessor processor = new ThinkTagProcessor();

        assertThat(processor.process("a <")).containsExactly(new Chunk(Kind.TEXT, "a "));
        assertThat(processor.flush()).containsExactly(new Chunk(Kind.TEXT, "<"));
    }

    @Test
    @DisplayName("閉じられない思考は最後まで思考として扱う")
    void unclosedThinking() {
        ThinkTagProcessor processor = new ThinkTagProcessor();

        assertThat(processor.process("<think>still")).containsExactly(new Chunk(Kind.THINKING, "still"));
        assertThat(processor.process(" going</")).containsExactly(new Chunk(Kind.THINKING, " going"));
        assertThat(processor.flush()).containsExactly(new Chunk(Kind.THINKING, "</"));
    }

    @Test
    @DisplayName("空のトークンは何も出さない")
    void ignoresEmptyTokens() {
        ThinkTagProcessor processor = new ThinkTagProcessor();

        assertThat(processor.process("")).isEmpty();
        assertThat(processor.process(null)).isEmpty();
    }
}
