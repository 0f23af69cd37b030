package io.github.hide212131.langchain4j.agentcore.runtime.planning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.agentcore.runtime.provider.ScriptedCompletionProvider;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlannerTest {

    private static final String PLAN = """
            Here is the plan:
            {"tasks": [
              {"id": "1", "description": "Read the README", "dependencies": []},
              {"id": "2", "description": "Summarize it", "dependencies": ["1"]}
            ]}
            """;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    PlannerTest() {
        // default
    }

    private final List<Long> sleeps = new ArrayList<>();
    private final List<String> tokens = new ArrayList<>();

    private Planner planner(ScriptedCompletionProvider provider) {
        return new Planner(provider, sleeps::add);
    }

    @Test
    @DisplayName("応答から JSON を切り出してタスク列にする")
    void parsesPlan() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply(PLAN);

        ExecutionPlan plan = planner(provider).plan("Summarize the README", "", tokens::add);

        assertThat(plan.tasks()).extracting(PlanTask::id).containsExactly("1", "2");
        assertThat(plan.tasks()).allSatisfy(task -> assertThat(task.status()).isEqualTo(TaskStatus.PENDING));
        assertThat(plan.tasks().get(1).dependencies()).containsExactly("1");
        assertThat(tokens).containsExactly(PLAN);
        assertThat(sleeps).isEmpty();
        assertThat(provider.lastRequest().prompt()).isEqualTo("Summarize the README");
        assertThat(provider.lastRequest().preamble()).contains("\"tasks\"").doesNotContain("Conversation so far");
    }

    @Test
    @DisplayName("会話の文脈を前置きに含める")
    void includesContext() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply(PLAN);

        planner(provider).plan("Do it", "user: earlier question", null);

        assertThat(provider.lastRequest().preamble()).contains("Conversation so far:\nuser: earlier question");
    }

    @Test
    @DisplayName("解析に失敗したら 1 秒・2 秒と待って再試行する")
    void retriesWithBackoff() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("not json", "{\"tasks\": 1}",
                PLAN);

        ExecutionPlan plan = planner(provider).plan("Summarize", "", tokens::add);

        assertThat(plan.tasks()).hasSize(2);
        assertThat(sleeps).containsExactly(1000L, 2000L);
        assertThat(tokens).contains("\n⚠️ Attempt 1 failed. Retrying in 1s...\n",
                "\n⚠️ Attempt 2 failed. Retrying in 2s...\n");
    }

    @Test
    @DisplayName("3 回とも不正なら最後の応答の先頭 200 文字を添えて失敗する")
    void failsAfterThreeMalformedResponses() {
        String third = "x".repeat(250);
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("bad 1", "bad 2", third);

        assertThatThrownBy(() -> planner(provider).plan("Summarize", "", null))
                .isInstanceOfSatisfying(PlanningException.class,
                        ex -> assertThat(ex.lastResponse()).isEqualTo(third))
                .hasMessageStartingWith("Failed to parse generated plan: ")
                .hasMessageEndingWith(". Response start: '" + "x".repeat(200) + "...'");
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    @DisplayName("LLM の失敗が続けば試行回数を添えて失敗する")
    void failsAfterProviderErrors() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().fail("timeout").fail("timeout")
                .fail("rate limited");

        assertThatThrownBy(() -> planner(provider).plan("Summarize", "", null))
                .isInstanceOf(PlanningException.class)
                .hasMessage("Planning failed after 3 attempts: rate limited");
    }

    @Test
    @DisplayName("空の応答が続けば Empty response として失敗する")
    void failsAfterEmptyResponses() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("", "", "");

        assertThatThrownBy(() -> planner(provider).plan("Summarize", "", null))
                .isInstanceOf(PlanningException.class)
                .hasMessage("Planning failed after 3 attempts: Empty response");
    }

    @Test
    @DisplayName("一時的な失敗の後に成功すれば計画を返す")
    void recoversAfterTransientFailure() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().fail("timeout").reply(PLAN);

        assertThat(planner(provider).plan("Summarize", "", null).tasks()).hasSize(2);
        assertThat(sleeps).containsExactly(1000L);
    }

    @Test
    @DisplayName("待機中の割り込みは中断として失敗する")
    void interrupted() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("bad");
        Planner planner = new Planner(provider, millis -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThatThrownBy(() -> planner.plan("Summarize", "", null))
                    .isInstanceOf(PlanningException.class)
                    .hasMessage("Planning interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("待機時間は試行ごとに倍になる")
    void backoffMillis() {
        assertThat(Planner.backoffMillis(1)).isEqualTo(1000);
        assertThat(Planner.backoffMillis(2)).isEqualTo(2000);
        assertThat(Planner.backoffMillis(3)).isEqualTo(4000);
    }
}
