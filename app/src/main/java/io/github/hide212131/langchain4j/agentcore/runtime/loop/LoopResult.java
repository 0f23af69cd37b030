package io.github.hide212131.langchain4j.agentcore.runtime.loop;

import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import java.util.Objects;

/**
 * ループ 1 回分の結果。
 *
 * @param message 最終応答、または終了理由
 * @param job     ステップを追記したジョブ
 */
public record LoopResult(LoopOutcome outcome, String message, Job job, int steps) {

    public LoopResult {
        Objects.requireNonNull(outcome, "outcome");
        message = message == null ? "" : message;
        Objects.requireNonNull(job, "job");
    }

    public boolean failed() {
        return outcome == LoopOutcome.FAILED;
    }
}
