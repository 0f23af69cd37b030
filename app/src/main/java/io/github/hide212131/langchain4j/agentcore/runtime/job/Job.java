package io.github.hide212131.langchain4j.agentcore.runtime.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * ユーザーのメッセージ 1 件に対する実行単位。ステップは追記のみで、作成順に並ぶ。
 */
public record Job(String id, String sessionId, JobStatus status, String query, List<Step> steps, Instant createdAt) {

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(status, "status");
        query = query == null ? "" : query;
        steps = steps == null ? List.of() : List.copyOf(steps);
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Job start(String sessionId, String query) {
        return new Job(UUID.randomUUID().toString(), sessionId, JobStatus.RUNNING, query, List.of(), Instant.now());
    }

    public Job withStatus(JobStatus newStatus) {
        Objects.requireNonNull(newStatus, "newStatus");
        return new Job(id, sessionId, newStatus, query, steps, createdAt);
    }

    public Job appendStep(Step step) {
        Objects.requireNonNull(step, "step");
        for (Step existing : steps) {
            if (existing.id().equals(step.id())) {
                throw new IllegalArgumentException("ステップ ID が重複しています: " + step.id());
            }
        }
        List<Step> updated = new ArrayList<>(steps);
        updated.add(step);
        return new Job(id, sessionId, status, query, updated, createdAt);
    }

    /** 既存ステップの状態を差し替える。並び順は変えない。 */
    public Job updateStep(Step step) {
        Objects.requireNonNull(step, "step");
        List<Step> updated = new ArrayList<>(steps.size());
        boolean replaced = false;
        for (Step existing : steps) {
            if (existing.id().equals(step.id())) {
                updated.add(step);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            throw new IllegalArgumentException("ステップが見つかりません: " + step.id());
        }
        return new Job(id, sessionId, status, query, updated, createdAt);
    }

    /** 直近のステップの位置。ステップがなければ -1。 */
    public int currentStepIndex() {
        return steps.size() - 1;
    }
}
