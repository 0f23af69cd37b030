package io.github.hide212131.langchain4j.agentcore.runtime.planning;

import java.util.List;
import java.util.Objects;

/**
 * 計画の 1 タスク。
 *
 * @param dependencies 先に終わっている必要があるタスクの ID。実行は常に計画の並び順で行う
 * @param result       タスク完了時の最終応答。未完了なら空文字
 */
public record PlanTask(String id, String description, List<String> dependencies, TaskStatus status, String result) {

    public PlanTask {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        status = status == null ? TaskStatus.PENDING : status;
        result = result == null ? "" : result;
    }

    public static PlanTask pending(String id, String description, List<String> dependencies) {
        return new PlanTask(id, description, dependencies, TaskStatus.PENDING, "");
    }

    public PlanTask withStatus(TaskStatus newStatus) {
        Objects.requireNonNull(newStatus, "newStatus");
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException("タスクの状態を戻すことはできません: " + id + " " + status.value() + " -> "
                    + newStatus.value());
        }
        return new PlanTask(id, description, dependencies, newStatus, result);
    }

    public PlanTask completed(String finalResult) {
        return withStatus(TaskStatus.COMPLETED).withResult(finalResult);
    }

    private PlanTask withResult(String newResult) {
        return new PlanTask(id, description, dependencies, status, newResult);
    }

    public String formatForLog() {
        StringBuilder sb = new StringBuilder(96);
        sb.append('[').append(status.label()).append("] ").append(id).append(": ").append(description);
        if (!dependencies.isEmpty()) {
            sb.append(" (依存: ").append(String.join(", ", dependencies)).append(')');
        }
        return sb.toString();
    }
}
