package io.github.hide212131.langchain4j.agentcore.runtime.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 複雑な問い合わせを分解したタスク列。タスクは並び順に 1 つずつ実行する。
 *
 * <p>
 * 計画 JSON の形式は {@code {"tasks":[{"id":"1","description":"...","dependencies":[]}]}}。
 */
public record ExecutionPlan(String planId, List<PlanTask> tasks) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ExecutionPlan {
        Objects.requireNonNull(planId, "planId");
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static ExecutionPlan of(List<PlanTask> tasks) {
        return new ExecutionPlan(UUID.randomUUID().toString(), tasks);
    }

    /**
     * 計画 JSON を読み込む。ID のないタスクには {@code task-N} を振る。
     *
     * @throws IllegalArgumentException JSON として不正、またはタスクが 1 件もない場合
     */
    public static ExecutionPlan parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(ex.getOriginalMessage(), ex);
        }
        JsonNode taskNodes = root == null ? null : root.get("tasks");
        if (taskNodes == null || !taskNodes.isArray()) {
            throw new IllegalArgumentException("missing field `tasks`");
        }
        List<PlanTask> tasks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 1;
        for (JsonNode node : taskNodes) {
            JsonNode description = node.get("description");
            if (description == null || !description.isTextual() || description.asText().isBlank()) {
                throw new IllegalArgumentException("missing field `description` in task " + index);
            }
            JsonNode idNode = node.get("id");
            String id = idNode == null || idNode.isNull() || idNode.asText().isBlank() ? "task-" + index
                    : idNode.asText();
            // 重複した ID は未使用の連番で置き換える
            int suffix = index;
            while (!seen.add(id)) {
                id = "task-" + suffix;
                suffix++;
            }
            List<String> dependencies = new ArrayList<>();
            JsonNode dependencyNodes = node.get("dependencies");
            if (dependencyNodes != null && dependencyNodes.isArray()) {
                dependencyNodes.forEach(dependency -> dependencies.add(dependency.asText()));
            }
            tasks.add(PlanTask.pending(id, description.asText().trim(), dependencies));
            index++;
        }
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("plan contains no tasks");
        }
        return of(tasks);
    }

    public Optional<PlanTask> task(String taskId) {
        return tasks.stream().filter(task -> task.id().equals(taskId)).findFirst();
    }

    public ExecutionPlan start(String taskId) {
        return replace(require(taskId).withStatus(TaskStatus.RUNNING));
    }

    public ExecutionPlan complete(String taskId, String result) {
        return replace(require(taskId).completed(result));
    }

    public long count(TaskStatus status) {
        return tasks.stream().filter(task -> task.status() == status).count();
    }

    public String formatForLog() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("実行計画 ").append(planId);
        int index = 1;
        for (PlanTask task : tasks) {
            sb.append(System.lineSeparator()).append(index).append(". ").append(task.formatForLog());
            index++;
        }
        return sb.toString();
    }

    private PlanTask require(String taskId) {
        return task(taskId).orElseThrow(() -> new IllegalArgumentException("タスクが見つかりません: " + taskId));
    }

    private ExecutionPlan replace(PlanTask updated) {
        List<PlanTask> replaced = new ArrayList<>(tasks.size());
        for (PlanTask task : tasks) {
            replaced.add(task.id().equals(updated.id()) ? updated : task);
        }
        return new ExecutionPlan(planId, replaced);
    }
}
