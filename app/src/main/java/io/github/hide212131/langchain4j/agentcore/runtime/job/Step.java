package io.github.hide212131.langchain4j.agentcore.runtime.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * ジョブ内の 1 回のツール呼び出し。
 */
public record Step(String id, String toolName, JsonNode toolArgs, StepStatus status, String result,
        boolean requiresApproval, Instant createdAt) {

    public Step {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(toolName, "toolName");
        toolArgs = toolArgs == null ? JsonNodeFactory.instance.objectNode() : toolArgs.deepCopy();
        Objects.requireNonNull(status, "status");
        result = result == null ? "" : result;
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static Step executing(String toolName, JsonNode toolArgs, boolean requiresApproval) {
        return new Step(UUID.randomUUID().toString(), toolName, toolArgs, StepStatus.EXECUTING, "", requiresApproval,
                Instant.now());
    }

    public Step completed(String output) {
        return new Step(id, toolName, toolArgs, StepStatus.COMPLETED, output, requiresApproval, createdAt);
    }

    public Step failed(String output) {
        return new Step(id, toolName, toolArgs, StepStatus.FAILED, output, requiresApproval, createdAt);
    }
}
