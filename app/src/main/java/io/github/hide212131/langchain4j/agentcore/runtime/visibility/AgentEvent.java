package io.github.hide212131.langchain4j.agentcore.runtime.visibility;

import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Step;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.ExecutionPlan;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 実行中に発生する通知。payload は種別ごとに {@link Job}・{@link StepPayload}・{@link ExecutionPlan}・
 * {@link PermissionRequest} のいずれか、またはなし。
 */
public record AgentEvent(AgentEventType type, String message, Object payload, Instant timestamp) {

    public AgentEvent {
        Objects.requireNonNull(type, "type");
        message = message == null ? "" : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentEvent token(String content) {
        return new AgentEvent(AgentEventType.TOKEN, content, null, null);
    }

    public static AgentEvent thinking(String message) {
        return new AgentEvent(AgentEventType.THINKING, message, null, null);
    }

    public static AgentEvent error(String message, String error) {
        return new AgentEvent(AgentEventType.ERROR, message, error, null);
    }

    public static AgentEvent jobStarted(Job job) {
        return new AgentEvent(AgentEventType.JOB_STARTED, job.query(), job, null);
    }

    public static AgentEvent jobCompleted(Job job, String message) {
        return new AgentEvent(AgentEventType.JOB_COMPLETED, message, job, null);
    }

    public static AgentEvent stepStarted(Job job, Step step) {
        return new AgentEvent(AgentEventType.STEP_STARTED, step.toolName(), new StepPayload(job.id(), step), null);
    }

    public static AgentEvent stepCompleted(Job job, Step step) {
        return new AgentEvent(AgentEventType.STEP_COMPLETED, step.toolName(), new StepPayload(job.id(), step), null);
    }

    public static AgentEvent approvalRequired(PermissionRequest request) {
        return new AgentEvent(AgentEventType.APPROVAL_REQUIRED, request.message(), request, null);
    }

    public static AgentEvent stepApproved(PermissionRequest request) {
        return new AgentEvent(AgentEventType.STEP_APPROVED, request.message(), request, null);
    }

    public static AgentEvent stepRejected(PermissionRequest request) {
        return new AgentEvent(AgentEventType.STEP_REJECTED, request.message(), request, null);
    }

    public static AgentEvent planUpdate(ExecutionPlan plan) {
        return new AgentEvent(AgentEventType.PLAN_UPDATE, plan.planId(), plan, null);
    }

    public <T> Optional<T> payloadAs(Class<T> type) {
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    /** ステップ系イベントの中身。 */
    public record StepPayload(String jobId, Step step) {
        public StepPayload {
            Objects.requireNonNull(jobId, "jobId");
            Objects.requireNonNull(step, "step");
        }
    }
}
