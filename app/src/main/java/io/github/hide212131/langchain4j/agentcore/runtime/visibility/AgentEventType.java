package io.github.hide212131.langchain4j.agentcore.runtime.visibility;

import java.util.Locale;

/** 観測者へ通知するイベントの種別。 */
public enum AgentEventType {
    TOKEN,
    JOB_STARTED,
    JOB_COMPLETED,
    STEP_STARTED,
    STEP_COMPLETED,
    APPROVAL_REQUIRED,
    STEP_APPROVED,
    STEP_REJECTED,
    THINKING,
    ERROR,
    PLAN_UPDATE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
