package io.github.hide212131.langchain4j.agentcore.runtime.job;

import java.util.Locale;

/** ジョブの状態。 */
public enum JobStatus {
    RUNNING, COMPLETED, FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this != RUNNING;
    }
}
