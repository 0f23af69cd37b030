package io.github.hide212131.langchain4j.agentcore.runtime.job;

import java.util.Locale;

/** ツール呼び出し 1 回分の状態。 */
public enum StepStatus {
    EXECUTING, COMPLETED, FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
