package io.github.hide212131.langchain4j.agentcore.runtime.planning;

/**
 * 再試行を使い切っても計画を得られなかった場合の例外。
 */
public final class PlanningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String lastResponse;

    public PlanningException(String message, String lastResponse, Throwable cause) {
        super(message, cause);
        this.lastResponse = lastResponse == null ? "" : lastResponse;
    }

    /** 最後に受け取った応答。応答がなかった場合は空文字。 */
    public String lastResponse() {
        return lastResponse;
    }
}
