package io.github.hide212131.langchain4j.agentcore.runtime.planning;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionException;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionRequest;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 目的をタスク列に分解する。
 *
 * <p>
 * 応答をストリームで受け取り、JSON 部分を切り出して {@link ExecutionPlan} に変換する。失敗した場合は
 * 1 秒・2 秒と倍々に待って最大 {@link #MAX_ATTEMPTS} 回まで試す。
 */
public final class Planner {

    public static final int MAX_ATTEMPTS = 3;
    static final long BASE_BACKOFF_MILLIS = 1000;
    static final int RESPONSE_EXCERPT_LENGTH = 200;

    static final String PLAN_SCHEMA = """
            {
              "type": "object",
              "required": ["tasks"],
              "properties": {
                "tasks": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "required": ["id", "description"],
                    "properties": {
                      "id": {"type": "string"},
                      "description": {"type": "string"},
                      "dependencies": {"type": "array", "items": {"type": "string"}}
                    }
                  }
                }
              }
            }""";

    private static final VisibilityLog LOG = VisibilityLog.forClass(Planner.class);

    /** 再試行前の待機。テストでは差し替える。 */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;

        static Sleeper threadSleep() {
            return Thread::sleep;
        }
    }

    private final CompletionProvider provider;
    private final Sleeper sleeper;

    public Planner(CompletionProvider provider) {
        this(provider, Sleeper.threadSleep());
    }

    public Planner(CompletionProvider provider, Sleeper sleeper) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    static String preamble(String context) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("You are a planning agent. Break the user's objective into a short, ordered list of concrete tasks")
                .append(" that an autonomous agent with tools can execute one by one.\n")
                .append("Each task description must be a self-contained instruction.\n\n")
                .append("Respond with ONLY a JSON object of the form {\"tasks\": [...]} matching this schema:\n")
                .append(PLAN_SCHEMA).append('\n');
        if (context != null && !context.isBlank()) {
            sb.append("\nConversation so far:\n").append(context).append('\n');
        }
        return sb.toString();
    }

    /**
     * @param context 直前までの会話の要約。なければ空文字
     * @param onToken 応答トークンと再試行の通知を受け取る
     * @throws PlanningException すべての試行が失敗した場合
     */
    public ExecutionPlan plan(String objective, String context, Consumer<String> onToken) {
        Objects.requireNonNull(objective, "objective");
        Consumer<String> sink = onToken == null ? token -> {
        } : onToken;
        CompletionRequest request = CompletionRequest.of(preamble(context), objective);

        for (int attempt = 1;; attempt++) {
            String response;
            try {
                response = provider.stream(request, sink);
            } catch (CompletionException ex) {
                LOG.warn("-", "-", "planning", "attempt-" + attempt, "計画の生成に失敗しました", objective, ex);
                if (attempt >= MAX_ATTEMPTS) {
                    throw new PlanningException(
                            "Planning failed after " + MAX_ATTEMPTS + " attempts: " + ex.getMessage(), "", ex);
                }
                backoff(attempt, sink);
                continue;
            }

            if (response == null || response.isEmpty()) {
                LOG.warn("-", "-", "planning", "attempt-" + attempt, "空の応答を受け取りました", objective, null);
                if (attempt >= MAX_ATTEMPTS) {
                    throw new PlanningException("Planning failed after " + MAX_ATTEMPTS + " attempts: Empty response",
                            "", null);
                }
                backoff(attempt, sink);
                continue;
            }

            try {
                ExecutionPlan plan = ExecutionPlan.parse(JsonFrames.extract(response));
                LOG.info("-", "-", "planning", "attempt-" + attempt, "計画を生成しました", objective, plan.formatForLog());
                return plan;
            } catch (IllegalArgumentException ex) {
                LOG.warn("-", "-", "planning", "attempt-" + attempt,
                        "計画 JSON の解析に失敗しました (" + attempt + "/" + MAX_ATTEMPTS + ")", response, ex);
                if (attempt >= MAX_ATTEMPTS) {
                    throw new PlanningException("Failed to parse generated plan: " + ex.getMessage()
                            + ". Response start: '" + excerpt(response) + "'", response, ex);
                }
            }
            backoff(attempt, sink);
        }
    }

    static String excerpt(String response) {
        if (response.length() > RESPONSE_EXCERPT_LENGTH) {
            return response.substring(0, RESPONSE_EXCERPT_LENGTH) + "...";
        }
        return response;
    }

    static long backoffMillis(int attempt) {
        return BASE_BACKOFF_MILLIS * (1L << (attempt - 1));
    }

    private void backoff(int attempt, Consumer<String> sink) {
        long waitMillis = backoffMillis(attempt);
        sink.accept("\n⚠️ Attempt " + attempt + " failed. Retrying in " + waitMillis / 1000 + "s...\n");
        try {
            sleeper.sleep(waitMillis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PlanningException("Planning interrupted", "", ex);
        }
    }
}
