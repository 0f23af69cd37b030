package io.github.hide212131.langchain4j.agentcore.app.cli;

import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.ExecutionPlan;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEvent;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 進捗イベントをコンソールへ書き出す観測者。承認待ちは登録されたハンドラへ渡す。
 */
final class ConsoleEventPrinter implements AgentObserver {

    private final PrintWriter out;
    private final PrintWriter err;
    private Consumer<PermissionRequest> approvalHandler = request -> {
        // 承認ハンドラ未登録
    };

    ConsoleEventPrinter(PrintWriter out, PrintWriter err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    void onApprovalRequired(Consumer<PermissionRequest> handler) {
        this.approvalHandler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void emit(String channel, AgentEvent event) {
        switch (event.type()) {
            case TOKEN -> out.println(event.message());
            case THINKING -> out.println("[thinking] " + event.message());
            case JOB_STARTED -> out.println("[job] started: " + event.message());
            case JOB_COMPLETED -> out.println("[job] " + event.message());
            case STEP_STARTED -> out.println("[step] running " + event.message());
            case STEP_COMPLETED -> out.println("[step] finished " + event.message());
            case STEP_APPROVED -> out.println("[approval] allowed: " + event.message());
            case STEP_REJECTED -> out.println("[approval] denied: " + event.message());
            case PLAN_UPDATE -> event.payloadAs(ExecutionPlan.class)
                    .ifPresent(plan -> out.println(plan.formatForLog()));
            case ERROR -> err.println("[error] " + event.message()
                    + event.payloadAs(String.class).map(detail -> ": " + detail).orElse(""));
            case APPROVAL_REQUIRED -> {
                out.println("[approval] " + event.message());
                event.payloadAs(PermissionRequest.class).ifPresent(approvalHandler);
            }
        }
        out.flush();
    }
}
