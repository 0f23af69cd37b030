package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ツール 1 回分の実行文脈。
 */
public record ToolContext(String sessionId, String jobId, Path workspace, PermissionBroker broker) {

    public ToolContext {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(broker, "broker");
        workspace = workspace.toAbsolutePath().normalize();
    }

    /**
     * セッション ID を添えて承認を求め、拒否された場合は {@link ToolException} を送出する。
     */
    public void requirePermission(PermissionRequest request) {
        Objects.requireNonNull(request, "request");
        boolean allowed;
        try {
            allowed = broker.check(request.withSessionId(sessionId));
        } catch (IllegalStateException ex) {
            throw ToolException.other(ex.getMessage(), ex);
        }
        if (!allowed) {
            throw ToolException.permissionDenied("User denied permission");
        }
    }
}
