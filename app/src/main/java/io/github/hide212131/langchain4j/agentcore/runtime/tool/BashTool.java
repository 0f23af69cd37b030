package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionType;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.ScopeEnforcer;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxBackend;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxConfig;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxResult;
import java.util.Objects;

/**
 * サンドボックス経由でシェルコマンドを実行する。
 */
public final class BashTool implements Tool {

    public static final String NAME = "bash";
    static final long TIMEOUT_SECONDS = 300;

    private static final VisibilityLog LOG = VisibilityLog.forClass(BashTool.class);

    private final SandboxBackend sandbox;
    private final ScopeEnforcer.Scope scope;
    private final SandboxConfig config;

    public BashTool(SandboxBackend sandbox) {
        this(sandbox, ScopeEnforcer.Scope.GLOBAL);
    }

    /**
     * @param scope WORKSPACE の場合、ワークスペース外へ出そうなコマンドを承認前に拒否する
     */
    public BashTool(SandboxBackend sandbox, ScopeEnforcer.Scope scope) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.config = SandboxConfig.builder().networkEnabled(true).timeoutSeconds(TIMEOUT_SECONDS).build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Execute a shell command in the workspace and return stdout, stderr and exit_code.";
    }

    @Override
    public JsonNode parametersSchema() {
        ObjectNode schema = ToolJson.objectSchema();
        ToolJson.property(schema, "command", "string", "The shell command to execute", true);
        return schema;
    }

    @Override
    public String execute(JsonNode args, ToolContext context) {
        String command = ToolArguments.requireText(args, "command");
        if (scope == ScopeEnforcer.Scope.WORKSPACE) {
            try {
                ScopeEnforcer.workspace(context.workspace()).validateCommand(command);
            } catch (IllegalArgumentException ex) {
                throw ToolException.validationFailed(ex.getMessage());
            }
        }
        context.requirePermission(PermissionRequest
                .create(PermissionType.SHELL_EXECUTE, "Agent wants to run command: " + command).withResource(command));

        SandboxResult result = sandbox.execute(command, context.workspace(), config);
        LOG.info(context.sessionId(), context.jobId(), "tool", NAME, "コマンドを実行しました", command,
                "backend=" + sandbox.name() + " exit=" + result.exitCode());

        ObjectNode output = ToolJson.MAPPER.createObjectNode();
        output.put("stdout", result.stdout());
        output.put("stderr", result.stderr());
        output.put("exit_code", result.exitCode());
        return ToolJson.write(output);
    }
}
