package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionType;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.RecordingBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.ScopeEnforcer;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.RecordingSandbox;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxResult;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BashToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    BashToolTest() {
        // default
    }

    @TempDir
    Path workspace;

    private static JsonNode command(String command) {
        return MAPPER.createObjectNode().put("command", command);
    }

    @Test
    @DisplayName("承認を得てからサンドボックスで実行し、stdout/stderr/exit_code を返す")
    void runsAfterApproval() throws Exception {
        RecordingSandbox sandbox = RecordingSandbox.returning(SandboxResult.fromExit(2, "out", "err"));
        RecordingBroker broker = RecordingBroker.allowing();
        BashTool tool = new BashTool(sandbox);

        String result = tool.execute(command("make test"), new ToolContext("s1", "j1", workspace, broker));

        JsonNode output = MAPPER.readTree(result);
        assertThat(output.get("stdout").asText()).isEqualTo("out");
        assertThat(output.get("stderr").asText()).isEqualTo("err");
        assertThat(output.get("exit_code").asInt()).isEqualTo(2);

        PermissionRequest request = broker.last();
        assertThat(request.permissionType()).isEqualTo(PermissionType.SHELL_EXECUTE);
        assertThat(request.message()).isEqualTo("Agent wants to run command: make test");
        assertThat(request.sessionId()).contains("s1");
        assertThat(request.metadata()).containsEntry(PermissionRequest.RESOURCE, "make test");

        RecordingSandbox.Invocation invocation = sandbox.last();
        assertThat(invocation.workspaceDir()).isEqualTo(workspace.toAbsolutePath().normalize());
        assertThat(invocation.config().timeoutSeconds()).isEqualTo(300);
        assertThat(invocation.config().networkEnabled()).isTrue();
    }

    @Test
    @DisplayName("拒否されたらコマンドを実行しない")
    void deniedDoesNotRun() {
        RecordingSandbox sandbox = RecordingSandbox.returning(SandboxResult.fromExit(0, "", ""));
        BashTool tool = new BashTool(sandbox);

        assertThatThrownBy(() -> tool.execute(command("rm -rf build"),
                new ToolContext("s1", "j1", workspace, RecordingBroker.denying())))
                .isInstanceOfSatisfying(ToolException.class, ex -> {
                    assertThat(ex.kind()).isEqualTo(ToolException.Kind.PERMISSION_DENIED);
                    assertThat(ex.fatal()).isTrue();
                })
                .hasMessage("Permission denied: User denied permission");
        assertThat(sandbox.invocations()).isEmpty();
    }

    @Test
    @DisplayName("command がなければ引数エラー")
    void missingCommand() {
        BashTool tool = new BashTool(RecordingSandbox.returning(SandboxResult.fromExit(0, "", "")));

        assertThatThrownBy(() -> tool.execute(MAPPER.createObjectNode(),
                new ToolContext("s1", "j1", workspace, RecordingBroker.allowing())))
                .isInstanceOf(ToolException.class)
                .hasMessage("Missing required argument: command");
    }

    @Test
    @DisplayName("WORKSPACE スコープでは承認を求める前に危険なコマンドを拒否する")
    void workspaceScopeValidatesFirst() {
        RecordingBroker broker = RecordingBroker.allowing();
        BashTool tool = new BashTool(RecordingSandbox.returning(SandboxResult.fromExit(0, "", "")),
                ScopeEnforcer.Scope.WORKSPACE);

        assertThatThrownBy(() -> tool.execute(command("cd / && ls"), new ToolContext("s1", "j1", workspace, broker)))
                .isInstanceOf(ToolException.class)
                .hasMessageStartingWith("Validation failed: ");
        assertThat(broker.requests()).isEmpty();
    }

    @Test
    @DisplayName("スキーマは command を必須にする")
    void schema() {
        JsonNode schema = new BashTool(RecordingSandbox.returning(SandboxResult.fromExit(0, "", "")))
                .parametersSchema();

        assertThat(schema.get("type").asText()).isEqualTo("object");
        assertThat(schema.get("required").get(0).asText()).isEqualTo("command");
    }
}
