package io.github.hide212131.langchain4j.agentcore.runtime.coordinator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.agentcore.runtime.AgentConfiguration;
import io.github.hide212131.langchain4j.agentcore.runtime.ExecutionMode;
import io.github.hide212131.langchain4j.agentcore.runtime.job.InMemoryJobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.RecordingBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.ScriptedCompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.RecordingSandbox;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxResult;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.LoadedSkill;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.ParsedSkill;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.SkillCatalog;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.BashTool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolException;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolRegistry;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEventCollector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoordinatorFactoryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Path SKILLS = Path.of("src/test/resources/skills");

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    CoordinatorFactoryTest() {
        // default
    }

    @TempDir
    Path workspace;

    private final RecordingSandbox isolated = new RecordingSandbox("docker", true,
            command -> SandboxResult.fromExit(0, "isolated", ""));
    private final RecordingSandbox direct = new RecordingSandbox("direct", true,
            command -> SandboxResult.fromExit(0, "direct", ""));

    private CoordinatorFactory.Components components(ExecutionMode mode, List<LoadedSkill> skills,
            ScriptedCompletionProvider provider, AgentEventCollector observer) {
        AgentConfiguration configuration = AgentConfiguration.defaults(workspace).withExecutionMode(mode);
        return new CoordinatorFactory.Components(configuration, provider, RecordingBroker.allowing(), observer,
                new InMemoryJobStore(), isolated, direct, skills);
    }

    private CoordinatorFactory.Components components(ExecutionMode mode, List<LoadedSkill> skills) {
        return components(mode, skills, new ScriptedCompletionProvider(), new AgentEventCollector());
    }

    private ToolContext context() {
        return new ToolContext("s1", "j1", workspace, RecordingBroker.allowing());
    }

    @Test
    @DisplayName("組み込みツールの後ろにスキルを登録する")
    void registersBuiltinsAndSkills() {
        List<LoadedSkill> skills = SkillCatalog.loadAll(SKILLS, new ArrayList<>());

        ToolRegistry registry = CoordinatorFactory.toolRegistry(components(ExecutionMode.FLEXIBLE, skills));

        assertThat(registry.names()).containsExactly("bash", "filesystem", "search_files", "csv-report");
    }

    @Test
    @DisplayName("組み込みツールと同名のスキルは登録しない")
    void skipsSkillNamedLikeTool() {
        ParsedSkill parsed = new ParsedSkill("bash", "Shadows the shell tool.", null, null, null, false, null, null,
                "body");
        LoadedSkill shadow = new LoadedSkill(parsed, Map.of());

        ToolRegistry registry = CoordinatorFactory.toolRegistry(components(ExecutionMode.FLEXIBLE, List.of(shadow)));

        assertThat(registry.names()).containsExactly("bash", "filesystem", "search_files");
        assertThat(registry.find("bash")).containsInstanceOf(BashTool.class);
    }

    @Test
    @DisplayName("SANDBOX モードではシェルを隔離環境で動かし、パスの制限をかけない")
    void sandboxModeUsesIsolatedShell() {
        ToolRegistry registry = CoordinatorFactory.toolRegistry(components(ExecutionMode.SANDBOX, List.of()));
        Tool bash = registry.find("bash").orElseThrow();

        String result = bash.execute(MAPPER.createObjectNode().put("command", "cat /etc/os-release"), context());

        assertThat(result).contains("isolated");
        assertThat(isolated.last().command()).isEqualTo("cat /etc/os-release");
        assertThat(direct.invocations()).isEmpty();
    }

    @Test
    @DisplayName("ホストで動かすモードではワークスペース外へ出るコマンドを拒否する")
    void hostModesRestrictShell() {
        for (ExecutionMode mode : List.of(ExecutionMode.DIRECT, ExecutionMode.FLEXIBLE)) {
            Tool bash = CoordinatorFactory.toolRegistry(components(mode, List.of())).find("bash").orElseThrow();

            assertThatThrownBy(() -> bash.execute(MAPPER.createObjectNode().put("command", "cat /etc/passwd"),
                    context()))
                    .isInstanceOfSatisfying(ToolException.class,
                            ex -> assertThat(ex.kind()).isEqualTo(ToolException.Kind.VALIDATION_FAILED));
            String result = bash.execute(MAPPER.createObjectNode().put("command", "ls"), context());
            assertThat(result).contains("direct");
        }
        assertThat(isolated.invocations()).isEmpty();
    }

    @Test
    @DisplayName("組み立てたコーディネーターで問い合わせを最後まで処理できる")
    void createsWorkingCoordinator() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("Hello!");
        AgentEventCollector observer = new AgentEventCollector();

        Coordinator coordinator = CoordinatorFactory.create(
                components(ExecutionMode.FLEXIBLE, List.of(), provider, observer));
        Job job = coordinator.run("s1", "hello");

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(observer.channels()).containsExactly("session:s1");
    }

    @Test
    @DisplayName("実行ループの前置きには登録済みツールを載せる")
    void loopSeesRegisteredTools() {
        ScriptedCompletionProvider provider = new ScriptedCompletionProvider().reply("Done.");

        CoordinatorFactory.create(components(ExecutionMode.FLEXIBLE, List.of(), provider, new AgentEventCollector()))
                .run("s1", "anything", true);

        assertThat(provider.lastRequest().preamble()).contains("- bash:", "- filesystem:", "- search_files:");
    }
}
