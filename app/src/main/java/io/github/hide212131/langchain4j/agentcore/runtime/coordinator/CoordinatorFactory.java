package io.github.hide212131.langchain4j.agentcore.runtime.coordinator;

import io.github.hide212131.langchain4j.agentcore.runtime.AgentConfiguration;
import io.github.hide212131.langchain4j.agentcore.runtime.ExecutionMode;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.loop.AgentLoop;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.ScopeEnforcer;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.Planner;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.routing.QueryClassifier;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxBackend;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.LoadedSkill;
import io.github.hide212131.langchain4j.agentcore.runtime.skill.SkillTool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.BashTool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.FilesystemTool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.SearchFilesTool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolRegistry;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolResultCache;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 設定・プロバイダ・サンドボックスから {@link Coordinator} を組み立てる。
 */
public final class CoordinatorFactory {

    private static final Logger LOGGER = Logger.getLogger(CoordinatorFactory.class.getName());

    private CoordinatorFactory() {
        throw new AssertionError("インスタンス化できません");
    }

    /** 組み立てに必要な部品一式。 */
    public record Components(AgentConfiguration configuration, CompletionProvider provider, PermissionBroker broker,
            AgentObserver observer, JobStore jobStore, SandboxBackend isolated, SandboxBackend direct,
            List<LoadedSkill> skills) {

        public Components {
            Objects.requireNonNull(configuration, "configuration");
            Objects.requireNonNull(provider, "provider");
            Objects.requireNonNull(broker, "broker");
            Objects.requireNonNull(observer, "observer");
            Objects.requireNonNull(jobStore, "jobStore");
            Objects.requireNonNull(isolated, "isolated");
            Objects.requireNonNull(direct, "direct");
            skills = skills == null ? List.of() : List.copyOf(skills);
        }
    }

    public static Coordinator create(Components components) {
        AgentConfiguration configuration = components.configuration();
        AgentLoop loop = AgentLoop.builder().provider(components.provider()).tools(toolRegistry(components))
                .broker(components.broker()).observer(components.observer()).jobStore(components.jobStore())
                .workspace(configuration.workspacePath()).systemPrompt(configuration.systemPrompt())
                .maxSteps(configuration.maxTurns()).cache(new ToolResultCache()).build();
        return new Coordinator(new QueryClassifier(components.provider()), new Planner(components.provider()),
                new SimpleChat(components.provider(), components.jobStore(), configuration.systemPrompt()), loop,
                components.observer(), components.jobStore());
    }

    /**
     * 組み込みツールとスキルを登録する。組み込みツールは SANDBOX モードでのみ隔離バックエンドを使い、
     * ホストで動かす場合はワークスペース外へ出るコマンドを拒否する。
     */
    public static ToolRegistry toolRegistry(Components components) {
        ExecutionMode mode = components.configuration().executionMode();
        boolean isolatedBuiltins = mode == ExecutionMode.SANDBOX;
        SandboxBackend shell = isolatedBuiltins ? components.isolated() : components.direct();
        ScopeEnforcer.Scope shellScope = isolatedBuiltins ? ScopeEnforcer.Scope.GLOBAL : ScopeEnforcer.Scope.WORKSPACE;

        ToolRegistry registry = ToolRegistry.of(new BashTool(shell, shellScope), new FilesystemTool(),
                new SearchFilesTool(shell));
        for (LoadedSkill skill : components.skills()) {
            if (registry.find(skill.name()).isPresent()) {
                LOGGER.warning(() -> "ツール名と重複するスキルを読み飛ばしました: " + skill.name());
                continue;
            }
            registry.register(new SkillTool(skill, mode, components.isolated(), components.direct()));
        }
        return registry;
    }
}
