package io.github.hide212131.langchain4j.agentcore.runtime;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 1 エージェント分の実行設定。
 *
 * @param id            エージェント識別子
 * @param name          表示名
 * @param provider      LLM プロバイダ名（null の場合は LLM_PROVIDER に従う）
 * @param model         モデル名（null の場合は OPENAI_MODEL かプロバイダの既定値）
 * @param systemPrompt  システムプロンプト（null の場合は既定の前置き）
 * @param maxTurns      1 回の実行ループで許可するツール呼び出し回数
 * @param workspacePath ツールが読み書きするワークスペース
 * @param executionMode スキル・シェル実行のポリシー
 * @param autonomous    true の場合は権限要求をすべて自動承認する
 */
public record AgentConfiguration(String id, String name, String provider, String model, String systemPrompt,
        int maxTurns, Path workspacePath, ExecutionMode executionMode, boolean autonomous) {

    public static final int DEFAULT_MAX_TURNS = 10;

    public AgentConfiguration {
        id = id == null || id.isBlank() ? "default" : id.trim();
        name = name == null || name.isBlank() ? "Default Agent" : name.trim();
        provider = provider == null || provider.isBlank() ? null : provider.trim();
        model = model == null || model.isBlank() ? null : model.trim();
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns は 1 以上を指定してください: " + maxTurns);
        }
        Objects.requireNonNull(workspacePath, "workspacePath");
        workspacePath = workspacePath.toAbsolutePath().normalize();
        executionMode = executionMode == null ? ExecutionMode.defaultMode() : executionMode;
    }

    public static AgentConfiguration defaults(Path workspacePath) {
        return new AgentConfiguration(null, null, null, null, null, DEFAULT_MAX_TURNS, workspacePath,
                ExecutionMode.defaultMode(), false);
    }

    public AgentConfiguration withExecutionMode(ExecutionMode mode) {
        return new AgentConfiguration(id, name, provider, model, systemPrompt, maxTurns, workspacePath, mode,
                autonomous);
    }

    public AgentConfiguration withWorkspacePath(Path path) {
        return new AgentConfiguration(id, name, provider, model, systemPrompt, maxTurns, path, executionMode,
                autonomous);
    }

    public AgentConfiguration withAutonomous(boolean value) {
        return new AgentConfiguration(id, name, provider, model, systemPrompt, maxTurns, workspacePath,
                executionMode, value);
    }
}
