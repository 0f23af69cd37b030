package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import io.github.hide212131.langchain4j.agentcore.runtime.ExecutionMode;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxUnavailableException;
import java.util.Locale;
import java.util.Objects;

/**
 * エージェントの実行モードとスキル側の要求から、隔離バックエンドを使うかどうかを決める。
 * 入力だけで結果が決まり、副作用を持たない。
 */
public final class SkillExecutionResolver {

    /** 実行先の判定結果。 */
    public enum Decision {
        ISOLATED, DIRECT
    }

    private SkillExecutionResolver() {
        throw new AssertionError("インスタンス化できません");
    }

    /**
     * @param preferredMode スキルの execution_mode。未指定なら null
     * @throws SandboxUnavailableException ポリシーが矛盾する、または必要な隔離バックエンドがない場合
     */
    public static Decision resolve(ExecutionMode agentMode, boolean requiresSandbox, String preferredMode,
            boolean dockerAvailable) {
        Objects.requireNonNull(agentMode, "agentMode");
        switch (agentMode) {
        case SANDBOX:
            if (!dockerAvailable) {
                throw new SandboxUnavailableException(
                        "Security Policy Enforcement: Sandbox mode is enabled but Docker is not available.");
            }
            return Decision.ISOLATED;
        case DIRECT:
            if (requiresSandbox) {
                throw new SandboxUnavailableException(
                        "Skill requires sandbox but Agent is in 'direct' execution mode.");
            }
            return Decision.DIRECT;
        case FLEXIBLE:
        default:
            String preferred = preferredMode == null ? "flexible" : preferredMode.trim().toLowerCase(Locale.ROOT);
            if ("sandbox".equals(preferred)) {
                if (!dockerAvailable) {
                    throw new SandboxUnavailableException(
                            "Skill requires sandbox execution but Docker is not available.");
                }
                return Decision.ISOLATED;
            }
            if ("direct".equals(preferred)) {
                return Decision.DIRECT;
            }
            return dockerAvailable ? Decision.ISOLATED : Decision.DIRECT;
        }
    }

    public static Decision resolve(ExecutionMode agentMode, ParsedSkill skill, boolean dockerAvailable) {
        Objects.requireNonNull(skill, "skill");
        return resolve(agentMode, skill.requiresSandbox(), skill.executionMode(), dockerAvailable);
    }
}
