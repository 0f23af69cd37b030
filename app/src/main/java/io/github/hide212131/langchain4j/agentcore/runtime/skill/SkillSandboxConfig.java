package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxConfig;

/**
 * SKILL.md の sandbox_config ブロック。記述のない項目は null のまま保持する。
 */
public record SkillSandboxConfig(String image, String memoryLimit, Double cpuLimit, Integer timeoutSeconds,
        Boolean networkEnabled) {

    public static SkillSandboxConfig defaults() {
        return new SkillSandboxConfig("python:3.11-slim", "256m", 0.5, 300, false);
    }

    /** 未指定の項目は {@link SandboxConfig} の既定値で補う。 */
    public SandboxConfig toSandboxConfig() {
        SandboxConfig.Builder builder = SandboxConfig.builder().image(image).memoryLimit(memoryLimit);
        if (cpuLimit != null && cpuLimit > 0) {
            builder.cpuLimit(cpuLimit);
        }
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            builder.timeoutSeconds(timeoutSeconds);
        }
        if (networkEnabled != null) {
            builder.networkEnabled(networkEnabled);
        }
        return builder.build();
    }
}
