package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 1 回のコマンド実行に適用するリソース制限。値を省略した場合は既定値で補う。
 */
public record SandboxConfig(String image, String memoryLimit, double cpuLimit, long timeoutSeconds,
        boolean networkEnabled) {

    public static final String DEFAULT_IMAGE = "debian:stable-slim";
    public static final String DEFAULT_MEMORY_LIMIT = "256m";
    public static final double DEFAULT_CPU_LIMIT = 0.5;
    public static final long DEFAULT_TIMEOUT_SECONDS = 300;

    public SandboxConfig {
        image = image == null || image.isBlank() ? DEFAULT_IMAGE : image.trim();
        memoryLimit = memoryLimit == null || memoryLimit.isBlank() ? DEFAULT_MEMORY_LIMIT : memoryLimit.trim();
        if (cpuLimit <= 0) {
            throw new IllegalArgumentException("cpuLimit は正の値を指定してください: " + cpuLimit);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds は正の値を指定してください: " + timeoutSeconds);
        }
    }

    public static SandboxConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().image(image).memoryLimit(memoryLimit).cpuLimit(cpuLimit).timeoutSeconds(timeoutSeconds)
                .networkEnabled(networkEnabled);
    }

    /** docker の --cpus に渡す表記。0.5 は "0.5"、1.0 は "1" になる。 */
    public String cpuLimitText() {
        return BigDecimal.valueOf(cpuLimit).stripTrailingZeros().toPlainString();
    }

    public static final class Builder {
        private String image;
        private String memoryLimit;
        private double cpuLimit = DEFAULT_CPU_LIMIT;
        private long timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private boolean networkEnabled;

        private Builder() {
        }

        public Builder image(String value) {
            this.image = value;
            return this;
        }

        public Builder memoryLimit(String value) {
            this.memoryLimit = value;
            return this;
        }

        public Builder cpuLimit(double value) {
            this.cpuLimit = value;
            return this;
        }

        public Builder timeoutSeconds(long value) {
            this.timeoutSeconds = value;
            return this;
        }

        public Builder networkEnabled(boolean value) {
            this.networkEnabled = value;
            return this;
        }

        public SandboxConfig build() {
            return new SandboxConfig(image, memoryLimit, cpuLimit, timeoutSeconds, networkEnabled);
        }
    }

    @Override
    public String toString() {
        return "SandboxConfig[image=" + image + ", memory=" + memoryLimit + ", cpus=" + cpuLimitText() + ", timeout="
                + timeoutSeconds + "s, network=" + networkEnabled + "]";
    }

    static SandboxConfig orDefaults(SandboxConfig config) {
        return Objects.requireNonNullElseGet(config, SandboxConfig::defaults);
    }
}
