package io.github.hide212131.langchain4j.agentcore.runtime;

import java.util.Locale;

/**
 * エージェント単位の実行ポリシー。スキルやシェルをどのバックエンドで動かすかを決める。
 */
public enum ExecutionMode {
    /** 常に隔離コンテナで実行する。 */
    SANDBOX,
    /** 常にホスト上で直接実行する。 */
    DIRECT,
    /** スキル側の希望に従い、未指定ならコンテナが使えるときだけ隔離する。 */
    FLEXIBLE;

    public static ExecutionMode defaultMode() {
        return FLEXIBLE;
    }

    public static ExecutionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return defaultMode();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sandbox" -> SANDBOX;
            case "direct" -> DIRECT;
            case "flexible" -> FLEXIBLE;
            default -> throw new IllegalArgumentException("Unknown execution mode: " + value);
        };
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
