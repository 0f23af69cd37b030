package io.github.hide212131.langchain4j.agentcore.runtime;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 利用する LLM プロバイダ。agent.yaml の {@code provider} と {@code LLM_PROVIDER} は同じ名前で指定する。
 */
public enum LlmProvider {
    /** 外部 API を呼ばずに決まった応答を返す。 */
    MOCK("mock", null),
    OPENAI("openai", "OPENAI_API_KEY");

    private final String id;
    private final String apiKeyVariable;

    LlmProvider(String id, String apiKeyVariable) {
        this.id = id;
        this.apiKeyVariable = apiKeyVariable;
    }

    public String id() {
        return id;
    }

    public boolean requiresApiKey() {
        return apiKeyVariable != null;
    }

    /** API キーを読む変数名。キー不要なら null。 */
    public String apiKeyVariable() {
        return apiKeyVariable;
    }

    /**
     * @param value  プロバイダ名。null または空白なら {@link #MOCK}
     * @param source エラーメッセージに出す指定元
     * @throws IllegalArgumentException 未対応の名前の場合
     */
    public static LlmProvider from(String value, String source) {
        if (value == null || value.isBlank()) {
            return MOCK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("dry-run".equals(normalized)) {
            return MOCK;
        }
        for (LlmProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown LLM provider in " + source + ": " + value + " (supported: "
                + Arrays.stream(values()).map(LlmProvider::id).collect(Collectors.joining(", ")) + ")");
    }
}
