package io.github.hide212131.langchain4j.agentcore.runtime;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * エージェント設定・環境変数・.env の順に LLM の接続設定を解決する。
 *
 * <p>
 * agent.yaml の {@code provider} と {@code model} は環境変数より優先する。API キーとエンドポイントは
 * agent.yaml には書かせず、環境変数と .env からだけ読む。
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";
    static final String AGENT_PROVIDER_SOURCE = "agent configuration";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    /** 環境変数と .env だけで解決する。 */
    public LlmConfiguration load() {
        return resolve(null, null);
    }

    /** agent.yaml の指定を優先して解決する。 */
    public LlmConfiguration load(AgentConfiguration agent) {
        Objects.requireNonNull(agent, "agent");
        return resolve(agent.provider(), agent.model());
    }

    private LlmConfiguration resolve(String agentProvider, String agentModel) {
        LlmProvider provider = agentProvider != null ? LlmProvider.from(agentProvider, AGENT_PROVIDER_SOURCE)
                : LlmProvider.from(lookup(ENV_LLM_PROVIDER), ENV_LLM_PROVIDER);
        String apiKey = lookup(ENV_OPENAI_API_KEY);
        if (provider.requiresApiKey() && apiKey == null) {
            throw new IllegalStateException(provider.apiKeyVariable() + " must be set when the LLM provider is "
                    + provider.id());
        }
        String model = agentModel != null ? agentModel : lookup(ENV_OPENAI_MODEL);
        return new LlmConfiguration(provider, apiKey, lookup(ENV_OPENAI_BASE_URL), model, timeout());
    }

    private Duration timeout() {
        String raw = lookup(ENV_OPENAI_TIMEOUT_SECONDS);
        if (raw == null) {
            return LlmConfiguration.DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " は秒数の整数で指定してください: " + raw, ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " は 1 以上を指定してください: " + raw);
        }
        return Duration.ofSeconds(seconds);
    }

    // 環境変数に同名のキーがあれば空文字でも .env を見ない
    private String lookup(String key) {
        String value = environment.containsKey(key) ? environment.get(key) : dotenv.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
