package io.github.hide212131.langchain4j.agentcore.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LlmConfigurationLoaderTest {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    LlmConfigurationLoaderTest() {
        // default
    }

    @TempDir
    Path tempDir;

    private Dotenv emptyDotenv() {
        return Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().directory(tempDir.toString()).load();
    }

    @Test
    @DisplayName("環境変数が空ならデフォルトで mock を選択する")
    void defaultIsMockWhenNoEnv() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(), emptyDotenv());

        LlmConfiguration config = loader.load();

        assertThat(config.provider()).isEqualTo(LlmProvider.MOCK);
        assertThat(config.openAiApiKey()).isNull();
        assertThat(config.openAiBaseUrl()).isNull();
        assertThat(config.openAiModel()).isNull();
        assertThat(config.timeout()).isEqualTo(LlmConfiguration.DEFAULT_TIMEOUT);
        assertThat(config.effectiveModel()).isEqualTo(LlmConfiguration.DEFAULT_MODEL);
    }

    @Test
    @DisplayName("LLM_PROVIDER=openai でキーがなければ例外を返す")
    void errorWhenOpenAiKeyMissing() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_LLM_PROVIDER, "openai"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    @DisplayName("環境変数が優先され、存在しない場合のみ .env を読む")
    void preferEnvironmentOverDotenv() throws IOException {
        Files.writeString(tempDir.resolve(".env"), """
                LLM_PROVIDER=openai
                OPENAI_API_KEY=from-dotenv
                OPENAI_BASE_URL=https://api.example.com
                OPENAI_MODEL=gpt-dotenv
                OPENAI_TIMEOUT_SECONDS=30
                """, StandardCharsets.UTF_8);
        Dotenv dotenv = Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().directory(tempDir.toString()).load();

        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(
                LlmConfigurationLoader.ENV_LLM_PROVIDER, "mock",
                LlmConfigurationLoader.ENV_OPENAI_API_KEY, "from-env",
                LlmConfigurationLoader.ENV_OPENAI_BASE_URL, "",
                LlmConfigurationLoader.ENV_OPENAI_MODEL, "gpt-env"), dotenv);

        LlmConfiguration config = loader.load();

        assertThat(config.provider()).isEqualTo(LlmProvider.MOCK);
        assertThat(config.openAiApiKey()).isEqualTo("from-env");
        assertThat(config.openAiBaseUrl()).isNull();
        assertThat(config.openAiModel()).isEqualTo("gpt-env");
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("タイムアウトは正の整数秒でなければならない")
    void rejectsInvalidTimeout() {
        LlmConfigurationLoader notNumber = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_OPENAI_TIMEOUT_SECONDS, "soon"), emptyDotenv());
        LlmConfigurationLoader zero = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_OPENAI_TIMEOUT_SECONDS, "0"), emptyDotenv());

        assertThatThrownBy(notNumber::load).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI_TIMEOUT_SECONDS");
        assertThatThrownBy(zero::load).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 以上");
    }

    @Test
    @DisplayName("不明なプロバイダ名は指定元を添えて拒否する")
    void rejectsUnknownProvider() {
        LlmConfigurationLoader unknown = new LlmConfigurationLoader(
                Map.of(LlmConfigurationLoader.ENV_LLM_PROVIDER, "anthropic"), emptyDotenv());

        assertThatThrownBy(unknown::load).isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown LLM provider in LLM_PROVIDER: anthropic (supported: mock, openai)");
        assertThatThrownBy(() -> unknown.load(agent("gemini", null))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unknown LLM provider in agent configuration: gemini");
    }

    @Test
    @DisplayName("agent.yaml の provider と model は環境変数より優先する")
    void agentConfigurationWins() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(
                LlmConfigurationLoader.ENV_LLM_PROVIDER, "mock",
                LlmConfigurationLoader.ENV_OPENAI_API_KEY, "sk-env-key",
                LlmConfigurationLoader.ENV_OPENAI_MODEL, "gpt-env"), emptyDotenv());

        LlmConfiguration config = loader.load(agent("OpenAI", "gpt-4o"));

        assertThat(config.provider()).isEqualTo(LlmProvider.OPENAI);
        assertThat(config.openAiModel()).isEqualTo("gpt-4o");
        assertThat(config.openAiApiKey()).isEqualTo("sk-env-key");
    }

    @Test
    @DisplayName("agent.yaml で未指定なら環境変数に従う")
    void agentConfigurationFallsBackToEnvironment() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(
                LlmConfigurationLoader.ENV_LLM_PROVIDER, "dry_run",
                LlmConfigurationLoader.ENV_OPENAI_MODEL, "gpt-env"), emptyDotenv());

        LlmConfiguration config = loader.load(agent(null, " "));

        assertThat(config.provider()).isEqualTo(LlmProvider.MOCK);
        assertThat(config.openAiModel()).isEqualTo("gpt-env");
    }

    @Test
    @DisplayName("agent.yaml で openai を選んでもキーがなければ例外")
    void agentProviderStillNeedsKey() {
        LlmConfigurationLoader loader = new LlmConfigurationLoader(Map.of(), emptyDotenv());

        assertThatThrownBy(() -> loader.load(agent("openai", null))).isInstanceOf(IllegalStateException.class)
                .hasMessage("OPENAI_API_KEY must be set when the LLM provider is openai");
    }

    private AgentConfiguration agent(String provider, String model) {
        return new AgentConfiguration(null, null, provider, model, null, AgentConfiguration.DEFAULT_MAX_TURNS,
                tempDir, ExecutionMode.FLEXIBLE, false);
    }

    @Test
    @DisplayName("API キーは末尾 4 文字だけを表示する")
    void masksApiKey() {
        assertThat(new LlmConfiguration(LlmProvider.OPENAI, "sk-1234567890", null, null, null).maskedApiKey())
                .isEqualTo("****7890");
        assertThat(new LlmConfiguration(LlmProvider.OPENAI, "short", null, null, null).maskedApiKey())
                .isEqualTo("****");
        assertThat(LlmConfiguration.mock().maskedApiKey()).isEqualTo("(none)");
    }
}
