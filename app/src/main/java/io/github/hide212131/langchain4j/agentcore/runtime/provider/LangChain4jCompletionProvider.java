package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.agentcore.runtime.LlmConfiguration;
import io.github.hide212131.langchain4j.agentcore.runtime.LlmProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * LangChain4j の ChatModel を {@link CompletionProvider} として使うアダプタ。
 */
public final class LangChain4jCompletionProvider implements CompletionProvider {

    private final ChatModel chatModel;
    private final StreamingChatModel streamingChatModel;
    private final Clock clock;
    private final Duration streamTimeout;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();
    private final AtomicInteger cumulativeInputTokens = new AtomicInteger();
    private final AtomicInteger cumulativeOutputTokens = new AtomicInteger();

    LangChain4jCompletionProvider(ChatModel chatModel, StreamingChatModel streamingChatModel, Clock clock,
            Duration streamTimeout) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.streamingChatModel = streamingChatModel;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.streamTimeout = Objects.requireNonNull(streamTimeout, "streamTimeout");
    }

    public static LangChain4jCompletionProvider forConfiguration(LlmConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.provider() == LlmProvider.MOCK) {
            return fake();
        }
        if (configuration.openAiApiKey() == null || configuration.openAiApiKey().isBlank()) {
            throw new IllegalStateException("OPENAI_API_KEY must be set");
        }
        OpenAiChatModel.OpenAiChatModelBuilder chat = OpenAiChatModel.builder()
                .apiKey(configuration.openAiApiKey())
                .modelName(configuration.effectiveModel())
                .timeout(configuration.timeout());
        OpenAiStreamingChatModel.OpenAiStreamingChatModelBuilder streaming = OpenAiStreamingChatModel.builder()
                .apiKey(configuration.openAiApiKey())
                .modelName(configuration.effectiveModel())
                .timeout(configuration.timeout());
        if (configuration.openAiBaseUrl() != null) {
            chat.baseUrl(configuration.openAiBaseUrl());
            streaming.baseUrl(configuration.openAiBaseUrl());
        }
        return new LangChain4jCompletionProvider(chat.build(), streaming.build(), Clock.systemUTC(),
                configuration.timeout());
    }

    public static LangChain4jCompletionProvider usingChatModel(ChatModel chatModel) {
        return new LangChain4jCompletionProvider(chatModel, null, Clock.systemUTC(), LlmConfiguration.DEFAULT_TIMEOUT);
    }

    public static LangChain4jCompletionProvider usingModels(ChatModel chatModel,
            StreamingChatModel streamingChatModel) {
        return new LangChain4jCompletionProvider(chatModel, streamingChatModel, Clock.systemUTC(),
                LlmConfiguration.DEFAULT_TIMEOUT);
    }

    /** 外部 API を呼ばずに決まった応答を返す。--dry-run 用。 */
    public static LangChain4jCompletionProvider fake() {
        return usingChatModel(new DryRunChatModel());
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public String complete(CompletionRequest request) {
        Objects.requireNonNull(request, "request");
        Instant start = clock.instant();
        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder().messages(toMessages(request)).build());
        } catch (RuntimeException ex) {
            throw new CompletionException("LLM call failed: " + ex.getMessage(), ex);
        }
        recordMetrics(response.tokenUsage(), Duration.between(start, clock.instant()).toMillis());
        AiMessage aiMessage = response.aiMessage();
        String text = aiMessage != null ? aiMessage.text() : null;
        return text == null ? "" : text;
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public String stream(CompletionRequest request, Consumer<String> onToken) {
        if (streamingChatModel == null) {
            return CompletionProvider.super.stream(request, onToken);
        }
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(onToken, "onToken");
        Instant start = clock.instant();
        StringBuilder collected = new StringBuilder();
        CompletableFuture<ChatResponse> done = new CompletableFuture<>();
        try {
            streamingChatModel.chat(ChatRequest.builder().messages(toMessages(request)).build(),
                    new StreamingChatResponseHandler() {
                        @Override
                        public void onPartialResponse(String partialResponse) {
                            collected.append(partialResponse);
                            onToken.accept(partialResponse);
                        }

                        @Override
                        public void onCompleteResponse(ChatResponse completeResponse) {
                            done.complete(completeResponse);
                        }

                        @Override
                        public void onError(Throwable error) {
                            done.completeExceptionally(error);
                        }
                    });
        } catch (RuntimeException ex) {
            throw new CompletionException("LLM stream failed: " + ex.getMessage(), ex);
        }
        ChatResponse response = await(done);
        recordMetrics(response != null ? response.tokenUsage() : null,
                Duration.between(start, clock.instant()).toMillis());
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage != null && aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            return aiMessage.text();
        }
        return collected.toString();
    }

    public ProviderMetrics metrics() {
        return new ProviderMetrics(callCount.get(), cumulativeDurationMs.get(), cumulativeInputTokens.get(),
                cumulativeOutputTokens.get());
    }

    public record ProviderMetrics(int callCount, long totalDurationMs, int totalInputTokens, int totalOutputTokens) {
        public int totalTokenCount() {
            return totalInputTokens + totalOutputTokens;
        }
    }

    static List<ChatMessage> toMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (!request.preamble().isBlank()) {
            messages.add(SystemMessage.from(request.preamble()));
        }
        for (ChatTurn turn : request.history()) {
            if (turn.content().isEmpty()) {
                continue;
            }
            switch (turn.role()) {
                case USER, TOOL -> messages.add(UserMessage.from(turn.content()));
                case ASSISTANT -> messages.add(AiMessage.from(turn.content()));
                default -> throw new IllegalArgumentException("未対応のロールです: " + turn.role());
            }
        }
        if (!request.prompt().isBlank()) {
            messages.add(UserMessage.from(request.prompt()));
        }
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("送信するメッセージがありません");
        }
        return messages;
    }

    private ChatResponse await(CompletableFuture<ChatResponse> done) {
        try {
            return done.get(streamTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CompletionException("LLM stream was interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new CompletionException("LLM stream failed: " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new CompletionException("LLM stream timed out after " + streamTimeout.toSeconds() + "s", ex);
        }
    }

    private void recordMetrics(TokenUsage usage, long durationMs) {
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        if (usage != null) {
            if (usage.inputTokenCount() != null) {
                cumulativeInputTokens.addAndGet(usage.inputTokenCount());
            }
            if (usage.outputTokenCount() != null) {
                cumulativeOutputTokens.addAndGet(usage.outputTokenCount());
            }
        }
    }
}
