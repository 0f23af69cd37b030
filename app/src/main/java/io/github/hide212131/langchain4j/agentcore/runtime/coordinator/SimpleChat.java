package io.github.hide212131.langchain4j.agentcore.runtime.coordinator;

import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionRequest;
import java.util.Objects;

/**
 * ツールを使わずに会話だけで答える。セッションの履歴を前提として渡し、やり取りを履歴に追記する。
 */
public final class SimpleChat {

    static final String DEFAULT_PREAMBLE = "You are a helpful, friendly assistant. Answer the user's message"
            + " directly and concisely.";

    private final CompletionProvider provider;
    private final JobStore jobStore;
    private final String preamble;

    public SimpleChat(CompletionProvider provider, JobStore jobStore, String preamble) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.preamble = preamble == null || preamble.isBlank() ? DEFAULT_PREAMBLE : preamble;
    }

    /**
     * @throws io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionException 応答を得られなかった場合
     */
    public String reply(String sessionId, String message) {
        CompletionRequest request = new CompletionRequest(preamble, jobStore.messages(sessionId), message);
        String response = provider.complete(request);
        String text = response == null ? "" : response.trim();
        jobStore.appendMessage(sessionId, ChatTurn.user(message));
        jobStore.appendMessage(sessionId, ChatTurn.assistant(text));
        return text;
    }
}
