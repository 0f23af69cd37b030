package io.github.hide212131.langchain4j.agentcore.runtime.provider;

/** LLM 呼び出しに失敗した場合の例外。 */
public class CompletionException extends RuntimeException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
