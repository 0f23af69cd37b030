package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

/**
 * 隔離実行が必須なのにバックエンドが使えない、またはポリシーが矛盾する場合の例外。
 */
public class SandboxUnavailableException extends RuntimeException {

    public SandboxUnavailableException(String message) {
        super(message);
    }
}
