package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import java.util.function.Consumer;

/**
 * 前置き・履歴・入力からテキストを返す LLM の窓口。モデル名や認証情報は実装側で保持する。
 */
public interface CompletionProvider {

    /**
     * @throws CompletionException 呼び出しに失敗した場合
     */
    String complete(CompletionRequest request);

    /**
     * トークン単位で {@code onToken} に流しつつ、最後に全文を返す。既定実装は一括応答を 1 トークンとして流す。
     */
    default String stream(CompletionRequest request, Consumer<String> onToken) {
        String text = complete(request);
        if (text != null && !text.isEmpty()) {
            onToken.accept(text);
        }
        return text == null ? "" : text;
    }
}
