package io.github.hide212131.langchain4j.agentcore.runtime.routing;

/** 問い合わせの分類。 */
public enum QueryClass {
    /** 会話だけで答えられる。 */
    SIMPLE,
    /** ツールや複数手順の実行が必要。 */
    COMPLEX
}
