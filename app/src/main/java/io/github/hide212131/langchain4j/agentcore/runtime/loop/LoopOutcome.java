package io.github.hide212131.langchain4j.agentcore.runtime.loop;

/** ループの終わり方。 */
public enum LoopOutcome {
    /** モデルがツールを呼ばずに最終応答を返した。 */
    COMPLETED,
    /** ステップ数の上限に達した。 */
    MAX_STEPS,
    /** 承認拒否・サンドボックス不可・LLM 障害で打ち切った。 */
    FAILED
}
