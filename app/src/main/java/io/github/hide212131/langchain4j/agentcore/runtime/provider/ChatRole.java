package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import java.util.Locale;

/** 会話履歴の発話者。TOOL はツール結果を模したターン。 */
public enum ChatRole {
    USER, ASSISTANT, TOOL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
