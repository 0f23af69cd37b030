package io.github.hide212131.langchain4j.agentcore.runtime.visibility;

/** 進捗イベントの送信先。UI やテレメトリへの橋渡しを実装する。 */
@FunctionalInterface
public interface AgentObserver {

    void emit(String channel, AgentEvent event);

    static String channelFor(String sessionId) {
        return "session:" + sessionId;
    }

    static AgentObserver noop() {
        return (channel, event) -> {
            // no-op
        };
    }
}
