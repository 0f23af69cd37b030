package io.github.hide212131.langchain4j.agentcore.runtime.visibility;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** メモリ内にイベントを蓄積するシンプルな観測者。テストや CLI の集計向け。 */
public final class AgentEventCollector implements AgentObserver {

    private final List<Received> buffer = new CopyOnWriteArrayList<>();

    @Override
    public void emit(String channel, AgentEvent event) {
        buffer.add(new Received(channel, Objects.requireNonNull(event, "event")));
    }

    public List<AgentEvent> events() {
        return buffer.stream().map(Received::event).toList();
    }

    public List<AgentEvent> events(AgentEventType type) {
        return buffer.stream().map(Received::event).filter(event -> event.type() == type).toList();
    }

    public List<String> messages(AgentEventType type) {
        return events(type).stream().map(AgentEvent::message).toList();
    }

    public List<AgentEventType> types() {
        return buffer.stream().map(received -> received.event().type()).toList();
    }

    public List<String> channels() {
        return buffer.stream().map(Received::channel).distinct().toList();
    }

    public void clear() {
        buffer.clear();
    }

    private record Received(String channel, AgentEvent event) {
    }
}
