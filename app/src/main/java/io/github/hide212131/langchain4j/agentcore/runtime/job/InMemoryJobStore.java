package io.github.hide212131.langchain4j.agentcore.runtime.job;

import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** プロセス内だけで保持する {@link JobStore}。 */
public final class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<ChatTurn>> messages = new ConcurrentHashMap<>();

    @Override
    public void save(Job job) {
        Objects.requireNonNull(job, "job");
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> findBySession(String sessionId) {
        return jobs.values().stream()
                .filter(job -> job.sessionId().equals(sessionId))
                .sorted(Comparator.comparing(Job::createdAt))
                .toList();
    }

    @Override
    public void delete(String jobId) {
        jobs.remove(jobId);
    }

    @Override
    public void appendMessage(String sessionId, ChatTurn turn) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(turn, "turn");
        messages.compute(sessionId, (key, current) -> {
            List<ChatTurn> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(turn);
            return List.copyOf(updated);
        });
    }

    @Override
    public List<ChatTurn> messages(String sessionId) {
        return messages.getOrDefault(sessionId, List.of());
    }
}
