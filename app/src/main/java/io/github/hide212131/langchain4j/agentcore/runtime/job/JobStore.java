package io.github.hide212131.langchain4j.agentcore.runtime.job;

import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import java.util.List;
import java.util.Optional;

/**
 * ジョブと会話履歴を ID で保存する単純なストア。
 */
public interface JobStore {

    void save(Job job);

    Optional<Job> find(String jobId);

    List<Job> findBySession(String sessionId);

    void delete(String jobId);

    void appendMessage(String sessionId, ChatTurn turn);

    List<ChatTurn> messages(String sessionId);
}
