package io.github.hide212131.langchain4j.agentcore.runtime.coordinator;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.loop.AgentLoop;
import io.github.hide212131.langchain4j.agentcore.runtime.loop.LoopResult;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.ExecutionPlan;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.PlanTask;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.Planner;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.PlanningException;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionException;
import io.github.hide212131.langchain4j.agentcore.runtime.routing.QueryClass;
import io.github.hide212131.langchain4j.agentcore.runtime.routing.QueryClassifier;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEvent;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 問い合わせ 1 件をジョブとして処理する。
 *
 * <p>
 * 分類結果が SIMPLE なら会話だけで答え、COMPLEX なら計画を立ててタスクごとに実行ループを回す。
 * 高速モードでは分類と計画を省き、問い合わせをそのまま実行ループに渡す。
 */
public final class Coordinator {

    static final String ALL_TASKS_EXECUTED = "All tasks executed.";
    static final String UNEXPECTED_ERROR = "Unexpected error: ";
    static final int PLANNING_CONTEXT_TURNS = 10;

    private static final VisibilityLog LOG = VisibilityLog.forClass(Coordinator.class);

    private final QueryClassifier classifier;
    private final Planner planner;
    private final SimpleChat simpleChat;
    private final AgentLoop loop;
    private final AgentObserver observer;
    private final JobStore jobStore;

    public Coordinator(QueryClassifier classifier, Planner planner, SimpleChat simpleChat, AgentLoop loop,
            AgentObserver observer, JobStore jobStore) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.simpleChat = Objects.requireNonNull(simpleChat, "simpleChat");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    }

    /** 通常モード。 */
    public Job run(String sessionId, String query) {
        return run(sessionId, query, false);
    }

    /**
     * @param fast true の場合は分類と計画を省く
     * @return 終了状態になったジョブ
     */
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public Job run(String sessionId, String query, boolean fast) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(query, "query");
        String channel = AgentObserver.channelFor(sessionId);
        Job job = Job.start(sessionId, query);
        jobStore.save(job);
        observer.emit(channel, AgentEvent.jobStarted(job));
        LOG.info(sessionId, job.id(), "coordinator", "start", "ジョブを開始しました", query, fast ? "fast" : "normal");

        try {
            return execute(channel, job, query, fast);
        } catch (RuntimeException ex) {
            // 途中で保存された最新の状態を失敗として閉じる
            LOG.error(sessionId, job.id(), "coordinator", "run", "ジョブが予期せず失敗しました", query, ex);
            observer.emit(channel, AgentEvent.error("Job aborted", ex.getMessage()));
            return failed(channel, jobStore.find(job.id()).orElse(job), UNEXPECTED_ERROR + ex.getMessage());
        }
    }

    private Job execute(String channel, Job job, String query, boolean fast) {
        String sessionId = job.sessionId();
        if (fast) {
            observer.emit(channel, AgentEvent.thinking("Fast Mode: Executing directly..."));
            LoopResult result = loop.run(job, query);
            return result.failed() ? failed(channel, result.job(), result.message())
                    : completed(channel, result.job(), result.message());
        }

        observer.emit(channel, AgentEvent.thinking("Analyzing query..."));
        QueryClass queryClass = classifier.classify(query);
        LOG.info(sessionId, job.id(), "routing", "classify", "問い合わせを分類しました", query, queryClass.name());
        if (queryClass == QueryClass.SIMPLE) {
            return respond(channel, job, query);
        }
        return planAndExecute(channel, job, query);
    }

    private Job respond(String channel, Job job, String query) {
        observer.emit(channel, AgentEvent.thinking("Responding..."));
        try {
            String reply = simpleChat.reply(job.sessionId(), query);
            observer.emit(channel, AgentEvent.token(reply));
            return completed(channel, job, reply);
        } catch (CompletionException ex) {
            LOG.warn(job.sessionId(), job.id(), "coordinator", "simple", "応答に失敗しました", query, ex);
            String message = "Error: " + ex.getMessage();
            observer.emit(channel, AgentEvent.token(message));
            return failed(channel, job, message);
        }
    }

    private Job planAndExecute(String channel, Job job, String query) {
        observer.emit(channel, AgentEvent.thinking("Analyzing request and creating a plan..."));
        ExecutionPlan plan;
        try {
            plan = planner.plan(query, planningContext(job.sessionId()),
                    token -> observer.emit(channel, AgentEvent.thinking(token)));
        } catch (PlanningException ex) {
            LOG.warn(job.sessionId(), job.id(), "planning", "plan", "計画を作成できませんでした", query, ex);
            String message = "Planning failed: " + ex.getMessage();
            observer.emit(channel, AgentEvent.token(message));
            return failed(channel, job, message);
        }
        observer.emit(channel, AgentEvent.planUpdate(plan));

        Job current = job;
        for (PlanTask task : plan.tasks()) {
            plan = plan.start(task.id());
            observer.emit(channel, AgentEvent.planUpdate(plan));
            observer.emit(channel, AgentEvent.thinking("Starting Task: " + task.description()));

            LoopResult result = loop.run(current, task.description());
            current = result.job();
            if (result.failed()) {
                LOG.warn(job.sessionId(), job.id(), "coordinator", task.id(), "タスクが失敗しました", task.description(),
                        null);
                return failed(channel, current, "Task " + task.id() + " failed: " + result.message());
            }
            plan = plan.complete(task.id(), result.message());
            observer.emit(channel, AgentEvent.planUpdate(plan));
        }
        return completed(channel, current, ALL_TASKS_EXECUTED);
    }

    // 計画に添える直近の会話
    private String planningContext(String sessionId) {
        List<ChatTurn> turns = jobStore.messages(sessionId);
        List<ChatTurn> recent = turns.subList(Math.max(0, turns.size() - PLANNING_CONTEXT_TURNS), turns.size());
        StringBuilder sb = new StringBuilder();
        for (ChatTurn turn : recent) {
            sb.append(turn.role().name().toLowerCase(Locale.ROOT)).append(": ").append(turn.content()).append('\n');
        }
        return sb.toString();
    }

    private Job completed(String channel, Job job, String message) {
        Job done = job.withStatus(JobStatus.COMPLETED);
        jobStore.save(done);
        observer.emit(channel, AgentEvent.jobCompleted(done, message));
        return done;
    }

    private Job failed(String channel, Job job, String message) {
        Job done = job.withStatus(JobStatus.FAILED);
        jobStore.save(done);
        observer.emit(channel, AgentEvent.jobCompleted(done, message));
        return done;
    }
}
