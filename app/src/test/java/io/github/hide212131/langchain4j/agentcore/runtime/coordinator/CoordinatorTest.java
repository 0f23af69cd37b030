package io.github.hide212131.langchain4j.agentcore.runtime.coordinator;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.agentcore.runtime.job.InMemoryJobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.loop.AgentLoop;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.RecordingBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.ExecutionPlan;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.PlanTask;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.Planner;
import io.github.hide212131.langchain4j.agentcore.runtime.planning.TaskStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.ScriptedCompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.routing.QueryClassifier;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEvent;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEventCollector;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEventType;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.nio.file.Path;
import java.util.List;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoordinatorTest {

    private static final String PLAN = "{\"tasks\": [{\"id\": \"1\", \"description\": \"Read the README\"},"
            + " {\"id\": \"2\", \"description\": \"Write a summary\", \"dependencies\": [\"1\"]}]}";

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    CoordinatorTest() {
        // default
    }

    @TempDir
    Path workspace;

    private final ScriptedCompletionProvider provider = new ScriptedCompletionProvider();
    private final AgentEventCollector events = new AgentEventCollector();
    private final InMemoryJobStore jobStore = new InMemoryJobStore();

    private Coordinator coordinator(int maxSteps) {
        return coordinator(maxSteps, events);
    }

    private Coordinator coordinator(int maxSteps, AgentObserver observer) {
        AgentLoop loop = AgentLoop.builder().provider(provider).broker(RecordingBroker.allowing()).observer(observer)
                .jobStore(jobStore).workspace(workspace).maxSteps(maxSteps).build();
        return new Coordinator(new QueryClassifier(provider), new Planner(provider, millis -> {
        }), new SimpleChat(provider, jobStore, null), loop, observer, jobStore);
    }

    private Coordinator coordinator() {
        return coordinator(AgentLoop.DEFAULT_MAX_STEPS);
    }

    @Test
    @DisplayName("SIMPLE な問い合わせは会話だけで答えて完了する")
    void simpleQuery() {
        provider.reply("Hello! How can I help?");

        Job job = coordinator().run("s1", "hello there");

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(events.types()).containsExactly(AgentEventType.JOB_STARTED, AgentEventType.THINKING,
                AgentEventType.THINKING, AgentEventType.TOKEN, AgentEventType.JOB_COMPLETED);
        assertThat(events.messages(AgentEventType.THINKING)).containsExactly("Analyzing query...", "Responding...");
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).containsExactly("Hello! How can I help?");
        assertThat(provider.lastRequest().preamble()).isEqualTo(SimpleChat.DEFAULT_PREAMBLE);
        assertThat(jobStore.messages("s1")).hasSize(2);
        assertThat(jobStore.find(job.id())).map(Job::status).contains(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("会話の応答に失敗したらエラー文を返してジョブを失敗にする")
    void simpleQueryFailure() {
        provider.fail("quota exceeded");

        Job job = coordinator().run("s1", "thanks!");

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(events.messages(AgentEventType.TOKEN)).containsExactly("Error: quota exceeded");
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).containsExactly("Error: quota exceeded");
    }

    @Test
    @DisplayName("COMPLEX な問い合わせは計画を立ててタスクを順に実行する")
    void complexQuery() {
        provider.reply(PLAN, "README says hello", "Summary written");

        Job job = coordinator().run("s1", "Create a summary file of the README");

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).containsExactly(Coordinator.ALL_TASKS_EXECUTED);
        assertThat(events.messages(AgentEventType.THINKING)).contains("Analyzing query...",
                "Analyzing request and creating a plan...", PLAN, "Starting Task: Read the README",
                "Starting Task: Write a summary");
        assertThat(events.messages(AgentEventType.TOKEN)).containsExactly("README says hello", "Summary written");
        assertThat(provider.requests()).extracting(request -> request.prompt()).containsExactly(
                "Create a summary file of the README", "Read the README", "Write a summary");

        List<ExecutionPlan> plans = events.events(AgentEventType.PLAN_UPDATE).stream()
                .map(event -> event.payloadAs(ExecutionPlan.class).orElseThrow()).toList();
        assertThat(plans).hasSize(5);
        assertThat(plans).extracting(ExecutionPlan::planId).containsOnly(plans.get(0).planId());
        assertThat(plans.get(1).task("1")).map(PlanTask::status).contains(TaskStatus.RUNNING);
        ExecutionPlan last = plans.get(plans.size() - 1);
        assertThat(last.count(TaskStatus.COMPLETED)).isEqualTo(2);
        assertThat(last.task("2")).map(PlanTask::result).contains("Summary written");
    }

    @Test
    @DisplayName("計画を作れなければジョブを失敗にする")
    void planningFailure() {
        provider.reply("no plan", "still no plan", "nope");

        Job job = coordinator().run("s1", "Refactor the module");

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).singleElement(InstanceOfAssertFactories.STRING)
                .startsWith("Planning failed: Failed to parse generated plan: ")
                .endsWith("Response start: 'nope'");
        assertThat(events.types()).doesNotContain(AgentEventType.PLAN_UPDATE);
    }

    @Test
    @DisplayName("タスクが失敗したら残りを実行せずにジョブを失敗にする")
    void taskFailure() {
        provider.reply(PLAN).fail("connection reset");

        Job job = coordinator().run("s1", "Create a summary file of the README");

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(events.messages(AgentEventType.JOB_COMPLETED))
                .containsExactly("Task 1 failed: connection reset");
        assertThat(events.messages(AgentEventType.ERROR)).containsExactly("LLM call failed");
        assertThat(events.messages(AgentEventType.THINKING)).doesNotContain("Starting Task: Write a summary");
        assertThat(jobStore.find(job.id())).map(Job::status).contains(JobStatus.FAILED);
    }

    @Test
    @DisplayName("既存の ID と衝突する重複 ID でも全タスクを実行して完了する")
    void collidingDuplicateTaskIds() {
        provider.reply("{\"tasks\": [{\"id\": \"task-2\", \"description\": \"A\"},"
                + " {\"id\": \"task-2\", \"description\": \"B\"}]}", "did A", "did B");

        Job job = coordinator().run("s1", "Create both files");

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).containsExactly(Coordinator.ALL_TASKS_EXECUTED);
        List<ExecutionPlan> plans = events.events(AgentEventType.PLAN_UPDATE).stream()
                .map(event -> event.payloadAs(ExecutionPlan.class).orElseThrow()).toList();
        assertThat(plans.get(plans.size() - 1).tasks()).extracting(PlanTask::result).containsExactly("did A",
                "did B");
    }

    @Test
    @DisplayName("想定外の例外でもジョブを失敗として閉じる")
    void unexpectedErrorFailsJob() {
        provider.reply(PLAN, "README says hello");
        AgentObserver flaky = (channel, event) -> {
            if ("Starting Task: Write a summary".equals(event.message())) {
                throw new IllegalStateException("observer down");
            }
            events.emit(channel, event);
        };

        Job job = coordinator(AgentLoop.DEFAULT_MAX_STEPS, flaky).run("s1", "Create a summary file of the README");

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(jobStore.find(job.id())).map(Job::status).contains(JobStatus.FAILED);
        assertThat(events.messages(AgentEventType.ERROR)).containsExactly("Job aborted");
        assertThat(events.messages(AgentEventType.JOB_COMPLETED))
                .containsExactly(Coordinator.UNEXPECTED_ERROR + "observer down");
    }

    @Test
    @DisplayName("高速モードは分類と計画を省いて実行ループへ渡す")
    void fastMode() {
        provider.reply("Quick answer");

        Job job = coordinator().run("s1", "Create a file", true);

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(provider.requests()).hasSize(1);
        assertThat(events.messages(AgentEventType.THINKING)).containsExactly("Fast Mode: Executing directly...");
        assertThat(events.messages(AgentEventType.JOB_COMPLETED)).containsExactly("Quick answer");
        assertThat(events.events().get(0).payloadAs(Job.class)).map(Job::query).contains("Create a file");
    }

    @Test
    @DisplayName("ステップ上限に達しても失敗にはしない")
    void maxStepsIsNotFailure() {
        provider.otherwise(request -> "{\"tool\": \"missing\", \"args\": {}}");

        Job job = coordinator(1).run("s1", "Loop", true);

        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.steps()).hasSize(1);
        assertThat(events.messages(AgentEventType.JOB_COMPLETED))
                .containsExactly("Reached maximum of 1 steps without a final answer.");
    }

    @Test
    @DisplayName("計画には同じセッションの直近の会話を添える")
    void planningUsesSessionContext() {
        provider.reply("Hi!", PLAN, "one", "two");
        Coordinator coordinator = coordinator();

        coordinator.run("s1", "hello");
        coordinator.run("s1", "Create a summary file of the README");

        assertThat(provider.requests().get(1).preamble())
                .contains("Conversation so far:\nuser: hello\nassistant: Hi!\n");
        assertThat(events.channels()).containsExactly("session:s1");
        assertThat(jobStore.findBySession("s1")).extracting(Job::status).containsOnly(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("ジョブ開始イベントには問い合わせ本文を載せる")
    void jobStartedCarriesQuery() {
        provider.reply("Sure.");

        coordinator().run("s1", "what is a monad?");

        AgentEvent started = events.events().get(0);
        assertThat(started.type()).isEqualTo(AgentEventType.JOB_STARTED);
        assertThat(started.message()).isEqualTo("what is a monad?");
    }
}
