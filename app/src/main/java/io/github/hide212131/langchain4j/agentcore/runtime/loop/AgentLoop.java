package io.github.hide212131.langchain4j.agentcore.runtime.loop;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.job.InMemoryJobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Job;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStatus;
import io.github.hide212131.langchain4j.agentcore.runtime.job.JobStore;
import io.github.hide212131.langchain4j.agentcore.runtime.job.Step;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionBroker;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.ChatTurn;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionException;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxUnavailableException;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolCall;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolCallExtractor;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolException;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolRegistry;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolResultCache;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEvent;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ツール呼び出しを繰り返して 1 つの依頼を片付ける実行ループ。
 *
 * <p>
 * 各周回でモデルに問い合わせ、応答にツール呼び出しがあれば 1 件だけ実行し、その結果を次の入力にする。
 * ツール呼び出しのない応答が来たら最終応答として終了する。ツール内の失敗は結果テキストとしてモデルへ返すが、
 * 承認拒否・サンドボックス不可・LLM 障害はループを打ち切り、ジョブを失敗にする。
 */
@SuppressWarnings({ "PMD.CouplingBetweenObjects", "PMD.ExcessiveImports" })
public final class AgentLoop {

    public static final int DEFAULT_MAX_STEPS = 10;
    public static final int DEFAULT_MAX_MESSAGES = 100;
    public static final int DEFAULT_MAX_TOKENS = 32_000;
    public static final int DEFAULT_MAX_TOOL_RESULT_CHARS = 8_000;
    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant that completes the user's request"
            + " step by step using the available tools.";
    static final String TOOL_INSTRUCTIONS = """
            To call a tool, reply with ONLY a JSON object of the form {"tool": "<name>", "args": {...}}.
            Call one tool at a time and wait for its result.
            When the request is complete, reply with the final answer as plain text without any tool JSON.""";

    private static final VisibilityLog LOG = VisibilityLog.forClass(AgentLoop.class);

    private final CompletionProvider provider;
    private final ToolRegistry tools;
    private final PermissionBroker broker;
    private final AgentObserver observer;
    private final JobStore jobStore;
    private final Path workspace;
    private final String systemPrompt;
    private final int maxSteps;
    private final int maxMessages;
    private final int maxTokens;
    private final int maxToolResultChars;
    private final ToolResultCache cache;

    private AgentLoop(Builder builder) {
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.tools = Objects.requireNonNull(builder.tools, "tools");
        this.broker = Objects.requireNonNull(builder.broker, "broker");
        this.observer = Objects.requireNonNull(builder.observer, "observer");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace");
        this.systemPrompt = builder.systemPrompt == null || builder.systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT
                : builder.systemPrompt;
        this.maxSteps = positive(builder.maxSteps, "maxSteps");
        this.maxMessages = positive(builder.maxMessages, "maxMessages");
        this.maxTokens = positive(builder.maxTokens, "maxTokens");
        this.maxToolResultChars = positive(builder.maxToolResultChars, "maxToolResultChars");
        this.cache = builder.cache;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int positive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " は正の値を指定してください: " + value);
        }
        return value;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /** モデルへ渡す前置き。システムプロンプトにツール一覧と呼び出し形式を添える。 */
    String preamble() {
        if (tools.isEmpty()) {
            return systemPrompt;
        }
        return systemPrompt + "\n\nYou can use the following tools:\n" + tools.describe() + "\n\n" + TOOL_INSTRUCTIONS;
    }

    /**
     * 依頼を処理する。会話履歴はジョブのセッション単位で {@link JobStore} から読み込み、追記していく。
     */
    public LoopResult run(Job job, String userMessage) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(userMessage, "userMessage");
        String sessionId = job.sessionId();
        String channel = AgentObserver.channelFor(sessionId);
        ConversationHistory history = new ConversationHistory(maxMessages, maxTokens);
        history.addAll(jobStore.messages(sessionId));

        Job current = job;
        ChatTurn pending = ChatTurn.user(userMessage);
        for (int step = 1; step <= maxSteps; step++) {
            String reply;
            try {
                reply = complete(channel, history, pending);
            } catch (CompletionException ex) {
                LOG.error(sessionId, job.id(), "loop", "step-" + step, "LLM 呼び出しに失敗しました", pending.content(), ex);
                observer.emit(channel, AgentEvent.error("LLM call failed", ex.getMessage()));
                return fail(current, ex.getMessage(), step - 1);
            }
            remember(sessionId, history, pending);
            remember(sessionId, history, ChatTurn.assistant(reply));

            Optional<ToolCall> call = ToolCallExtractor.extractFirst(reply);
            if (call.isEmpty()) {
                observer.emit(channel, AgentEvent.token(reply));
                LOG.info(sessionId, job.id(), "loop", "step-" + step, "最終応答を受け取りました", userMessage, reply);
                return new LoopResult(LoopOutcome.COMPLETED, reply, current, step - 1);
            }

            StepOutcome outcome = executeStep(current, channel, call.get());
            current = outcome.job();
            jobStore.save(current);
            if (outcome.fatal()) {
                observer.emit(channel, AgentEvent.error("Step aborted", outcome.result()));
                return fail(current, outcome.result(), step);
            }
            String forHistory = HistoryTruncator.smartTruncate(outcome.result(), maxToolResultChars);
            pending = ChatTurn.tool("Tool '" + call.get().toolName() + "' result:\n" + forHistory);
        }
        String message = "Reached maximum of " + maxSteps + " steps without a final answer.";
        LOG.warn(sessionId, job.id(), "loop", "max-steps", message, userMessage, null);
        observer.emit(channel, AgentEvent.token(message));
        return new LoopResult(LoopOutcome.MAX_STEPS, message, current, maxSteps);
    }

    private String complete(String channel, ConversationHistory history, ChatTurn pending) {
        CompletionRequest request = new CompletionRequest(preamble(), history.turns(), pending.content());
        ThinkTagProcessor processor = new ThinkTagProcessor();
        StringBuilder visible = new StringBuilder();
        provider.stream(request, token -> route(channel, processor.process(token), visible));
        route(channel, processor.flush(), visible);
        return visible.toString().trim();
    }

    private void route(String channel, List<ThinkTagProcessor.Chunk> chunks, StringBuilder visible) {
        for (ThinkTagProcessor.Chunk chunk : chunks) {
            if (chunk.kind() == ThinkTagProcessor.Kind.THINKING) {
                observer.emit(channel, AgentEvent.thinking(chunk.text()));
            } else {
                visible.append(chunk.text());
            }
        }
    }

    private void remember(String sessionId, ConversationHistory history, ChatTurn turn) {
        history.add(turn);
        jobStore.appendMessage(sessionId, turn);
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private StepOutcome executeStep(Job job, String channel, ToolCall call) {
        Optional<Tool> found = tools.find(call.toolName());
        Step step = Step.executing(call.toolName(), call.args(), found.map(Tool::requiresApproval).orElse(false));
        Job current = job.appendStep(step);
        jobStore.save(current);
        observer.emit(channel, AgentEvent.stepStarted(current, step));

        if (found.isEmpty()) {
            String message = "Unknown tool: " + call.toolName() + ". Available tools: "
                    + String.join(", ", tools.names());
            return finish(current, channel, step.failed(message), false);
        }
        Tool tool = found.get();
        ToolContext context = new ToolContext(job.sessionId(), job.id(), workspace, broker);
        try {
            String result = runTool(tool, call, context);
            LOG.info(job.sessionId(), job.id(), "tool", tool.name(), "ツールを実行しました", call.argsJson(),
                    result);
            return finish(current, channel, step.completed(result), false);
        } catch (SandboxUnavailableException ex) {
            LOG.error(job.sessionId(), job.id(), "tool", tool.name(), "サンドボックスを利用できません", call.argsJson(), ex);
            return finish(current, channel, step.failed(ex.getMessage()), true);
        } catch (ToolException ex) {
            if (ex.fatal()) {
                LOG.warn(job.sessionId(), job.id(), "tool", tool.name(), "操作が拒否されました", call.argsJson(), ex);
                return finish(current, channel, step.failed(ex.getMessage()), true);
            }
            LOG.warn(job.sessionId(), job.id(), "tool", tool.name(), "ツールが失敗しました", call.argsJson(), ex);
            return finish(current, channel, step.failed("Error: " + ex.getMessage()), false);
        } catch (RuntimeException ex) {
            LOG.warn(job.sessionId(), job.id(), "tool", tool.name(), "ツールが予期せず失敗しました", call.argsJson(), ex);
            return finish(current, channel, step.failed("Error: " + ex.getMessage()), false);
        }
    }

    private String runTool(Tool tool, ToolCall call, ToolContext context) {
        if (cache == null) {
            return tool.execute(call.args(), context);
        }
        String scope = ToolResultCache.scope(context.sessionId(), context.workspace());
        if (!tool.cacheable()) {
            // 状態を変えうるツールの後では、失敗した場合も含めて以前の結果を信用しない
            try {
                return tool.execute(call.args(), context);
            } finally {
                cache.invalidate(scope);
            }
        }
        Optional<PermissionRequest> permission = tool.permissionRequest(call.args());
        if (permission.isEmpty() && tool.requiresApproval()) {
            return tool.execute(call.args(), context);
        }
        Optional<String> cached = cache.get(scope, tool.name(), call.args());
        if (cached.isPresent()) {
            permission.ifPresent(context::requirePermission);
            LOG.debug(context.sessionId(), context.jobId(), "tool", tool.name(), "キャッシュ済みの結果を使います");
            return cached.get();
        }
        String result = tool.execute(call.args(), context);
        cache.put(scope, tool.name(), call.args(), result);
        return result;
    }

    private StepOutcome finish(Job job, String channel, Step finished, boolean fatal) {
        Job updated = job.updateStep(finished);
        observer.emit(channel, AgentEvent.stepCompleted(updated, finished));
        return new StepOutcome(updated, finished.result(), fatal);
    }

    private LoopResult fail(Job job, String message, int steps) {
        Job failed = job.withStatus(JobStatus.FAILED);
        jobStore.save(failed);
        return new LoopResult(LoopOutcome.FAILED, message, failed, steps);
    }

    private record StepOutcome(Job job, String result, boolean fatal) {
    }

    public static final class Builder {
        private CompletionProvider provider;
        private ToolRegistry tools = new ToolRegistry();
        private PermissionBroker broker = PermissionBroker.denyAll();
        private AgentObserver observer = AgentObserver.noop();
        private JobStore jobStore = new InMemoryJobStore();
        private Path workspace;
        private String systemPrompt;
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int maxMessages = DEFAULT_MAX_MESSAGES;
        private int maxTokens = DEFAULT_MAX_TOKENS;
        private int maxToolResultChars = DEFAULT_MAX_TOOL_RESULT_CHARS;
        private ToolResultCache cache;

        private Builder() {
        }

        public Builder provider(CompletionProvider value) {
            this.provider = value;
            return this;
        }

        public Builder tools(ToolRegistry value) {
            this.tools = value;
            return this;
        }

        public Builder broker(PermissionBroker value) {
            this.broker = value;
            return this;
        }

        public Builder observer(AgentObserver value) {
            this.observer = value;
            return this;
        }

        public Builder jobStore(JobStore value) {
            this.jobStore = value;
            return this;
        }

        public Builder workspace(Path value) {
            this.workspace = value;
            return this;
        }

        public Builder systemPrompt(String value) {
            this.systemPrompt = value;
            return this;
        }

        public Builder maxSteps(int value) {
            this.maxSteps = value;
            return this;
        }

        public Builder maxMessages(int value) {
            this.maxMessages = value;
            return this;
        }

        public Builder maxTokens(int value) {
            this.maxTokens = value;
            return this;
        }

        public Builder maxToolResultChars(int value) {
            this.maxToolResultChars = value;
            return this;
        }

        /** null の場合はキャッシュしない。 */
        public Builder cache(ToolResultCache value) {
            this.cache = value;
            return this;
        }

        public AgentLoop build() {
            return new AgentLoop(this);
        }
    }
}
