package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.langchain4j.agentcore.runtime.ExecutionMode;
import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionType;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxBackend;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxConfig;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxResult;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.agentcore.runtime.tool.ToolException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 読み込み済みスキルをツールとして公開する。
 *
 * <p>
 * 引数 {@code args} が {@code read} の場合は本文を返すだけで何も実行しない。それ以外は同梱ファイルを一時ディレクトリへ
 * 展開し、{@link SkillExecutionResolver} の判定に従って隔離または直接のバックエンドでコマンドを実行する。
 */
public final class SkillTool implements Tool {

    static final String READ_ARGUMENT = "read";
    static final long DIRECT_TIMEOUT_SECONDS = 60;
    static final SandboxConfig ISOLATED_FALLBACK = SandboxConfig.builder().image("alpine:latest").memoryLimit("128m")
            .timeoutSeconds(60).build();

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final VisibilityLog LOG = VisibilityLog.forClass(SkillTool.class);

    private final LoadedSkill skill;
    private final ExecutionMode executionMode;
    private final SandboxBackend isolated;
    private final SandboxBackend direct;
    private final String description;

    public SkillTool(LoadedSkill skill, ExecutionMode executionMode, SandboxBackend isolated, SandboxBackend direct) {
        this.skill = Objects.requireNonNull(skill, "skill");
        this.executionMode = Objects.requireNonNull(executionMode, "executionMode");
        this.isolated = Objects.requireNonNull(isolated, "isolated");
        this.direct = Objects.requireNonNull(direct, "direct");
        this.description = enhance(skill.skill().description());
    }

    static String enhance(String description) {
        String trimmed = description;
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + ". IMPORTANT: Before using this skill, call it with args='read' to get detailed instructions"
                + " and code examples.";
    }

    @Override
    public String name() {
        return skill.name();
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public JsonNode parametersSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode args = schema.putObject("properties").putObject("args");
        args.put("type", "string");
        args.put("description", "Command to run with the skill files, or 'read' to get the skill instructions");
        schema.putArray("required").add("args");
        return schema;
    }

    @Override
    public boolean needsSummarization(JsonNode args, String result) {
        return isRead(args);
    }

    @Override
    public String execute(JsonNode args, ToolContext context) {
        JsonNode value = args == null ? null : args.get("args");
        if (value == null || value.isNull()) {
            throw ToolException.missingArgument("args");
        }
        String command = value.asText();
        if (isRead(args)) {
            ObjectNode output = MAPPER.createObjectNode();
            output.put("content", skill.skill().body());
            return output.toString();
        }
        if (command.isBlank()) {
            throw ToolException.invalidArgument("args", "command must not be blank");
        }

        SkillExecutionResolver.Decision decision = SkillExecutionResolver.resolve(executionMode, skill.skill(),
                isolated.isAvailable());
        context.requirePermission(PermissionRequest
                .create(PermissionType.SHELL_EXECUTE, "Agent wants to run skill " + name() + ": " + command)
                .withResource(command).withMetadata("skill", name()));

        Path staging = stage();
        try {
            return decision == SkillExecutionResolver.Decision.ISOLATED ? runIsolated(command, staging, context)
                    : runDirect(command, staging, context);
        } finally {
            deleteQuietly(staging);
        }
    }

    private String runIsolated(String command, Path staging, ToolContext context) {
        SandboxConfig config = skill.skill().sandboxConfigValue().map(SkillSandboxConfig::toSandboxConfig)
                .orElse(ISOLATED_FALLBACK);
        LOG.info(context.sessionId(), context.jobId(), "skill", name(), "隔離環境でスキルを実行します", command,
                config.toString());
        SandboxResult result = isolated.executeWithFiles(command, context.workspace(), staging, config);
        if (!result.success()) {
            throw ToolException
                    .executionFailed("Skill execution failed: " + result.stdout() + "\nStderr: " + result.stderr());
        }
        return output(result);
    }

    private String runDirect(String command, Path staging, ToolContext context) {
        SandboxConfig config = SandboxConfig.builder().timeoutSeconds(DIRECT_TIMEOUT_SECONDS).build();
        LOG.info(context.sessionId(), context.jobId(), "skill", name(), "ワークスペースでスキルを直接実行します", command,
                context.workspace().toString());
        SandboxResult result = direct.executeWithFiles(command, context.workspace(), staging, config);
        if (!result.success()) {
            throw ToolException
                    .executionFailed("Local execution failed: " + result.stdout() + "\nStderr: " + result.stderr());
        }
        return output(result);
    }

    private static String output(SandboxResult result) {
        ObjectNode output = MAPPER.createObjectNode();
        output.put("stdout", result.stdout());
        output.put("stderr", result.stderr());
        return output.toString();
    }

    private static boolean isRead(JsonNode args) {
        JsonNode value = args == null ? null : args.get("args");
        return value != null && value.isTextual() && READ_ARGUMENT.equalsIgnoreCase(value.asText().trim());
    }

    Path stage() {
        try {
            Path staging = Files.createTempDirectory("skill-" + name() + "-");
            for (Map.Entry<String, SkillFile> entry : skill.files().entrySet()) {
                Path target = staging.resolve(entry.getKey()).normalize();
                if (!target.startsWith(staging)) {
                    throw ToolException.executionFailed("Invalid skill file path: " + entry.getKey());
                }
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, entry.getValue().content(), StandardCharsets.UTF_8);
            }
            return staging;
        } catch (IOException ex) {
            throw ToolException.executionFailed("Failed to create temp dir for skill files: " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException ex) {
            LOG.debug("-", "-", "skill", directory.toString(), "一時ディレクトリを削除できませんでした: " + ex.getMessage());
        }
    }
}
