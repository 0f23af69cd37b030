package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * ホスト上のシェルでそのままコマンドを実行する。隔離は行わず、時間制限だけを掛ける。
 */
public final class DirectSandbox implements SandboxBackend {

    static final String SKILL_FILES_ENV = "SKILL_FILES_PATH";
    private static final Logger LOGGER = Logger.getLogger(DirectSandbox.class.getName());
    private static final Duration HOST_GRACE = Duration.ofSeconds(10);

    private final CommandRunner runner;

    public DirectSandbox() {
        this(CommandRunner.processes());
    }

    public DirectSandbox(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public boolean isAvailable() {
        return ProcessRunner.probe(runner, List.of("bash", "--version"));
    }

    @Override
    public SandboxResult executeWithFiles(String command, Path workspaceDir, Path extraFilesDir,
            SandboxConfig config) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command は空にできません");
        }
        Objects.requireNonNull(workspaceDir, "workspaceDir");
        SandboxConfig effective = SandboxConfig.orDefaults(config);
        Path workspace = prepareWorkspace(workspaceDir);
        Map<String, String> environment = new HashMap<>();
        if (extraFilesDir != null) {
            environment.put(SKILL_FILES_ENV, extraFilesDir.toAbsolutePath().normalize().toString());
        }
        List<String> invocation = buildCommand(command, effective);
        LOGGER.fine(() -> "direct: " + command + " (cwd=" + workspace + ", timeout=" + effective.timeoutSeconds()
                + "s)");
        Duration hardTimeout = Duration.ofSeconds(effective.timeoutSeconds()).plus(HOST_GRACE);
        return runner.run(invocation, workspace, Map.copyOf(environment), hardTimeout);
    }

    static List<String> buildCommand(String command, SandboxConfig config) {
        return List.of("bash", "-c", "timeout " + config.timeoutSeconds() + " " + command);
    }

    private static Path prepareWorkspace(Path workspaceDir) {
        Path workspace = workspaceDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspace);
        } catch (IOException ex) {
            throw new IllegalStateException("ワークスペースを作成できません: " + workspace, ex);
        }
        return workspace;
    }
}
