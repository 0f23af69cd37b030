package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 使い捨ての Docker コンテナでコマンドを実行する。ルートは読み取り専用、ネットワークは既定で遮断。
 */
public final class DockerSandbox implements SandboxBackend {

    public static final String WORKSPACE_MOUNT = "/workspace";
    public static final String SKILL_MOUNT = "/skill";
    static final String TMPFS = "--tmpfs=/tmp:size=64m";

    private static final Logger LOGGER = Logger.getLogger(DockerSandbox.class.getName());
    private static final Duration HOST_GRACE = Duration.ofSeconds(10);

    private final String dockerBinary;
    private final CommandRunner runner;
    private volatile Boolean available;

    public DockerSandbox() {
        this("docker", CommandRunner.processes());
    }

    public DockerSandbox(String dockerBinary, CommandRunner runner) {
        this.dockerBinary = Objects.requireNonNull(dockerBinary, "dockerBinary");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name() {
        return "docker";
    }

    /** 初回に {@code docker --version} を確認し、結果を保持する。 */
    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached == null) {
            cached = ProcessRunner.probe(runner, List.of(dockerBinary, "--version"));
            available = cached;
            LOGGER.fine("docker available=" + cached);
        }
        return cached;
    }

    @Override
    public SandboxResult executeWithFiles(String command, Path workspaceDir, Path extraFilesDir,
            SandboxConfig config) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command は空にできません");
        }
        Objects.requireNonNull(workspaceDir, "workspaceDir");
        if (!isAvailable()) {
            throw new SandboxUnavailableException("Docker is not available");
        }
        SandboxConfig effective = SandboxConfig.orDefaults(config);
        Path workspace = canonicalWorkspace(workspaceDir);
        Path extra = extraFilesDir == null ? null : canonical(extraFilesDir);
        List<String> invocation = buildCommand(dockerBinary, command, workspace, extra, effective);
        LOGGER.fine(() -> "docker: " + String.join(" ", invocation));
        Duration hardTimeout = Duration.ofSeconds(effective.timeoutSeconds()).plus(HOST_GRACE);
        return runner.run(invocation, null, Map.of(), hardTimeout);
    }

    /**
     * docker run の引数列を組み立てる。
     */
    static List<String> buildCommand(String dockerBinary, String command, Path workspace, Path extraFiles,
            SandboxConfig config) {
        List<String> args = new ArrayList<>();
        args.add(dockerBinary);
        args.add("run");
        args.add("--rm");
        args.add("--memory=" + config.memoryLimit());
        args.add("--cpus=" + config.cpuLimitText());
        if (!config.networkEnabled()) {
            args.add("--network=none");
        }
        args.add("--read-only");
        args.add(TMPFS);
        args.add("-v");
        args.add(workspace + ":" + WORKSPACE_MOUNT + ":rw");
        if (extraFiles != null) {
            args.add("-v");
            args.add(extraFiles + ":" + SKILL_MOUNT + ":ro");
        }
        args.add("-w");
        args.add(WORKSPACE_MOUNT);
        args.add(DockerImage.resolve(config.image()));
        args.add("/bin/sh");
        args.add("-c");
        args.add("timeout " + config.timeoutSeconds() + " " + command);
        return List.copyOf(args);
    }

    private static Path canonicalWorkspace(Path workspaceDir) {
        Path workspace = workspaceDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspace);
        } catch (IOException ex) {
            throw new IllegalStateException("ワークスペースを作成できません: " + workspace, ex);
        }
        return canonical(workspace);
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            throw new IllegalStateException("パスを解決できません: " + path, ex);
        }
    }
}
