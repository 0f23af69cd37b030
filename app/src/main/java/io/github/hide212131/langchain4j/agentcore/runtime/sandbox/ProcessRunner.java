package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

@SuppressWarnings("PMD.CloseResource")
final class ProcessRunner {

    private static final Logger LOGGER = Logger.getLogger(ProcessRunner.class.getName());
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private ProcessRunner() {
        throw new AssertionError("インスタンス化できません");
    }

    static SandboxResult run(List<String> command, Path workingDir, Map<String, String> environment,
            Duration hardTimeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(hardTimeout, "hardTimeout");
        String logicalCommand = String.join(" ", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        if (environment != null) {
            builder.environment().putAll(environment);
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new IllegalStateException("コマンドの起動に失敗しました: " + logicalCommand, ex);
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> stdoutFuture = executor.submit(() -> readStream(process.getInputStream()));
            Future<String> stderrFuture = executor.submit(() -> readStream(process.getErrorStream()));
            boolean finished = waitForProcess(process, hardTimeout, logicalCommand);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                LOGGER.warning("ホスト側のタイムアウトでプロセスを停止しました: " + logicalCommand);
                return SandboxResult.timeout(partialOutput(stdoutFuture));
            }
            String stdout = getFuture(stdoutFuture, logicalCommand);
            String stderr = getFuture(stderrFuture, logicalCommand);
            return SandboxResult.fromExit(process.exitValue(), stdout, stderr);
        } finally {
            shutdownExecutor(executor);
        }
    }

    /** コマンドが起動でき、終了コード 0 で終わるかを確認する。 */
    static boolean probe(CommandRunner runner, List<String> command) {
        try {
            return runner.run(command, null, Map.of(), PROBE_TIMEOUT).success();
        } catch (IllegalStateException ex) {
            LOGGER.log(Level.FINE, "コマンドが利用できません: " + String.join(" ", command), ex);
            return false;
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static boolean waitForProcess(Process process, Duration timeout, String logicalCommand) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("コマンドの実行が中断されました: " + logicalCommand, ex);
        }
    }

    private static String getFuture(Future<String> future, String logicalCommand) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("コマンドの出力取得が中断されました: " + logicalCommand, ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("コマンドの出力取得に失敗しました: " + logicalCommand, ex);
        }
    }

    private static String partialOutput(Future<String> future) {
        try {
            return future.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException ex) {
            LOGGER.log(Level.FINE, "タイムアウト後の出力を回収できませんでした", ex);
            future.cancel(true);
            return "";
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
