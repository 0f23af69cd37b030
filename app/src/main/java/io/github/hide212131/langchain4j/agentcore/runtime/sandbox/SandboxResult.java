package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

/**
 * サンドボックスでのコマンド実行結果。タイムアウトは終了コード 124 で表す。
 */
public record SandboxResult(boolean success, String stdout, String stderr, int exitCode, boolean timedOut) {

    public static final int TIMEOUT_EXIT_CODE = 124;

    public SandboxResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static SandboxResult fromExit(int exitCode, String stdout, String stderr) {
        return new SandboxResult(exitCode == 0, stdout, stderr, exitCode, exitCode == TIMEOUT_EXIT_CODE);
    }

    public static SandboxResult timeout() {
        return timeout("");
    }

    public static SandboxResult timeout(String partialStdout) {
        return new SandboxResult(false, partialStdout, "Command timed out", TIMEOUT_EXIT_CODE, true);
    }

    /** stdout と stderr をまとめた表示用テキスト。 */
    public String combinedOutput() {
        if (stderr.isBlank()) {
            return stdout;
        }
        if (stdout.isBlank()) {
            return stderr;
        }
        return stdout + System.lineSeparator() + stderr;
    }
}
