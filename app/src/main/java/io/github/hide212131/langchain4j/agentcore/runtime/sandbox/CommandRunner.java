package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 外部プロセスを起動して結果を返す。テストではプロセスを起動しない実装に差し替える。
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command     実行する引数列
     * @param workingDir  作業ディレクトリ。null の場合は現在のディレクトリ
     * @param environment 追加する環境変数
     * @param hardTimeout ホスト側で強制終了するまでの時間
     */
    SandboxResult run(List<String> command, Path workingDir, Map<String, String> environment, Duration hardTimeout);

    static CommandRunner processes() {
        return ProcessRunner::run;
    }
}
