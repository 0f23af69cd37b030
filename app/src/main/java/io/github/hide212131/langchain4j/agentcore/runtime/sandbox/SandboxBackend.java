package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.nio.file.Path;

/**
 * ワークスペースに対してシェルコマンドを実行するバックエンド。
 */
public interface SandboxBackend {

    /** ログ出力用の名前。 */
    String name();

    boolean isAvailable();

    default SandboxResult execute(String command, Path workspaceDir, SandboxConfig config) {
        return executeWithFiles(command, workspaceDir, null, config);
    }

    /**
     * 読み取り専用のファイル束を添えて実行する。
     *
     * @param extraFilesDir 追加ファイルのディレクトリ。不要な場合は null
     * @throws SandboxUnavailableException バックエンドが利用できない場合
     */
    SandboxResult executeWithFiles(String command, Path workspaceDir, Path extraFilesDir, SandboxConfig config);
}
