package io.github.hide212131.langchain4j.agentcore.runtime.sandbox;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** 受け取ったコマンドを記録し、決まった結果を返すテスト用バックエンド。 */
public final class RecordingSandbox implements SandboxBackend {

    private final String name;
    private final boolean available;
    private final Function<String, SandboxResult> responder;
    private final List<Invocation> invocations = new ArrayList<>();

    public RecordingSandbox(String name, boolean available, Function<String, SandboxResult> responder) {
        this.name = name;
        this.available = available;
        this.responder = responder;
    }

    public static RecordingSandbox returning(SandboxResult result) {
        return new RecordingSandbox("recording", true, command -> result);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public SandboxResult executeWithFiles(String command, Path workspaceDir, Path extraFilesDir,
            SandboxConfig config) {
        invocations.add(new Invocation(command, workspaceDir, extraFilesDir, config));
        return responder.apply(command);
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public Invocation last() {
        return invocations.get(invocations.size() - 1);
    }

    /** 1 回分の呼び出し内容。 */
    public record Invocation(String command, Path workspaceDir, Path extraFilesDir, SandboxConfig config) {
    }
}
