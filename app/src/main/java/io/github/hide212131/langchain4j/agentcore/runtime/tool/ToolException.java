package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import java.util.Objects;

/**
 * ツール実行の失敗。{@link Kind} ごとにモデルへ返すメッセージの書式が決まっている。
 */
public final class ToolException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** 失敗の分類。 */
    public enum Kind {
        MISSING_ARGUMENT, INVALID_ARGUMENT, PERMISSION_DENIED, EXECUTION_FAILED, VALIDATION_FAILED, OTHER
    }

    private final Kind kind;

    private ToolException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ToolException missingArgument(String name) {
        return new ToolException(Kind.MISSING_ARGUMENT, "Missing required argument: " + name, null);
    }

    public static ToolException invalidArgument(String name, String reason) {
        return new ToolException(Kind.INVALID_ARGUMENT, "Invalid argument '" + name + "': " + reason, null);
    }

    public static ToolException permissionDenied(String reason) {
        return new ToolException(Kind.PERMISSION_DENIED, "Permission denied: " + reason, null);
    }

    public static ToolException executionFailed(String reason) {
        return new ToolException(Kind.EXECUTION_FAILED, "Execution failed: " + reason, null);
    }

    public static ToolException executionFailed(String reason, Throwable cause) {
        return new ToolException(Kind.EXECUTION_FAILED, "Execution failed: " + reason, cause);
    }

    public static ToolException validationFailed(String reason) {
        return new ToolException(Kind.VALIDATION_FAILED, "Validation failed: " + reason, null);
    }

    public static ToolException other(String message) {
        return new ToolException(Kind.OTHER, message, null);
    }

    public static ToolException other(String message, Throwable cause) {
        return new ToolException(Kind.OTHER, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    /** ループを打ち切るべき失敗かどうか。 */
    public boolean fatal() {
        return kind == Kind.PERMISSION_DENIED;
    }
}
