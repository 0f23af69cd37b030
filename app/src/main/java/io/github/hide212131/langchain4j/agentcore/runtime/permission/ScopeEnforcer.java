package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ワークスペース外へのアクセスを防ぐ。GLOBAL はすべて許可する。
 */
public final class ScopeEnforcer {

    private static final List<String> DANGEROUS_PATTERNS = List.of("cd /", "cd ~", "cd ..", "rm -rf /", "rm -rf ~",
            "> /", ">> /");

    private final Scope scope;
    private final Path workspace;

    private ScopeEnforcer(Scope scope, Path workspace) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.workspace = workspace;
    }

    public static ScopeEnforcer global() {
        return new ScopeEnforcer(Scope.GLOBAL, null);
    }

    public static ScopeEnforcer workspace(Path workspace) {
        return new ScopeEnforcer(Scope.WORKSPACE, Objects.requireNonNull(workspace, "workspace"));
    }

    public Scope scope() {
        return scope;
    }

    public boolean isPathAllowed(Path path) {
        Objects.requireNonNull(path, "path");
        if (scope == Scope.GLOBAL) {
            return true;
        }
        Path root;
        try {
            root = workspace.toRealPath();
        } catch (IOException ex) {
            return false;
        }
        Path absolute = path.isAbsolute() ? path : root.resolve(path);
        return resolveExisting(absolute.normalize()).startsWith(root);
    }

    /**
     * コマンドがワークスペースを抜け出しそうな場合に IllegalArgumentException を投げる。
     */
    public void validateCommand(String command) {
        Objects.requireNonNull(command, "command");
        if (scope == Scope.GLOBAL) {
            return;
        }
        for (String pattern : DANGEROUS_PATTERNS) {
            if (command.contains(pattern)) {
                throw new IllegalArgumentException(
                        "Command contains potentially dangerous pattern '" + pattern + "' that may escape workspace");
            }
        }
        for (String part : command.trim().split("\\s+")) {
            if (part.startsWith("/") && !isPathAllowed(Path.of(part))) {
                throw new IllegalArgumentException(
                        "Command references path '" + part + "' outside workspace '" + workspace + "'");
            }
        }
    }

    /** まだ存在しないパスは、存在する最も近い親を実体化して残りを繋ぎ直す。 */
    private static Path resolveExisting(Path path) {
        Path current = path;
        Path remainder = null;
        while (current != null) {
            try {
                Path real = current.toRealPath();
                return remainder == null ? real : real.resolve(remainder);
            } catch (IOException ex) {
                Path name = current.getFileName();
                if (name != null) {
                    remainder = remainder == null ? name : name.resolve(remainder);
                }
                current = current.getParent();
            }
        }
        return path;
    }

    /** アクセス範囲。 */
    public enum Scope {
        GLOBAL, WORKSPACE;

        public static Scope from(String value) {
            if (value != null && "workspace".equals(value.trim().toLowerCase(Locale.ROOT))) {
                return WORKSPACE;
            }
            return GLOBAL;
        }
    }
}
