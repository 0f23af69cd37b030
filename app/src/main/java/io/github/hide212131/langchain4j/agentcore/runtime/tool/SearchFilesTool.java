package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionType;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxBackend;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxConfig;
import io.github.hide212131.langchain4j.agentcore.runtime.sandbox.SandboxResult;
import java.util.Objects;
import java.util.Optional;

/**
 * grep によるワークスペース内の再帰検索。
 */
public final class SearchFilesTool implements Tool {

    public static final String NAME = "search_files";
    static final String NO_MATCHES = "No matches found.";
    static final long TIMEOUT_SECONDS = 60;

    private final SandboxBackend sandbox;
    private final SandboxConfig config;

    public SearchFilesTool(SandboxBackend sandbox) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.config = SandboxConfig.builder().timeoutSeconds(TIMEOUT_SECONDS).build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search for text in files recursively. Returns matching lines with file names and line numbers.";
    }

    @Override
    public JsonNode parametersSchema() {
        ObjectNode schema = ToolJson.objectSchema();
        ToolJson.property(schema, "query", "string", "Text or pattern to search for", true);
        ToolJson.property(schema, "path", "string", "Directory relative to the workspace (default: .)", false);
        return schema;
    }

    @Override
    public boolean cacheable() {
        return true;
    }

    @Override
    public String execute(JsonNode args, ToolContext context) {
        String query = ToolArguments.requireText(args, "query");
        String path = searchPath(args);
        context.requirePermission(readRequest(path));

        SandboxResult result = sandbox.execute(command(query, path), context.workspace(), config);
        if (!result.success()) {
            if (result.exitCode() == 1 && result.stderr().isEmpty()) {
                return NO_MATCHES;
            }
            throw ToolException.executionFailed("grep failed: " + result.stderr());
        }
        return result.stdout().isEmpty() ? NO_MATCHES : result.stdout();
    }

    @Override
    public Optional<PermissionRequest> permissionRequest(JsonNode args) {
        return Optional.of(readRequest(searchPath(args)));
    }

    private static String searchPath(JsonNode args) {
        return ToolArguments.requireRelativePath(ToolArguments.optionalText(args, "path", "."));
    }

    private static PermissionRequest readRequest(String path) {
        return PermissionRequest.create(PermissionType.FILESYSTEM_READ, "Agent wants to search files in " + path)
                .withResource(path).withMetadata("operation", "search");
    }

    static String command(String query, String path) {
        return "grep -r -n -e " + shellQuote(query) + " -- " + shellQuote(path);
    }

    private static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
