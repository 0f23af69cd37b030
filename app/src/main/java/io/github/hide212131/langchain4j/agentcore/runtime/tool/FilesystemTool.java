package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionType;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.ScopeEnforcer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * ワークスペース内のファイル操作。パスはワークスペース相対に限る。
 */
@SuppressWarnings("PMD.CyclomaticComplexity")
public final class FilesystemTool implements Tool {

    public static final String NAME = "filesystem";

    /** 対応する操作。 */
    enum Operation {
        READ_FILE, WRITE_FILE, LIST_DIR, MAKE_DIR, DELETE_FILE;

        String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        boolean readOnly() {
            return this == READ_FILE || this == LIST_DIR;
        }

        static Operation from(String value) {
            for (Operation operation : values()) {
                if (operation.value().equals(value)) {
                    return operation;
                }
            }
            throw ToolException.invalidArgument("operation", "unknown operation " + value);
        }
    }

    private final ScopeEnforcer.Scope scope;

    public FilesystemTool() {
        this(ScopeEnforcer.Scope.WORKSPACE);
    }

    public FilesystemTool(ScopeEnforcer.Scope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Read, write, list files and directories. Path must be relative to workspace root.";
    }

    @Override
    public JsonNode parametersSchema() {
        ObjectNode schema = ToolJson.objectSchema();
        ObjectNode operation = ToolJson.property(schema, "operation", "string", "Operation to perform", true);
        ArrayNode values = operation.putArray("enum");
        for (Operation op : Operation.values()) {
            values.add(op.value());
        }
        ToolJson.property(schema, "path", "string", "Path relative to the workspace root", true);
        ToolJson.property(schema, "content", "string", "Content for write_file", false);
        return schema;
    }

    @Override
    public boolean needsSummarization(JsonNode args, String result) {
        JsonNode operation = args == null ? null : args.get("operation");
        return operation != null && Operation.READ_FILE.value().equals(operation.asText());
    }

    @Override
    public String execute(JsonNode args, ToolContext context) {
        Operation operation = Operation.from(ToolArguments.requireText(args, "operation"));
        String path = ToolArguments.requireRelativePath(ToolArguments.requireText(args, "path"));
        Path target = context.workspace().resolve(path);
        // シンボリックリンク経由でワークスペース外を指していないか
        if (scope == ScopeEnforcer.Scope.WORKSPACE && Files.isDirectory(context.workspace())
                && !ScopeEnforcer.workspace(context.workspace()).isPathAllowed(target)) {
            throw ToolException.validationFailed("Path '" + path + "' resolves outside the workspace");
        }
        // 書き込み内容は承認前に検証しておく
        String content = operation == Operation.WRITE_FILE ? ToolArguments.requireText(args, "content") : null;

        PermissionType type = operation.readOnly() ? PermissionType.FILESYSTEM_READ : PermissionType.FILESYSTEM_WRITE;
        String verb = operation.readOnly() ? "read" : "modify";
        String noun = operation == Operation.LIST_DIR ? "directory" : "file";
        context.requirePermission(PermissionRequest.create(type, "Agent wants to " + verb + " " + noun + " at " + path)
                .withResource(path).withMetadata("operation", operation.value()));

        try {
            return switch (operation) {
            case READ_FILE -> Files.readString(target, StandardCharsets.UTF_8);
            case WRITE_FILE -> {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, content, StandardCharsets.UTF_8);
                yield "File written successfully";
            }
            case LIST_DIR -> listDirectory(target);
            case MAKE_DIR -> {
                Files.createDirectories(target);
                yield "Directory created";
            }
            case DELETE_FILE -> {
                Files.delete(target);
                yield "File deleted";
            }
            };
        } catch (IOException ex) {
            throw ToolException.executionFailed(ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    private static String listDirectory(Path directory) throws IOException {
        List<Path> children = new ArrayList<>();
        try (Stream<Path> stream = Files.list(directory)) {
            stream.sorted().forEach(children::add);
        }
        ArrayNode items = ToolJson.MAPPER.createArrayNode();
        for (Path child : children) {
            ObjectNode item = items.addObject();
            item.put("name", child.getFileName().toString());
            item.put("type", Files.isDirectory(child) ? "directory" : "file");
        }
        return ToolJson.write(items);
    }
}
