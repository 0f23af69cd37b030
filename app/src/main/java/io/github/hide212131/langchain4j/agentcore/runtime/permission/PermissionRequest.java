package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 特権操作の前にツールが発行する承認依頼。
 */
public record PermissionRequest(String id, PermissionType permissionType, String message,
        Map<String, String> metadata) {

    public static final String SESSION_ID = "session_id";
    public static final String RESOURCE = "resource";

    public PermissionRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(permissionType, "permissionType");
        message = message == null ? "" : message;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PermissionRequest create(PermissionType type, String message) {
        return new PermissionRequest(UUID.randomUUID().toString(), type, message, Map.of());
    }

    public PermissionRequest withMetadata(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<String, String> updated = new HashMap<>(metadata);
        updated.put(key, value);
        return new PermissionRequest(id, permissionType, message, updated);
    }

    public PermissionRequest withSessionId(String sessionId) {
        return withMetadata(SESSION_ID, sessionId);
    }

    public PermissionRequest withResource(String resource) {
        return withMetadata(RESOURCE, resource);
    }

    public Optional<String> sessionId() {
        return Optional.ofNullable(metadata.get(SESSION_ID));
    }

    /** {@code <session>:<type>:<resource>}。セッションがなければ先頭を省き、リソースがなければ global。 */
    public String cacheKey() {
        String sessionPart = sessionId().map(session -> session + ":").orElse("");
        String resource = metadata.getOrDefault(RESOURCE, "global");
        return sessionPart + permissionType.value() + ":" + resource;
    }
}
