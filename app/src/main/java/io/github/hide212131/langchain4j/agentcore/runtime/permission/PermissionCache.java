package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** 「常に許可」とされた操作をキー単位で覚えておく。 */
public final class PermissionCache {

    private final Map<String, Boolean> approved = new ConcurrentHashMap<>();

    public boolean isApproved(PermissionRequest request) {
        return approved.containsKey(request.cacheKey());
    }

    public void remember(PermissionRequest request) {
        approved.put(request.cacheKey(), Boolean.TRUE);
    }

    public void preApprove(String cacheKey) {
        approved.put(Objects.requireNonNull(cacheKey, "cacheKey"), Boolean.TRUE);
    }

    public void clear() {
        approved.clear();
    }

    public void clearSession(String sessionId) {
        String prefix = sessionId + ":";
        approved.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public int size() {
        return approved.size();
    }
}
