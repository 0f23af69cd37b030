package io.github.hide212131.langchain4j.agentcore.runtime.permission;

/** 権限要求への応答。ALLOW_ALWAYS はセッション内で記憶される。 */
public enum PermissionResponse {
    ALLOW, DENY, ALLOW_ALWAYS;

    public boolean allowed() {
        return this != DENY;
    }

    public boolean shouldCache() {
        return this == ALLOW_ALWAYS;
    }

    public static PermissionResponse of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }
}
