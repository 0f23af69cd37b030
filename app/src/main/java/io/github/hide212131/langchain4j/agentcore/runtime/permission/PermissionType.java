package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.Locale;

/** 承認が必要な操作の種別。 */
public enum PermissionType {
    FILESYSTEM_READ, FILESYSTEM_WRITE, SHELL_EXECUTE, NETWORK, UNKNOWN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
