package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/** 常に同じ判断を即時に返す。 */
final class FixedPermissionBroker implements PermissionBroker {

    static final FixedPermissionBroker ALLOW_ALL = new FixedPermissionBroker(true);
    static final FixedPermissionBroker DENY_ALL = new FixedPermissionBroker(false);

    private static final Logger LOGGER = Logger.getLogger(FixedPermissionBroker.class.getName());

    private final boolean decision;

    private FixedPermissionBroker(boolean decision) {
        this.decision = decision;
    }

    @Override
    public CompletableFuture<Boolean> request(PermissionRequest request) {
        LOGGER.fine(() -> (decision ? "auto-approved: " : "auto-denied: ") + request.permissionType().value() + " "
                + request.message());
        return CompletableFuture.completedFuture(decision);
    }

    @Override
    public boolean resolve(String requestId, boolean allowed) {
        return false;
    }

    @Override
    public List<String> listPending() {
        return List.of();
    }
}
