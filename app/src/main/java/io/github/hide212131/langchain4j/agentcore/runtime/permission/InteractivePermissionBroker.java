package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentEvent;
import io.github.hide212131.langchain4j.agentcore.runtime.visibility.AgentObserver;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 人間などの外部判断を待つ権限ブローカー。依頼ごとに Future を 1 つ作り、{@link #resolve} で一度だけ完了させる。
 * 保留中の依頼はプロセス全体で共有する並行マップで管理する。
 */
public final class InteractivePermissionBroker implements PermissionBroker {

    private static final String PHASE = "permission";

    private final AgentObserver observer;
    private final PermissionCache cache;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final VisibilityLog log = VisibilityLog.forClass(InteractivePermissionBroker.class);

    /** 観測者なし。判断を仰ぐ先がないため、キャッシュにない依頼はすべて拒否する。 */
    public InteractivePermissionBroker() {
        this(null, new PermissionCache());
    }

    public InteractivePermissionBroker(AgentObserver observer) {
        this(Objects.requireNonNull(observer, "observer"), new PermissionCache());
    }

    InteractivePermissionBroker(AgentObserver observer, PermissionCache cache) {
        this.observer = observer;
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public CompletableFuture<Boolean> request(PermissionRequest request) {
        Objects.requireNonNull(request, "request");
        String session = request.sessionId().orElse(null);
        if (cache.isApproved(request)) {
            log.debug(session, null, PHASE, request.id(), "cached approval: " + request.cacheKey());
            return CompletableFuture.completedFuture(true);
        }
        if (observer == null) {
            log.warn(session, null, PHASE, request.id(), "no observer registered, denying", request.message(), null);
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<PermissionResponse> decision = new CompletableFuture<>();
        Pending previous = pending.putIfAbsent(request.id(), new Pending(request, decision));
        if (previous != null) {
            throw new IllegalArgumentException("同じ ID の依頼が保留中です: " + request.id());
        }
        log.info(session, null, PHASE, request.id(), "approval required", request.message(), null);
        observer.emit(channel(request), AgentEvent.approvalRequired(request));
        return decision.thenApply(response -> {
            if (response.shouldCache()) {
                cache.remember(request);
            }
            return response.allowed();
        });
    }

    @Override
    public boolean resolve(String requestId, boolean allowed) {
        return resolve(requestId, PermissionResponse.of(allowed));
    }

    /**
     * ALLOW_ALWAYS を含む応答で確定させる。
     *
     * @return 今回の呼び出しで確定した場合 true
     */
    public boolean resolve(String requestId, PermissionResponse response) {
        Objects.requireNonNull(response, "response");
        if (requestId == null) {
            return false;
        }
        Pending entry = pending.remove(requestId);
        if (entry == null) {
            log.debug(null, null, PHASE, requestId, "resolve ignored for unknown or settled request");
            return false;
        }
        PermissionRequest request = entry.request();
        log.info(request.sessionId().orElse(null), null, PHASE, requestId, "resolved: " + response, null, null);
        if (observer != null) {
            observer.emit(channel(request),
                    response.allowed() ? AgentEvent.stepApproved(request) : AgentEvent.stepRejected(request));
        }
        return entry.decision().complete(response);
    }

    public boolean approve(String requestId) {
        return resolve(requestId, PermissionResponse.ALLOW);
    }

    public boolean reject(String requestId) {
        return resolve(requestId, PermissionResponse.DENY);
    }

    @Override
    public List<String> listPending() {
        return List.copyOf(pending.keySet());
    }

    public List<PermissionRequest> pendingRequests() {
        return pending.values().stream().map(Pending::request).toList();
    }

    @Override
    public void cancelSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        for (Pending entry : List.copyOf(pending.values())) {
            if (entry.request().sessionId().filter(sessionId::equals).isPresent()) {
                resolve(entry.request().id(), PermissionResponse.DENY);
            }
        }
    }

    public PermissionCache cache() {
        return cache;
    }

    private static String channel(PermissionRequest request) {
        return AgentObserver.channelFor(request.sessionId().orElse("global"));
    }

    private record Pending(PermissionRequest request, CompletableFuture<PermissionResponse> decision) {
    }
}
