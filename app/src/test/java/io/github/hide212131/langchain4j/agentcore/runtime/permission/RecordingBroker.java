package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** 受け取った依頼を記録し、決まった判断を即時に返すテスト用ブローカー。 */
public final class RecordingBroker implements PermissionBroker {

    private final boolean decision;
    private final Deque<Boolean> scripted = new ArrayDeque<>();
    private final List<PermissionRequest> requests = new ArrayList<>();

    private RecordingBroker(boolean decision) {
        this.decision = decision;
    }

    public static RecordingBroker allowing() {
        return new RecordingBroker(true);
    }

    public static RecordingBroker denying() {
        return new RecordingBroker(false);
    }

    /** 最初の {@code allowed} 件だけ許可し、以降は拒否する。 */
    public static RecordingBroker allowingFirst(int allowed) {
        RecordingBroker broker = new RecordingBroker(false);
        for (int i = 0; i < allowed; i++) {
            broker.scripted.add(Boolean.TRUE);
        }
        return broker;
    }

    @Override
    public CompletableFuture<Boolean> request(PermissionRequest request) {
        requests.add(request);
        Boolean next = scripted.poll();
        return CompletableFuture.completedFuture(next != null ? next : decision);
    }

    @Override
    public boolean resolve(String requestId, boolean allowed) {
        return false;
    }

    @Override
    public List<String> listPending() {
        return List.of();
    }

    public List<PermissionRequest> requests() {
        return List.copyOf(requests);
    }

    public PermissionRequest last() {
        return requests.get(requests.size() - 1);
    }
}
