package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 特権操作の承認窓口。{@link #request} は判断が届くまで完了しない Future を返す。
 */
public interface PermissionBroker {

    CompletableFuture<Boolean> request(PermissionRequest request);

    /**
     * 保留中の依頼に判断を返す。未知の ID や解決済みの ID は何もせず false を返す。
     */
    boolean resolve(String requestId, boolean allowed);

    List<String> listPending();

    /** セッションに属する保留中の依頼をすべて拒否として確定させる。 */
    default void cancelSession(String sessionId) {
        // 保留を持たない実装では何もしない
    }

    /**
     * 判断が出るまで呼び出しスレッドを止めて待つ。
     */
    default boolean check(PermissionRequest request) {
        CompletableFuture<Boolean> decision = request(request);
        try {
            return decision.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("権限確認の待機が中断されました: " + request.id(), ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("権限確認に失敗しました: " + request.id(), ex.getCause());
        }
    }

    /** 無人運用向け。すべての依頼を待たずに許可する。 */
    static PermissionBroker autonomous() {
        return FixedPermissionBroker.ALLOW_ALL;
    }

    static PermissionBroker denyAll() {
        return FixedPermissionBroker.DENY_ALL;
    }
}
