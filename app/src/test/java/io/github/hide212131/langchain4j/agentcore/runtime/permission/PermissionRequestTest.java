package io.github.hide212131.langchain4j.agentcore.runtime.permission;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PermissionRequestTest {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    PermissionRequestTest() {
        // default
    }

    @Test
    @DisplayName("キャッシュキーはセッション・種別・リソースから作る")
    void cacheKey() {
        PermissionRequest request = PermissionRequest.create(PermissionType.FILESYSTEM_WRITE, "write")
                .withResource("notes.txt")
                .withSessionId("abc");

        assertThat(request.cacheKey()).isEqualTo("abc:filesystem_write:notes.txt");
    }

    @Test
    @DisplayName("リソースがなければ global、セッションがなければ先頭を省く")
    void cacheKeyFallbacks() {
        PermissionRequest request = PermissionRequest.create(PermissionType.NETWORK, "fetch");

        assertThat(request.cacheKey()).isEqualTo("network:global");
        assertThat(request.sessionId()).isEmpty();
    }

    @Test
    @DisplayName("メタデータの追加は元の依頼を変えない")
    void metadataIsCopied() {
        PermissionRequest original = PermissionRequest.create(PermissionType.SHELL_EXECUTE, "run");

        PermissionRequest updated = original.withMetadata("operation", "search");

        assertThat(original.metadata()).isEmpty();
        assertThat(updated.metadata()).containsEntry("operation", "search");
        assertThat(updated.id()).isEqualTo(original.id());
    }

    @Test
    @DisplayName("セッション単位でキャッシュを消せる")
    void clearSession() {
        PermissionCache cache = new PermissionCache();
        cache.remember(PermissionRequest.create(PermissionType.SHELL_EXECUTE, "a").withSessionId("s1"));
        cache.remember(PermissionRequest.create(PermissionType.SHELL_EXECUTE, "b").withSessionId("s2"));
        cache.preApprove("network:global");

        cache.clearSession("s1");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.isApproved(PermissionRequest.create(PermissionType.NETWORK, "x"))).isTrue();
    }
}
