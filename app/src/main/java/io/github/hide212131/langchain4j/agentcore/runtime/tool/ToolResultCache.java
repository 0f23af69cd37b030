package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * スコープ・ツール名・引数から SHA-256 のキーを作り、結果を TTL 付きで保持する。
 *
 * <p>
 * スコープはセッションとワークスペースの組で、別のセッションや別のワークスペースの結果は返さない。
 */
public final class ToolResultCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ToolResultCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public ToolResultCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl は正の値を指定してください: " + ttl);
        }
    }

    /** セッションとワークスペースからスコープ名を作る。 */
    public static String scope(String sessionId, Path workspace) {
        return Objects.requireNonNull(sessionId, "sessionId") + "@"
                + Objects.requireNonNull(workspace, "workspace").toAbsolutePath().normalize();
    }

    public Optional<String> get(String scope, String toolName, JsonNode args) {
        String key = key(scope, toolName, args);
        Entry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.result());
    }

    public void put(String scope, String toolName, JsonNode args, String result) {
        Objects.requireNonNull(result, "result");
        Instant now = clock.instant();
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        entries.put(key(scope, toolName, args), new Entry(scope, result, now.plus(ttl)));
    }

    /** 指定したスコープの結果をすべて捨てる。 */
    public void invalidate(String scope) {
        Objects.requireNonNull(scope, "scope");
        entries.values().removeIf(entry -> entry.scope().equals(scope));
    }

    public void clear() {
        entries.clear();
    }

    public Stats stats() {
        return new Stats(entries.size(), hits.get(), misses.get());
    }

    static String key(String scope, String toolName, JsonNode args) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(toolName, "toolName");
        String material = scope + "\n" + toolName + ":" + ToolJson.canonical(args);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 が利用できません", ex);
        }
    }

    private record Entry(String scope, String result, Instant expiresAt) {
    }

    /** キャッシュの統計。 */
    public record Stats(int entries, long hits, long misses) {
    }
}
