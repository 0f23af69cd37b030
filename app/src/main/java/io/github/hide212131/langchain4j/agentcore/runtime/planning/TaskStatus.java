package io.github.hide212131.langchain4j.agentcore.runtime.planning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 計画タスクの状態。PENDING → RUNNING → COMPLETED の順にしか進まない。
 */
public enum TaskStatus {
    PENDING("未実施"), RUNNING("実行中"), COMPLETED("完了");

    private final String displayLabel;
    private static final Map<String, TaskStatus> LOOKUP = buildLookup();

    TaskStatus(String label) {
        this.displayLabel = label;
    }

    public String label() {
        return displayLabel;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 同じ状態か後ろの状態にだけ移れる。 */
    public boolean canTransitionTo(TaskStatus next) {
        return next.ordinal() >= ordinal();
    }

    @JsonCreator
    public static TaskStatus from(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        TaskStatus mapped = LOOKUP.get(normalizeKey(value));
        if (mapped != null) {
            return mapped;
        }
        throw new IllegalArgumentException("不明なステータスです: " + value);
    }

    private static String normalizeKey(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, TaskStatus> buildLookup() {
        Map<String, TaskStatus> map = new HashMap<>();
        for (TaskStatus status : values()) {
            map.put(normalizeKey(status.name()), status);
            map.put(normalizeKey(status.displayLabel), status);
        }
        map.put("todo", PENDING);
        map.put("in_progress", RUNNING);
        map.put("executing", RUNNING);
        map.put("done", COMPLETED);
        map.put("success", COMPLETED);
        return Map.copyOf(map);
    }
}
