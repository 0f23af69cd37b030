package io.github.hide212131.langchain4j.agentcore.runtime;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * フェーズ・セッション・ジョブ・ステップを 1 行に揃えて出力する JUL ラッパ。
 */
@SuppressWarnings({ "PMD.UseObjectForClearerAPI", "PMD.GuardLogStatement", "PMD.AvoidDuplicateLiterals",
        "PMD.ConsecutiveLiteralAppends" })
public final class VisibilityLog {

    private static final int FORMAT_BUFFER_SIZE = 192;
    private static final int MAX_FIELD_LENGTH = 400;

    private final Logger logger;

    public VisibilityLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static VisibilityLog forClass(Class<?> type) {
        return new VisibilityLog(Logger.getLogger(type.getName()));
    }

    public void debug(String sessionId, String jobId, String phase, String step, String message) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        logger.log(Level.FINE, format(Level.FINE, sessionId, jobId, phase, step, message, null, null, null));
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    public void info(String sessionId, String jobId, String phase, String step, String message, String input,
            String output) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        logger.log(Level.INFO, format(Level.INFO, sessionId, jobId, phase, step, message, input, output, null));
    }

    @SuppressWarnings({ "checkstyle:ParameterNumber", "PMD.GuardLogStatement" })
    public void warn(String sessionId, String jobId, String phase, String step, String message, String input,
            Throwable error) {
        if (!logger.isLoggable(Level.WARNING)) {
            return;
        }
        logger.log(Level.WARNING, format(Level.WARNING, sessionId, jobId, phase, step, message, input, null, error),
                error);
    }

    @SuppressWarnings({ "checkstyle:ParameterNumber", "PMD.GuardLogStatement" })
    public void error(String sessionId, String jobId, String phase, String step, String message, String input,
            Throwable error) {
        if (!logger.isLoggable(Level.SEVERE)) {
            return;
        }
        logger.log(Level.SEVERE, format(Level.SEVERE, sessionId, jobId, phase, step, message, input, null, error),
                error);
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    String format(Level level, String sessionId, String jobId, String phase, String step, String message,
            String input, String output, Throwable error) {
        String header = String.format(Locale.ROOT, "[phase=%s][level=%s][session=%s][job=%s][step=%s] %s",
                valueOrDash(phase), level.getName(), valueOrDash(sessionId), valueOrDash(jobId), valueOrDash(step),
                valueOrEmpty(message));
        StringBuilder sb = new StringBuilder(FORMAT_BUFFER_SIZE);
        sb.append(header);
        if (input != null && !input.isBlank()) {
            sb.append(" input=").append(clip(input.trim()));
        }
        if (output != null && !output.isBlank()) {
            sb.append(" output=").append(clip(output.trim()));
        }
        if (error != null) {
            sb.append(" error=").append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
        }
        return sb.toString();
    }

    private String clip(String value) {
        if (value.length() <= MAX_FIELD_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_FIELD_LENGTH) + "...";
    }

    private String valueOrDash(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim();
    }

    private String valueOrEmpty(String value) {
        if (value == null) {
            return "";
        }
        return value;
    }
}
