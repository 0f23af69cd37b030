package io.github.hide212131.langchain4j.agentcore.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@SuppressWarnings({ "PMD.JUnitTestContainsTooManyAsserts", "PMD.GuardLogStatement" })
class VisibilityLogTest {

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    VisibilityLogTest() {
        // default
    }

    @Test
    @DisplayName("INFO には phase/session/job/step と入出力を含める")
    void logInfo() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        VisibilityLog log = new VisibilityLog(newLogger(out, Level.ALL));

        log.info("session-1", "job-1", "planning", "attempt-1", "計画を生成しました", "goal=demo", "tasks=2");

        String text = out.toString(StandardCharsets.UTF_8);
        assertThat(text).contains("[phase=planning]").contains("[level=INFO]").contains("[session=session-1]")
                .contains("[job=job-1]").contains("[step=attempt-1]").contains("計画を生成しました")
                .contains("input=goal=demo").contains("output=tasks=2");
    }

    @Test
    @DisplayName("WARNING 以上だけを許すロガーでは INFO と DEBUG を抑止する")
    void suppressInfoWhenLevelIsWarning() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        VisibilityLog log = new VisibilityLog(newLogger(out, Level.WARNING));

        log.debug("s", "j", "routing", "marker", "debug-line");
        log.info("s", "j", "loop", "step-1", "info-line", "", "");
        log.warn("s", "j", "tool", "bash", "warn-line", "", new IllegalStateException("boom"));

        String text = out.toString(StandardCharsets.UTF_8);
        assertThat(text).doesNotContain("debug-line").doesNotContain("info-line");
        assertThat(text).contains("warn-line").contains("error=IllegalStateException: boom");
    }

    @Test
    @DisplayName("空の識別子は - で埋め、長い入力は切り詰める")
    void formatsMissingFieldsAndClipsInput() {
        VisibilityLog log = new VisibilityLog(Logger.getLogger("visibility-log-" + UUID.randomUUID()));

        String line = log.format(Level.INFO, null, " ", "loop", null, "msg", "x".repeat(500), null, null);

        assertThat(line).startsWith("[phase=loop][level=INFO][session=-][job=-][step=-] msg input=")
                .endsWith("x".repeat(400) + "...");
    }

    private Logger newLogger(ByteArrayOutputStream out, Level level) {
        Logger log = Logger.getLogger("visibility-log-" + UUID.randomUUID());
        log.setUseParentHandlers(false);
        log.setLevel(level);
        Handler handler = new StreamHandler(out, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        handler.setLevel(Level.ALL);
        log.addHandler(handler);
        return log;
    }
}
