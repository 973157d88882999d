package com.phillippitts.lossguard.logging;

import com.phillippitts.lossguard.testutil.InMemoryAppender;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Validates structured log context (MDC) for remotely reported runs.
 *
 * Verifies that:
 * - The controller's run start line carries requestId, runId and endpoint from RunContextFilter
 * - Monitor log lines of a step report carry the reported step index
 */
@SpringBootTest(properties = "lossguard.spike.window-size=2")
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class LoggingFormatIntegrationTest {

    private static final String APP_LOGGER = "com.phillippitts.lossguard";
    private static final String CONTROLLER_LOGGER =
            "com.phillippitts.lossguard.presentation.controller.RunMonitorController";
    private static final String MONITOR_LOGGER = "com.phillippitts.lossguard.service.monitor.LossSpikeMonitor";

    @Autowired
    private MockMvc mvc;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(APP_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestIdAndRunIdInStructuredLogs() throws Exception {
        mvc.perform(post("/api/v1/monitor/run-start")
                        .header("X-Request-ID", "abc123")
                        .header("X-Run-ID", "run-7"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "abc123"));

        LogEvent event = findEvent(CONTROLLER_LOGGER, "Run start reported");

        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData.<String>getValue("requestId")).isEqualTo("abc123");
        assertThat(contextData.<String>getValue("runId")).isEqualTo("run-7");
        assertThat(contextData.<String>getValue("endpoint")).isEqualTo("POST /api/v1/monitor/run-start");
    }

    @Test
    void shouldTagMonitorLogsWithReportedStep() throws Exception {
        for (int step = 0; step < 3; step++) {
            mvc.perform(post("/api/v1/monitor/steps")
                            .header("X-Run-ID", "run-7")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"step\": " + step + ", \"loss\": [1.5]}"))
                    .andExpect(status().isOk());
        }

        // The loss cap is calibrated when the two-step window is first full
        LogEvent event = findEvent(MONITOR_LOGGER, "Calibrated loss cap");

        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData.<String>getValue("step")).isEqualTo("2");
        assertThat(contextData.<String>getValue("runId")).isEqualTo("run-7");
        assertThat(contextData.<String>getValue("endpoint")).isEqualTo("POST /api/v1/monitor/steps");
    }

    private LogEvent findEvent(String loggerName, String messagePrefix) {
        return appender.getEvents().stream()
                .filter(e -> loggerName.equals(e.getLoggerName()))
                .filter(e -> e.getMessage().getFormattedMessage().startsWith(messagePrefix))
                .findFirst()
                .orElseThrow();
    }
}
