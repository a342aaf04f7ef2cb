package com.phillippitts.n8nsync.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Verifies that control API log lines carry the MDC values set by MdcFilter.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "n8n.sync.watch-on-startup=false",
        "n8n.sync.poll-interval-ms=0",
        "n8n.sync.instance-identifier=logging",
        "n8n.api.host=http://127.0.0.1:1"
    }
)
class LoggingFormatIntegrationTest {

    private static final String CONTROLLER_LOGGER =
            "com.phillippitts.n8nsync.presentation.controller.SyncController";

    @TempDir
    static Path workDir;

    @DynamicPropertySource
    static void directory(DynamicPropertyRegistry registry) {
        registry.add("n8n.sync.directory", () -> workDir.toString());
    }

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(CONTROLLER_LOGGER);
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
    void shouldIncludeRequestIdInStructuredLogs() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "abc123");

        ResponseEntity<String> response = restTemplate.exchange(
                "http://localhost:" + port + "/api/sync/refresh",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                String.class
        );

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(response.getHeaders().getFirst("X-Request-ID")).isEqualTo("abc123");

        await().atMost(3, SECONDS).until(() -> appender.getEvents().stream()
                .anyMatch(e -> e.getMessage().getFormattedMessage().contains("Manual refresh requested")));

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage().getFormattedMessage().contains("Manual refresh requested"))
                .findFirst()
                .orElseThrow();
        ReadOnlyStringMap contextData = event.getContextData();
        assertThat((String) contextData.getValue("requestId")).isEqualTo("abc123");
        assertThat((String) contextData.getValue("uri")).isEqualTo("/api/sync/refresh");
    }

    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        InMemoryAppender(String name) {
            super(name, null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return events;
        }
    }
}
