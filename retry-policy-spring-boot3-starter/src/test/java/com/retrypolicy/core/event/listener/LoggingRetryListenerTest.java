package com.retrypolicy.core.event.listener;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.retrypolicy.model.enums.RetryEventType;
import com.retrypolicy.model.event.RetryEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.KeyValuePair;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingRetryListenerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private LoggingRetryListener listener;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("retry-policy-test." + getClass().getSimpleName());
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        listener = new LoggingRetryListener(logger);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private static Map<String, Object> keyValues(ILoggingEvent event) {
        Map<String, Object> kv = new HashMap<>();
        if (event.getKeyValuePairs() != null) {
            for (KeyValuePair pair : event.getKeyValuePairs()) {
                kv.put(pair.key, pair.value);
            }
        }
        return kv;
    }

    @Test
    @DisplayName("Should log an attempt at WARN with the attempt fields")
    void shouldLogAttempt() {
        // When
        listener.onEvent(RetryEvent.builder()
                .type(RetryEventType.ATTEMPT)
                .retryId("r-1")
                .exceptionClass("java.io.IOException")
                .exceptionMessage("reset")
                .retriesRemaining(2)
                .sleepBeforeRetry(Duration.ofMillis(1500))
                .timeElapsed(Duration.ofMillis(250))
                .build());

        // Then
        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).startsWith("[Retry-Attempt] java.io.IOException: reset");
        assertThat(keyValues(event))
                .containsEntry("exception_class", "java.io.IOException")
                .containsEntry("exception_message", "reset")
                .containsEntry("retries_remaining", 2)
                .containsEntry("retry_id", "r-1")
                .containsEntry("sleep_before_retry", 1.5)
                .containsEntry("time_elapsed", 0.25);
    }

    @Test
    @DisplayName("Should log a null sleep when none was computed")
    void shouldLogNullSleep() {
        listener.onEvent(RetryEvent.builder()
                .type(RetryEventType.ATTEMPT)
                .retryId("r-2")
                .exceptionClass("java.io.IOException")
                .retriesRemaining(1)
                .timeElapsed(Duration.ZERO)
                .build());

        Map<String, Object> kv = keyValues(appender.list.get(0));
        assertThat(kv).containsKey("sleep_before_retry");
        assertThat(kv.get("sleep_before_retry")).isNull();
    }

    @Test
    @DisplayName("Should log a failure at ERROR with the failure fields")
    void shouldLogFailure() {
        listener.onEvent(RetryEvent.builder()
                .type(RetryEventType.FAILURE)
                .retryId("r-3")
                .exceptionClass("java.util.concurrent.TimeoutException")
                .exceptionMessage("slow")
                .retriesAttempted(3)
                .timeElapsed(Duration.ofSeconds(2))
                .build());

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        assertThat(keyValues(event))
                .containsEntry("retries_attempted", 3)
                .containsEntry("retry_id", "r-3")
                .containsEntry("time_elapsed", 2.0)
                .doesNotContainKey("retries_remaining");
    }

    @Test
    @DisplayName("Should log a success at INFO with the success fields")
    void shouldLogSuccess() {
        listener.onEvent(RetryEvent.builder()
                .type(RetryEventType.SUCCESS)
                .retryId("r-4")
                .retriesRequired(2)
                .timeElapsed(Duration.ofMillis(500))
                .build());

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(keyValues(event))
                .containsEntry("retries_required", 2)
                .containsEntry("retry_id", "r-4")
                .containsEntry("time_elapsed", 0.5)
                .doesNotContainKey("exception_class");
    }
}
