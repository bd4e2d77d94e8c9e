package com.retrypolicy.core.event.listener;

import com.retrypolicy.core.metric.RetryMetrics;
import com.retrypolicy.model.enums.RetryEventType;
import com.retrypolicy.model.event.RetryEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRetryListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsRetryListener listener = new MetricsRetryListener(RetryMetrics.create(registry));

    private static RetryEvent event(RetryEventType type) {
        return RetryEvent.builder()
                .type(type)
                .retryId("r")
                .retriesRequired(type == RetryEventType.SUCCESS ? 2 : null)
                .timeElapsed(Duration.ofMillis(100))
                .build();
    }

    @Test
    void shouldCountEachEventType() {
        // When
        listener.onEvent(event(RetryEventType.ATTEMPT));
        listener.onEvent(event(RetryEventType.ATTEMPT));
        listener.onEvent(event(RetryEventType.SUCCESS));
        listener.onEvent(event(RetryEventType.FAILURE));

        // Then
        assertThat(registry.get("retry.attempt").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("retry.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("retry.failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("retry.retries.required").summary().totalAmount()).isEqualTo(2.0);
        assertThat(registry.get("retry.elapsed.time").timer().count()).isEqualTo(2);
    }
}
