package com.retrypolicy.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryOptionsTest {

    @Test
    @DisplayName("Should fill unset fields from defaults")
    void shouldFillFromDefaults() {
        RetryOptions resolved = RetryOptions.builder().retryCount(7).build().resolve(RetryOptions.defaults());

        assertThat(resolved.getRetryCount()).isEqualTo(7);
        assertThat(resolved.getRetrySleep()).isNull();
        assertThat(resolved.getExponentialBackoff()).isFalse();
        assertThat(resolved.getLogRetries()).isTrue();
        assertThat(resolved.getJitterMillis()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("Should start exponential backoff at one second regardless of retry-sleep")
    void shouldIgnoreRetrySleepForExponential() {
        RetryOptions opt = RetryOptions.builder()
                .retrySleep(Duration.ofSeconds(9))
                .exponentialBackoff(true)
                .build();

        assertThat(opt.initialSleepBase()).isEqualTo(Duration.ofSeconds(1));
        assertThat(RetryOptions.builder().retrySleep(Duration.ofSeconds(9)).build().initialSleepBase())
                .isEqualTo(Duration.ofSeconds(9));
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> RetryOptions.builder().retryCount(-1).build().resolve(RetryOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryCount");
        assertThatThrownBy(() -> RetryOptions.builder().jitterMillis(-1L).build().resolve(RetryOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jitterMillis");
        assertThatThrownBy(() -> RetryOptions.builder().retrySleep(Duration.ofMillis(-1)).build()
                .resolve(RetryOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
