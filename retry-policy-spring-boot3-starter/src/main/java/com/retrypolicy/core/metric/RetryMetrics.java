package com.retrypolicy.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

public final class RetryMetrics {
    private final Counter attempt;
    private final Counter success;
    private final Counter failure;
    private final DistributionSummary retriesRequired;
    private final Timer elapsed;

    private RetryMetrics(MeterRegistry reg) {
        this.attempt = Counter.builder("retry.attempt").description("retryable failures followed by a retry").register(reg);
        this.success = Counter.builder("retry.success").description("operations succeeded after retrying").register(reg);
        this.failure = Counter.builder("retry.failure").description("operations failed with retries exhausted").register(reg);
        this.retriesRequired = DistributionSummary.builder("retry.retries.required")
                .description("retries needed before success").baseUnit("times").register(reg);
        this.elapsed = Timer.builder("retry.elapsed.time").description("time from first attempt to outcome").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incAttempt(){ attempt.increment(); }
    public void incSuccess(){ success.increment(); }
    public void incFailure(){ failure.increment(); }
    public void recordRetriesRequired(Integer n){ if (n != null) retriesRequired.record(n); }
    public void recordElapsed(Duration d){ if (d != null) elapsed.record(d); }
}
