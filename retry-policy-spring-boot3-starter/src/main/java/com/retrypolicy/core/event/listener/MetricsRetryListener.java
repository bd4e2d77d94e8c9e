package com.retrypolicy.core.event.listener;

import com.retrypolicy.core.metric.RetryMetrics;
import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.model.event.RetryEvent;

public class MetricsRetryListener implements RetryEventListener {

    private final RetryMetrics metrics;

    public MetricsRetryListener(RetryMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public void onEvent(RetryEvent event) {
        switch (event.getType()) {
            case ATTEMPT -> metrics.incAttempt();
            case SUCCESS -> {
                metrics.incSuccess();
                metrics.recordRetriesRequired(event.getRetriesRequired());
                metrics.recordElapsed(event.getTimeElapsed());
            }
            case FAILURE -> {
                metrics.incFailure();
                metrics.recordElapsed(event.getTimeElapsed());
            }
        }
    }
}
