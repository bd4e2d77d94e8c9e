package com.retrypolicy.autoconfig;

import com.retrypolicy.core.event.listener.MetricsRetryListener;
import com.retrypolicy.core.metric.RetryMeterRegistryProvider;
import com.retrypolicy.core.metric.RetryMetrics;
import com.retrypolicy.core.spi.RetryEventListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "retry.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetryPolicyMetricsAutoConfiguration {

    @Bean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    public RetryEventListener metricsRetryListener(RetryMetrics metrics) {
        return new MetricsRetryListener(metrics);
    }
}
