package com.retrypolicy.core.metric;

import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryMeterRegistryProviderTest {

    @Test
    void shouldFallBackToSimpleRegistry() {
        CompositeMeterRegistry registry = (CompositeMeterRegistry) new RetryMeterRegistryProvider(List.of()).getRegistry();

        assertThat(registry.getRegistries()).hasSize(1)
                .first().isInstanceOf(SimpleMeterRegistry.class);
    }

    @Test
    void shouldFlattenDiscoveredComposites() {
        // Given
        SimpleMeterRegistry inner = new SimpleMeterRegistry();
        CompositeMeterRegistry outer = new CompositeMeterRegistry();
        outer.add(inner);
        SimpleMeterRegistry direct = new SimpleMeterRegistry();

        // When
        CompositeMeterRegistry registry = (CompositeMeterRegistry) new RetryMeterRegistryProvider(List.of(outer, direct))
                .getRegistry();
        registry.counter("retry.attempt").increment();

        // Then
        assertThat(registry.getRegistries()).containsExactlyInAnyOrder(inner, direct);
        assertThat(inner.get("retry.attempt").counter().count()).isEqualTo(1.0);
        assertThat(direct.get("retry.attempt").counter().count()).isEqualTo(1.0);
    }
}
