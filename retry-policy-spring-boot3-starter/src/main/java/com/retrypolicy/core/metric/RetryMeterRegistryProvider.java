package com.retrypolicy.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        // 没有业务注册表时保底 Simple
        if (discovered == null || discovered.isEmpty()) {
            this.composite.add(new SimpleMeterRegistry());
            return;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry c) {
                c.getRegistries().forEach(this.composite::add);
            } else {
                this.composite.add(mr);
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
