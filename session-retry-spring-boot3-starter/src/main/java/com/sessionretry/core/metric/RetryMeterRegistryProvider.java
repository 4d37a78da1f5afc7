package com.sessionretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 汇总应用中的 MeterRegistry, 无外部注册表时以 Simple 兜底
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        boolean attached = false;
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                    attached |= !c.getRegistries().isEmpty();
                } else {
                    this.composite.add(mr);
                    attached = true;
                }
            }
        }
        // 保底 Simple
        if (!attached) {
            this.composite.add(new SimpleMeterRegistry());
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
