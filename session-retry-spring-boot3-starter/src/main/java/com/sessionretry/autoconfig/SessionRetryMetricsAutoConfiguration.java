package com.sessionretry.autoconfig;

import com.sessionretry.core.metric.RetryMeterRegistryProvider;
import com.sessionretry.core.metric.RetryMetrics;
import com.sessionretry.core.trace.observer.MetricsRetryObserver;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnProperty(prefix = "session.retry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionRetryMetricsAutoConfiguration {

    @Bean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRetryObserver metricsRetryObserver(RetryMetrics retryMetrics) {
        return new MetricsRetryObserver(retryMetrics);
    }
}
