package com.sessionretry.autoconfig;

import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.backoff.BackoffRegistry;
import com.sessionretry.core.engine.SessionRetryLifecycle;
import com.sessionretry.core.engine.SessionRetryOrchestrator;
import com.sessionretry.core.failure.ErrorClassifier;
import com.sessionretry.core.handler.GuardedOperationExecutor;
import com.sessionretry.core.metric.RetryMetrics;
import com.sessionretry.core.policy.RetryPolicy;
import com.sessionretry.core.spi.BackoffPolicy;
import com.sessionretry.core.spi.RetryObserver;
import com.sessionretry.core.spi.SessionPool;
import com.sessionretry.core.trace.ObserverRegistry;
import com.sessionretry.core.trace.observer.StructuredRetryLogger;
import com.sessionretry.exception.guard.GuardRejectedException;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * 重试编排器及其组件
 */
@AutoConfiguration(after = {SessionRetryMetricsAutoConfiguration.class, SessionRetryGuardAutoConfiguration.class})
@EnableConfigurationProperties(SessionRetryProperties.class)
@ConditionalOnProperty(prefix = "session.retry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionRetryAutoConfiguration {

    /**
     * 退避时间轮
     */
    @Bean
    @ConditionalOnMissingBean(name = "sessionRetryTimer")
    public HashedWheelTimer sessionRetryTimer(SessionRetryProperties props) {
        SessionRetryProperties.Timer t = props.getTimer();
        return new HashedWheelTimer(
                new NamedThreadFactory("session-retry-timer"),
                t.getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                t.getTicksPerWheel(),
                false,
                t.getMaxPendingTimeouts()
        );
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(SessionRetryProperties props,
                                           ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies.orderedStream().toList());
    }

    /**
     * 装配了 guard 时, guard 拒绝（请求未到达后端）按可重试处理
     */
    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(SessionRetryProperties props,
                                           ObjectProvider<GuardedOperationExecutor> guard) {
        ErrorClassifier classifier = ErrorClassifier.of(props.getRetryableStatusOverrides(), props.getRetryableExceptions());
        if (guard.getIfAvailable() != null) {
            classifier = classifier.withRetryable(GuardRejectedException.class);
        }
        return classifier;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(SessionRetryProperties props, BackoffRegistry backoffRegistry) {
        return new RetryPolicy(props.getMaxAttempts(), props.getMaxElapsed(), backoffRegistry);
    }

    /**
     * 结构化重试日志
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "session.retry.logger", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StructuredRetryLogger structuredRetryLogger(SessionRetryProperties props, ErrorClassifier classifier) {
        SessionRetryProperties.Logger l = props.getLogger();
        return new StructuredRetryLogger(l.getVerbosity(), l.getFormat(), classifier);
    }

    /**
     * 观察者注册中心, 收集容器内所有 RetryObserver
     */
    @Bean
    @ConditionalOnMissingBean
    public ObserverRegistry observerRegistry(ObjectProvider<RetryMetrics> metrics,
                                             ObjectProvider<RetryObserver> observers) {
        return new ObserverRegistry(metrics.getIfAvailable(), observers.orderedStream().toList());
    }

    /**
     * 重试编排器, 仅在应用提供了 SessionPool 时装配
     */
    @Bean
    @ConditionalOnBean(SessionPool.class)
    @ConditionalOnMissingBean
    public SessionRetryOrchestrator<?> sessionRetryOrchestrator(SessionPool<?> sessionPool,
                                                                ErrorClassifier classifier,
                                                                RetryPolicy policy,
                                                                ObserverRegistry observerRegistry,
                                                                HashedWheelTimer sessionRetryTimer,
                                                                ObjectProvider<GuardedOperationExecutor> guard) {
        return orchestrator(sessionPool, classifier, policy, observerRegistry, sessionRetryTimer, guard.getIfAvailable());
    }

    @Bean
    public SessionRetryLifecycle sessionRetryLifecycle(ObjectProvider<SessionRetryOrchestrator<?>> orchestrator,
                                                       HashedWheelTimer sessionRetryTimer,
                                                       SessionRetryProperties props) {
        return new SessionRetryLifecycle(orchestrator.getIfAvailable(), sessionRetryTimer, props);
    }

    private static <S> SessionRetryOrchestrator<S> orchestrator(SessionPool<S> pool, ErrorClassifier classifier,
                                                               RetryPolicy policy, ObserverRegistry observers,
                                                               HashedWheelTimer timer, GuardedOperationExecutor guard) {
        return new SessionRetryOrchestrator<>(pool, classifier, policy, observers, timer, guard);
    }
}
