package com.sessionretry.autoconfig;

import com.sessionretry.config.SessionRetryGuardProperties;
import com.sessionretry.core.handler.GuardedOperationExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(SessionRetryGuardProperties.class)
@ConditionalOnProperty(prefix = "session.retry.guard", name = "enabled", havingValue = "true")
public class SessionRetryGuardAutoConfiguration {

    /**
     * 单次尝试的限流/隔离/熔断入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedOperationExecutor sessionRetryGuard(SessionRetryGuardProperties props) {
        return new GuardedOperationExecutor(props);
    }
}
