package com.keyco.autoconfig;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.dedup.RequestDeduplicator;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyingFacade;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * 熔断与去重, 每个客户端一份
 */
@AutoConfiguration(after = {KeycoClientMetricsAutoConfiguration.class, KeycoNotifierAutoConfiguration.class})
@ConditionalOnProperty(prefix = "keyco.client", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KeycoClientProperties.class)
public class KeycoGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "keycoClock")
    public Clock keycoClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackendCircuitBreaker backendCircuitBreaker(KeycoClientProperties props, @Qualifier("keycoClock") Clock keycoClock,
                                                       ClientMetrics metrics, NotifyingFacade notifier) {
        return new BackendCircuitBreaker(props, keycoClock, metrics, notifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestDeduplicator requestDeduplicator(KeycoClientProperties props, @Qualifier("keycoClock") Clock keycoClock) {
        return new RequestDeduplicator(props, keycoClock);
    }
}
