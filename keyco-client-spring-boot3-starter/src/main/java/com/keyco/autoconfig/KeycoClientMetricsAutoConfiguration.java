package com.keyco.autoconfig;

import com.keyco.core.metric.ClientMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
@ConditionalOnProperty(prefix = "keyco.client", name = "enabled", matchIfMissing = true)
public class KeycoClientMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ClientMetrics clientMetrics(ObjectProvider<MeterRegistry> registries) {
        return ClientMetrics.bindTo(registries.orderedStream().collect(Collectors.toList()));
    }
}
