package com.keyco.autoconfig;

import com.keyco.annotation.EnableKeycoClient;
import com.keyco.config.KeycoClientProperties;
import com.keyco.config.KeycoNotifierProperties;
import com.keyco.core.KeycoApiClient;
import com.keyco.core.KeycoClientLifecycle;
import com.keyco.core.backoff.BackoffRegistry;
import com.keyco.core.backoff.RetryScheduler;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.credential.PropertyCredentialStore;
import com.keyco.core.dedup.RequestDeduplicator;
import com.keyco.core.engine.ApiRequestExecutor;
import com.keyco.core.failure.OutcomeHandlerFactory;
import com.keyco.core.http.BackendEndpoints;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.AsyncNotifyingService;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.core.preflight.PreflightProbe;
import com.keyco.core.serializer.JacksonPayloadSerializer;
import com.keyco.core.spi.BackoffPolicy;
import com.keyco.core.spi.CredentialStore;
import com.keyco.core.spi.PayloadSerializer;
import com.keyco.core.spi.failure.ErrorClassifier;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮, 交付线程, HTTP 客户端与请求执行器
 */
@AutoConfiguration(after = {
        KeycoClientMetricsAutoConfiguration.class,
        KeycoNotifierAutoConfiguration.class,
        KeycoGuardAutoConfiguration.class,
        ErrorClassifierAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "keyco.client", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties({
        KeycoClientProperties.class,
        KeycoNotifierProperties.class
})
public class KeycoClientAutoConfiguration {

    static final String KEYCO_HTTP_CLIENT = "keycoOkHttpClient";

    /**
     * 时间轮: 重试, 兜底超时, 探测看门狗
     */
    @Bean("keycoWheelTimer")
    public HashedWheelTimer keycoWheelTimer(KeycoClientProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("keyco-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 回调交付线程, 单线程保证同一客户端回调有序
     */
    @Bean("keycoDeliveryExecutor")
    public ExecutorService keycoDeliveryExecutor(KeycoClientProperties props) {
        return Executors.newSingleThreadExecutor(new NamedThreadFactory(props.getDelivery().getThreadName()));
    }

    @Bean(KEYCO_HTTP_CLIENT)
    @ConditionalOnMissingBean(OkHttpClient.class)
    public OkHttpClient keycoOkHttpClient() {
        return new OkHttpClient();
    }

    /**
     * 策略注册中心
     */
    @Bean
    public BackoffRegistry backoffRegistry(KeycoClientProperties props,
                                           @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    @Bean
    public RetryScheduler retryScheduler(BackoffRegistry registry, KeycoClientProperties props) {
        return new RetryScheduler(registry, props);
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 默认凭据来源: keyco.client.api-key
     */
    @Bean
    @ConditionalOnMissingBean(CredentialStore.class)
    public CredentialStore credentialStore(KeycoClientProperties props) {
        return new PropertyCredentialStore(props);
    }

    @Bean
    public BackendEndpoints backendEndpoints(KeycoClientProperties props) {
        return new BackendEndpoints(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public PreflightProbe preflightProbe(OkHttpClient http, BackendEndpoints endpoints,
                                         KeycoClientProperties props,
                                         @Qualifier("keycoWheelTimer") HashedWheelTimer timer) {
        return new PreflightProbe(http, endpoints, props, timer);
    }

    /**
     * 请求执行器
     */
    @Bean
    public ApiRequestExecutor apiRequestExecutor(KeycoClientProperties props,
                                                 OkHttpClient http,
                                                 BackendEndpoints endpoints,
                                                 PayloadSerializer serializer,
                                                 CredentialStore credentials,
                                                 BackendCircuitBreaker breaker,
                                                 RequestDeduplicator dedup,
                                                 PreflightProbe preflight,
                                                 RetryScheduler scheduler,
                                                 ErrorClassifier classifier,
                                                 OutcomeHandlerFactory outcomes,
                                                 NotifyingFacade notifier,
                                                 ClientMetrics meter,
                                                 @Qualifier("keycoWheelTimer") HashedWheelTimer timer,
                                                 @Qualifier("keycoDeliveryExecutor") ExecutorService delivery,
                                                 @Qualifier("keycoClock") Clock clock,
                                                 ApplicationContext applicationContext) {
        EnableKeycoClient enable = findEnableKeycoClient(applicationContext);
        if (enable != null) {
            KeycoClientProperties.Preflight preflightProps = props.getPreflight();
            preflightProps.setConnectivityCheckEnabled(enable.value());
            props.setPreflight(preflightProps);
        }
        return new ApiRequestExecutor(props, http, endpoints, serializer, credentials, breaker, dedup,
                preflight, scheduler, classifier, outcomes, notifier, meter, timer, delivery, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeycoApiClient keycoApiClient(ApiRequestExecutor executor, PreflightProbe preflight,
                                         BackendCircuitBreaker breaker) {
        return new KeycoApiClient(executor, preflight, breaker);
    }

    /**
     * 启动横幅与优雅停机
     */
    @Bean
    public KeycoClientLifecycle keycoClientLifecycle(ApiRequestExecutor executor,
                                                     @Qualifier("keycoWheelTimer") HashedWheelTimer timer,
                                                     @Qualifier("keycoDeliveryExecutor") ExecutorService delivery,
                                                     ObjectProvider<AsyncNotifyingService> notifyService,
                                                     KeycoClientProperties props,
                                                     KeycoNotifierProperties notifyProps,
                                                     ApplicationContext applicationContext) {
        // 应用自带 OkHttpClient 时不创建 keycoOkHttpClient, 停机也不关闭它
        boolean ownsHttpClient = applicationContext.containsBean(KEYCO_HTTP_CLIENT);
        return new KeycoClientLifecycle(executor, timer, delivery, notifyService.getIfAvailable(),
                props, notifyProps, ownsHttpClient);
    }

    private EnableKeycoClient findEnableKeycoClient(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableKeycoClient an = type.getAnnotation(EnableKeycoClient.class);
            if (an != null) return an;
        }
        return null;
    }
}
