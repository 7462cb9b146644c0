package com.keyco.core;

import com.keyco.config.KeycoClientProperties;
import com.keyco.config.KeycoNotifierProperties;
import com.keyco.core.backoff.BackoffRegistry;
import com.keyco.core.backoff.RetryScheduler;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.breaker.CircuitState;
import com.keyco.core.credential.PropertyCredentialStore;
import com.keyco.core.dedup.RequestDeduplicator;
import com.keyco.core.engine.ApiRequestExecutor;
import com.keyco.core.failure.OutcomeHandlerFactory;
import com.keyco.core.failure.RouterErrorClassifier;
import com.keyco.core.failure.decider.ApiExceptionHandler;
import com.keyco.core.failure.decider.CancelledCallHandler;
import com.keyco.core.failure.decider.HttpStatusHandler;
import com.keyco.core.failure.decider.InvalidResponseHandler;
import com.keyco.core.failure.decider.IoFailureHandler;
import com.keyco.core.failure.decider.TimeoutHandler;
import com.keyco.core.failure.decider.UnknownHandler;
import com.keyco.core.failure.handler.CancelledOutcomeHandler;
import com.keyco.core.failure.handler.RetryOutcomeHandler;
import com.keyco.core.failure.handler.TerminalOutcomeHandler;
import com.keyco.core.http.BackendEndpoints;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.core.preflight.PreflightProbe;
import com.keyco.core.serializer.JacksonPayloadSerializer;
import com.keyco.core.spi.CredentialStore;
import com.keyco.model.ApiResult;
import com.keyco.model.BackendStatus;
import com.keyco.model.ChatParams;
import com.keyco.model.RequestHandle;
import com.keyco.model.RewriteParams;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 对外门面: rewrite / chat, 以及供 UI 主动调用的健康与连通性检查
 */
public class KeycoApiClient implements AutoCloseable {

    private final ApiRequestExecutor executor;

    private final PreflightProbe preflight;

    private final BackendCircuitBreaker breaker;

    /** 自持资源的释放逻辑, 由 Spring 托管时为空操作 */
    private final Runnable closer;

    public KeycoApiClient(ApiRequestExecutor executor, PreflightProbe preflight, BackendCircuitBreaker breaker) {
        this(executor, preflight, breaker, () -> {});
    }

    KeycoApiClient(ApiRequestExecutor executor, PreflightProbe preflight, BackendCircuitBreaker breaker, Runnable closer) {
        this.executor = executor;
        this.preflight = preflight;
        this.breaker = breaker;
        this.closer = closer;
    }

    public RequestHandle rewrite(RewriteParams params, Consumer<String> onProgress, Consumer<ApiResult> onComplete) {
        return executor.submit(params, onProgress, onComplete);
    }

    public RequestHandle rewrite(RewriteParams params, Consumer<ApiResult> onComplete) {
        return executor.submit(params, null, onComplete);
    }

    public CompletableFuture<ApiResult> rewrite(RewriteParams params) {
        return executor.submit(params, null, null).result();
    }

    public RequestHandle chat(ChatParams params, Consumer<String> onProgress, Consumer<ApiResult> onComplete) {
        return executor.submit(params, onProgress, onComplete);
    }

    public RequestHandle chat(ChatParams params, Consumer<ApiResult> onComplete) {
        return executor.submit(params, null, onComplete);
    }

    public CompletableFuture<ApiResult> chat(String query) {
        return executor.submit(ChatParams.of(query), null, null).result();
    }

    public CompletableFuture<BackendStatus> checkBackendStatus() {
        return preflight.checkBackendHealth().thenApply(BackendStatus::of);
    }

    public CompletableFuture<Boolean> checkConnectivity() {
        return preflight.checkConnectivity();
    }

    public CircuitState circuitState() {
        return breaker.currentState();
    }

    public BackendCircuitBreaker breaker() {
        return breaker;
    }

    @Override
    public void close() {
        executor.shutdown();
        closer.run();
    }

    public static Builder builder(KeycoClientProperties props) {
        return new Builder(props);
    }

    /**
     * 脱离 Spring 手工装配
     */
    public static final class Builder {

        private final KeycoClientProperties props;
        private OkHttpClient http;
        private Clock clock = Clock.systemUTC();
        private CredentialStore credentials;
        private ClientMetrics metrics;
        private NotifyingFacade notifier = NotifyingFacade.noop();

        private Builder(KeycoClientProperties props) {
            this.props = props;
        }

        public Builder okHttpClient(OkHttpClient http) { this.http = http; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder credentials(CredentialStore credentials) { this.credentials = credentials; return this; }
        public Builder metrics(ClientMetrics metrics) { this.metrics = metrics; return this; }
        public Builder notifier(NotifyingFacade notifier) { this.notifier = notifier; return this; }

        public KeycoApiClient build() {
            OkHttpClient client = http != null ? http : new OkHttpClient();
            ClientMetrics meter = metrics != null ? metrics : ClientMetrics.simple();
            CredentialStore store = credentials != null ? credentials : new PropertyCredentialStore(props);

            HashedWheelTimer timer = new HashedWheelTimer(
                    new NamedThreadFactory("keyco-wheel-timer"),
                    props.getWheel().getTickDuration().toMillis(),
                    TimeUnit.MILLISECONDS,
                    props.getWheel().getTicksPerWheel(),
                    false,
                    props.getWheel().getMaxPendingTimeouts());
            ExecutorService delivery = Executors.newSingleThreadExecutor(
                    new NamedThreadFactory(props.getDelivery().getThreadName()));

            BackoffRegistry registry = new BackoffRegistry(props);
            registry.afterPropertiesSet();
            BackendEndpoints endpoints = new BackendEndpoints(props);
            BackendCircuitBreaker breaker = new BackendCircuitBreaker(props, clock, meter, notifier);
            PreflightProbe preflight = new PreflightProbe(client, endpoints, props, timer);
            ApiRequestExecutor executor = new ApiRequestExecutor(
                    props,
                    client,
                    endpoints,
                    new JacksonPayloadSerializer(),
                    store,
                    breaker,
                    new RequestDeduplicator(props, clock),
                    preflight,
                    new RetryScheduler(registry, props),
                    new RouterErrorClassifier(List.of(
                            new CancelledCallHandler(), new TimeoutHandler(), new HttpStatusHandler(),
                            new InvalidResponseHandler(), new IoFailureHandler(), new ApiExceptionHandler(),
                            new UnknownHandler())),
                    new OutcomeHandlerFactory(List.of(
                            new RetryOutcomeHandler(), new TerminalOutcomeHandler(), new CancelledOutcomeHandler())),
                    notifier,
                    meter,
                    timer,
                    delivery,
                    clock);
            KeycoClientLifecycle lifecycle = new KeycoClientLifecycle(executor, timer, delivery, null,
                    props, new KeycoNotifierProperties(), http == null);
            lifecycle.start();
            return new KeycoApiClient(executor, preflight, breaker, lifecycle::stop);
        }
    }
}
