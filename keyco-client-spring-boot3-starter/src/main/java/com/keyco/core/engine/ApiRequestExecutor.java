package com.keyco.core.engine;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.backoff.RetryScheduler;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.breaker.CircuitState;
import com.keyco.core.dedup.DedupRecord;
import com.keyco.core.dedup.RequestDeduplicator;
import com.keyco.core.dedup.RequestKeys;
import com.keyco.core.failure.OutcomeHandlerFactory;
import com.keyco.core.http.BackendEndpoints;
import com.keyco.core.http.ResponseParser;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyContexts;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.core.preflight.PreflightProbe;
import com.keyco.core.spi.CredentialStore;
import com.keyco.core.spi.PayloadSerializer;
import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.exception.ApiException;
import com.keyco.exception.CallCancelledException;
import com.keyco.exception.HttpStatusException;
import com.keyco.model.ApiRequest;
import com.keyco.model.ApiResult;
import com.keyco.model.RequestHandle;
import com.keyco.model.WheelTask;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;
import com.keyco.model.enums.Severity;
import io.netty.util.Timer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 请求执行器
 * 校验 -> 去重(首次) -> 连通性预检(首次) -> 熔断 -> HTTP -> 分类 -> 重试/终态
 */
@Slf4j
public class ApiRequestExecutor {

    public static final String DUPLICATE_PROGRESS = "Request already in progress...";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final KeycoClientProperties props;

    /** 带单次请求超时的客户端 */
    private final OkHttpClient http;

    private final BackendEndpoints endpoints;

    private final PayloadSerializer serializer;

    private final ResponseParser parser;

    private final CredentialStore credentials;

    private final BackendCircuitBreaker breaker;

    private final RequestDeduplicator dedup;

    private final PreflightProbe preflight;

    private final RetryScheduler scheduler;

    /** 错误分类 */
    private final ErrorClassifier classifier;

    /** 去向处理器 */
    private final OutcomeHandlerFactory outcomes;

    private final NotifyingFacade notifier;

    private final ClientMetrics meter;

    /** 重试与兜底都挂在时间轮上 */
    private final Timer timer;

    /** 所有回调在同一个交付线程上执行 */
    private final Executor delivery;

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** 本客户端未完成的请求, 停机时只中止这些调用 */
    private final Map<String, RequestContext> active = new ConcurrentHashMap<>();

    /** 提供执行能力给去向处理器 不暴露实现细节 */
    private final ExecutorOps ops;

    public ApiRequestExecutor(KeycoClientProperties props,
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
                              Timer timer,
                              Executor delivery,
                              Clock clock) {
        this.props = props;
        this.http = http.newBuilder().callTimeout(props.getTimeouts().getRequest()).build();
        this.endpoints = endpoints;
        this.serializer = serializer;
        this.parser = new ResponseParser(serializer);
        this.credentials = credentials;
        this.breaker = breaker;
        this.dedup = dedup;
        this.preflight = preflight;
        this.scheduler = scheduler;
        this.classifier = classifier;
        this.outcomes = outcomes;
        this.notifier = notifier;
        this.meter = meter;
        this.timer = timer;
        this.delivery = delivery;
        this.ops = new DefaultExecutorOps(props, clock, breaker, scheduler, notifier, meter,
                timer, delivery, running::get, this::attempt);
    }

    /**
     * 提交一次逻辑请求, 结果经 onComplete 与 RequestHandle#result 交付
     */
    public RequestHandle submit(ApiRequest request, Consumer<String> onProgress, Consumer<ApiResult> onComplete) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        RequestHandle handle = new RequestHandle(requestId);
        RequestContext ctx = RequestContext.builder()
                .requestId(requestId)
                .request(request)
                .attempt(0)
                .maxRetries(scheduler.maxRetries())
                .onProgress(onProgress)
                .onComplete(onComplete)
                .handle(handle)
                .startedNanos(System.nanoTime())
                .build();
        meter.incRequests();

        if (!running.get()) {
            fail(ctx, ApiException.of(ErrorKind.NETWORK_ERROR, "client is shut down"));
            return handle;
        }
        if (!request.isValid()) {
            fail(ctx, ApiException.of(ErrorKind.INVALID_REQUEST, "request failed validation"));
            return handle;
        }

        String key = RequestKeys.of(request);
        Optional<DedupRecord> existing = dedup.check(key, handle.result());
        if (existing.isPresent()) {
            meter.incDedupSuppressed();
            log.info("[Dedup] op={} suppressed duplicate, key={}", request.operation(), key);
            progress(ctx, DUPLICATE_PROGRESS);
            CompletableFuture<ApiResult> original = existing.get().getResult();
            return RequestHandle.duplicateOf(requestId, original != null ? original
                    : CompletableFuture.completedFuture(ApiResult.failure(
                            ApiException.of(ErrorKind.INVALID_REQUEST, "Request already in progress"))));
        }

        active.put(requestId, ctx);
        handle.result().whenComplete((r, e) -> active.remove(requestId));
        handle.bindOnCancel(e -> outcomes.get(ErrorClassifier.Outcome.CANCELLED).handle(ctx, e, ops));
        long failsafeMs = props.getFailsafe().getTimeout().toMillis();
        handle.attachFailsafe(timer.newTimeout(
                new WheelTask(WheelTask.Kind.FAILSAFE, requestId, () -> failsafe(ctx)),
                failsafeMs, TimeUnit.MILLISECONDS));

        log.info("[Keyco-Client] op={} request={} submitted, payloadLength={}",
                request.operation(), requestId, request.payloadLength());

        if (props.getPreflight().isConnectivityCheckEnabled()) {
            preflight.checkConnectivity().whenComplete((online, e) -> {
                if (Boolean.TRUE.equals(online)) {
                    attempt(ctx);
                } else {
                    fail(ctx, ApiException.of(ErrorKind.NO_CONNECTIVITY, "connectivity probe failed"));
                }
            });
        } else {
            attempt(ctx);
        }
        return handle;
    }

    /**
     * 单次尝试, 重试从这里重新进入（不再经过去重与连通性预检）
     */
    void attempt(RequestContext ctx) {
        if (ctx.getHandle().isDone()) {
            return;
        }
        if (!running.get()) {
            fail(ctx, ApiException.of(ErrorKind.NETWORK_ERROR, "client is shut down"));
            return;
        }
        CircuitState state = breaker.currentState();
        if (state.isOpen()) {
            log.info("[Breaker] open until {}, probing backend health, request={}", state.getUntil(), ctx.getRequestId());
            preflight.checkBackendHealth().whenComplete((healthy, e) -> {
                if (ctx.getHandle().isDone()) {
                    return;
                }
                if (Boolean.TRUE.equals(healthy)) {
                    breaker.reset();
                    send(ctx, false);
                } else {
                    breaker.recordProbeFailure();
                    fail(ctx, ApiException.of(ErrorKind.BACKEND_UNAVAILABLE, "Backend service unavailable"));
                }
            });
            return;
        }
        boolean trial = false;
        if (state.isHalfOpen()) {
            if (!breaker.tryAcquireTrial()) {
                fail(ctx, ApiException.of(ErrorKind.CIRCUIT_OPEN, "half-open trial already in flight"));
                return;
            }
            trial = true;
        }
        send(ctx, trial);
    }

    private void send(RequestContext ctx, boolean trial) {
        // 每次尝试最多归还一次试探名额
        AtomicBoolean trialHeld = new AtomicBoolean(trial);
        Runnable releaseTrial = () -> {
            if (trialHeld.compareAndSet(true, false)) {
                breaker.releaseTrial();
            }
        };
        Call call;
        try {
            call = http.newCall(buildRequest(ctx));
        } catch (RuntimeException e) {
            releaseTrial.run();
            onError(ctx, e);
            return;
        }
        ctx.getHandle().attachCall(call);
        log.info("[Keyco-Client] op={} request={} attempt={}/{} sending",
                ctx.getRequest().operation(), ctx.getRequestId(), ctx.getAttempt(), ctx.getMaxRetries());

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                releaseTrial.run();
                onError(ctx, c.isCanceled() ? new CallCancelledException(e) : e);
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    int status = response.code();
                    ResponseBody rb = response.body();
                    String body = rb == null ? "" : rb.string();
                    releaseTrial.run();
                    log.info("[Keyco-Client] op={} request={} attempt={} status={}",
                            ctx.getRequest().operation(), ctx.getRequestId(), ctx.getAttempt(), status);
                    if (!response.isSuccessful()) {
                        onError(ctx, new HttpStatusException(status, parser.extractErrorMessage(body)));
                        return;
                    }
                    breaker.recordSuccess();
                    ops.deliver(ctx, ApiResult.success(parser.parseSuccess(status, body)));
                } catch (IOException e) {
                    releaseTrial.run();
                    onError(ctx, c.isCanceled() ? new CallCancelledException(e) : e);
                } catch (RuntimeException e) {
                    releaseTrial.run();
                    onError(ctx, e);
                }
            }
        });
    }

    private Request buildRequest(RequestContext ctx) {
        ApiRequest request = ctx.getRequest();
        String json = serializer.writeBody(request.toWireBody(props.getDefaultLocale()));
        Request.Builder b = new Request.Builder()
                .url(endpoints.of(request.operation()))
                .post(RequestBody.create(json, JSON));
        credentials.get().ifPresent(token -> b.header("Authorization", "Bearer " + token));
        return b.build();
    }

    private void onError(RequestContext ctx, Throwable t) {
        if (ctx.getHandle().isDone()) {
            return;
        }
        ApiException error = classifier.classify(t, ctx);
        ErrorClassifier.Outcome outcome;
        if (error.isCancelled()) {
            outcome = ErrorClassifier.Outcome.CANCELLED;
        } else if (scheduler.shouldRetry(error, ctx.getAttempt())) {
            outcome = ErrorClassifier.Outcome.RETRY;
        } else {
            outcome = ErrorClassifier.Outcome.FAIL;
        }
        outcomes.get(outcome).handle(ctx, error, ops);
    }

    private void fail(RequestContext ctx, ApiException error) {
        onError(ctx, error);
    }

    private void failsafe(RequestContext ctx) {
        RequestHandle handle = ctx.getHandle();
        if (handle.isDone()) {
            return;
        }
        long millis = props.getFailsafe().getTimeout().toMillis();
        log.warn("[Keyco-Client] op={} request={} fail-safe fired after {} ms",
                ctx.getRequest().operation(), ctx.getRequestId(), millis);
        meter.incFailsafeFired();
        notifier.fire(NotifyContexts.ctxForFailsafe(ops.clientId(), ctx, ops.clock()), Severity.ERROR);
        // 先交付再中止, 中止引发的取消回调会被丢弃
        ops.deliver(ctx, ApiResult.failure(ApiException.of(ErrorKind.TIMEOUT, "no completion within " + millis + " ms")));
        handle.abort();
    }

    private void progress(RequestContext ctx, String message) {
        Consumer<String> p = ctx.getOnProgress();
        if (p == null) {
            return;
        }
        try {
            delivery.execute(() -> {
                try {
                    p.accept(message);
                } catch (RuntimeException e) {
                    log.error("[Keyco-Client] onProgress callback threw, request={}", ctx.getRequestId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Keyco-Client] delivery executor rejected progress, request={}", ctx.getRequestId());
        }
    }

    /**
     * 停止接收新请求, 排队中的重试按终态失败交付
     */
    public void shutdown() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 停机: 未完成的请求以关闭失败交付, 再中止其在途调用
     * 只触碰本客户端发出的 Call, 共享的 OkHttpClient 不受影响
     */
    public int abortInFlight() {
        int aborted = 0;
        for (RequestContext ctx : active.values()) {
            if (!ctx.getHandle().isDone()) {
                ops.deliver(ctx, ApiResult.failure(ApiException.of(ErrorKind.NETWORK_ERROR, "client is shut down")));
                aborted++;
            }
            ctx.getHandle().abort();
        }
        active.clear();
        return aborted;
    }

    public OkHttpClient http() {
        return http;
    }
}
