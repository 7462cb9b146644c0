package com.keyco.core.engine;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.backoff.RetryScheduler;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.model.ApiResult;
import com.keyco.model.WheelTask;
import com.keyco.model.ctx.RequestContext;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

@Slf4j
public class DefaultExecutorOps implements ExecutorOps {

    private final String clientId;
    private final KeycoClientProperties props;
    private final Clock clock;
    private final BackendCircuitBreaker breaker;
    private final RetryScheduler scheduler;
    private final NotifyingFacade notifier;
    private final ClientMetrics meter;
    private final Timer timer;
    private final Executor delivery;
    private final BooleanSupplier running;
    private final Consumer<RequestContext> dispatcher;

    public DefaultExecutorOps(KeycoClientProperties props,
                              Clock clock,
                              BackendCircuitBreaker breaker,
                              RetryScheduler scheduler,
                              NotifyingFacade notifier,
                              ClientMetrics meter,
                              Timer timer,
                              Executor delivery,
                              BooleanSupplier running,
                              Consumer<RequestContext> dispatcher) {
        this.clientId = props.getClientId();
        this.props = props;
        this.clock = clock;
        this.breaker = breaker;
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.meter = meter;
        this.timer = timer;
        this.delivery = delivery;
        this.running = running;
        this.dispatcher = dispatcher;
    }

    @Override
    public String clientId() {
        return clientId;
    }

    @Override
    public KeycoClientProperties props() {
        return props;
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public BackendCircuitBreaker breaker() {
        return breaker;
    }

    @Override
    public RetryScheduler scheduler() {
        return scheduler;
    }

    @Override
    public NotifyingFacade notifier() {
        return notifier;
    }

    @Override
    public ClientMetrics meter() {
        return meter;
    }

    @Override
    public BooleanSupplier running() {
        return running;
    }

    @Override
    public void scheduleRetry(RequestContext next, Duration delay) {
        Timeout t = timer.newTimeout(
                new WheelTask(WheelTask.Kind.RETRY, next.getRequestId(), () -> dispatcher.accept(next)),
                delay.toMillis(),
                TimeUnit.MILLISECONDS
        );
        next.getHandle().attachRetry(t);
    }

    @Override
    public void deliver(RequestContext ctx, ApiResult result) {
        if (!ctx.getHandle().complete(result)) {
            log.debug("[Keyco-Client] late result dropped, request={}", ctx.getRequestId());
            return;
        }
        if (result.isSuccess()) {
            meter.incSuccess();
        } else {
            meter.incFailed();
        }
        meter.recordAttempts(ctx.getAttempt() + 1);
        meter.recordExecNanos(System.nanoTime() - ctx.getStartedNanos());
        Consumer<ApiResult> callback = ctx.getOnComplete();
        if (callback == null) {
            return;
        }
        try {
            delivery.execute(() -> {
                try {
                    callback.accept(result);
                } catch (RuntimeException e) {
                    log.error("[Keyco-Client] onComplete callback threw, request={}", ctx.getRequestId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Keyco-Client] delivery executor rejected result, request={}", ctx.getRequestId());
        }
    }
}
