package com.keyco.core;

import com.keyco.config.KeycoClientProperties;
import com.keyco.config.KeycoNotifierProperties;
import com.keyco.core.engine.ApiRequestExecutor;
import com.keyco.core.notify.AsyncNotifyingService;
import com.keyco.model.WheelTask;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class KeycoClientLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(KeycoClientLifecycle.class);

    private final ApiRequestExecutor executor;

    private final Timer timer;

    private final ExecutorService delivery;

    private final AsyncNotifyingService notifyService;

    private final KeycoClientProperties props;

    private final KeycoNotifierProperties notifyProps;

    /** OkHttpClient 由本客户端创建时才关闭其调度器与连接池 */
    private final boolean ownsHttpClient;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public KeycoClientLifecycle(ApiRequestExecutor executor, Timer timer, ExecutorService delivery,
                                AsyncNotifyingService notifyService,
                                KeycoClientProperties props, KeycoNotifierProperties notifyProps,
                                boolean ownsHttpClient) {
        this.executor = executor;
        this.timer = timer;
        this.delivery = delivery;
        this.notifyService = notifyService;
        this.props = props;
        this.notifyProps = notifyProps;
        this.ownsHttpClient = ownsHttpClient;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ KeycoApiClient starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ clientId                : {}", props.getClientId());
            log.info("│ backend.baseUrl         : {}", props.normalizedBaseUrl());
            log.info("│ timeouts.request        : {} ms", props.getTimeouts().getRequest().toMillis());
            log.info("│ retry.maxRetries        : {}", props.getRetry().getMaxRetries());
            log.info("│ backoff.strategy        : {}", props.getBackoff().getStrategy());
            log.info("│ breaker.threshold       : {}", props.getBreaker().getFailureThreshold());
            log.info("│ breaker.cooldown        : {} ms", props.getBreaker().getCooldown().toMillis());
            log.info("│ breaker.halfOpenTimeout : {} ms", props.getBreaker().getHalfOpenTimeout().toMillis());
            log.info("│ dedup.window            : {} ms", props.getDedup().getWindow().toMillis());
            log.info("│ preflight.connectivity  : {}", props.getPreflight().isConnectivityCheckEnabled());
            log.info("│ failsafe.timeout        : {} ms", props.getFailsafe().getTimeout().toMillis());
            log.info("│ apiKey.configured       : {}", props.getApiKey() != null && !props.getApiKey().isBlank());
            log.info("│ notifier.enabled        : {}", notifyProps.isEnabled());
            log.info("│ http.ownedByClient      : {}", ownsHttpClient);
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Keyco-Client] failed to render startup banner: {}", t.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Keyco-Client] stop skipped: already stopped");
            return;
        }
        log.info("[Keyco-Client] stopping...");
        long awaitMs = props.getShutdown().getAwait().toMillis();
        try {
            executor.shutdown();
            // 未到期的重试立即以关闭失败交付
            Set<Timeout> pending = timer.stop();
            int drained = 0;
            for (Timeout t : pending) {
                if (t.task() instanceof WheelTask) {
                    WheelTask task = (WheelTask) t.task();
                    if (task.getKind() == WheelTask.Kind.RETRY) {
                        task.fire();
                        drained++;
                    }
                }
            }
            if (drained > 0) {
                log.info("[Keyco-Client] {} pending retries resolved as shut down", drained);
            }
            int aborted = executor.abortInFlight();
            if (aborted > 0) {
                log.info("[Keyco-Client] {} in-flight requests resolved as shut down", aborted);
            }
            OkHttpClient http = executor.http();
            if (ownsHttpClient) {
                // 预检探测等剩余调用
                http.dispatcher().cancelAll();
            }
            delivery.shutdown();
            if (!delivery.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Keyco-Client] delivery executor did not drain within {} ms", awaitMs);
                delivery.shutdownNow();
            }
            if (ownsHttpClient) {
                http.dispatcher().executorService().shutdown();
                http.connectionPool().evictAll();
            }
            if (notifyService != null) {
                notifyService.shutdown();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delivery.shutdownNow();
        } finally {
            log.info("[Keyco-Client] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
