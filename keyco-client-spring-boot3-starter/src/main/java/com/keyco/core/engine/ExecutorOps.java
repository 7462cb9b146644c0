package com.keyco.core.engine;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.backoff.RetryScheduler;
import com.keyco.core.breaker.BackendCircuitBreaker;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.exception.ApiException;
import com.keyco.model.ApiResult;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * 只暴露去向处理器需要的能力
 */
public interface ExecutorOps {

    String clientId();

    KeycoClientProperties props();

    Clock clock();

    BackendCircuitBreaker breaker();

    RetryScheduler scheduler();

    NotifyingFacade notifier();

    ClientMetrics meter();

    /** 客户端是否在运行 */
    BooleanSupplier running();

    /** 在时间轮上安排下一次尝试 */
    void scheduleRetry(RequestContext next, Duration delay);

    /** 在交付线程上完成请求, 只生效一次 */
    void deliver(RequestContext ctx, ApiResult result);

    /**
     * 终态失败是否计入熔断
     * 取消、本地拦截（参数/断网/熔断/后端不可用）与 2xx 上的解析错误都不计入
     */
    default boolean countsAgainstBreaker(ApiException e) {
        if (e.isCancelled()) {
            return false;
        }
        return switch (e.getKind()) {
            case NETWORK_ERROR, TIMEOUT -> true;
            case HTTP_ERROR -> e.getStatusCode() == null || e.getStatusCode() < 200 || e.getStatusCode() >= 300;
            default -> false;
        };
    }

    /** 本地拦截的错误, 没有发出主请求 */
    default boolean isLocal(ErrorKind kind) {
        return kind == ErrorKind.INVALID_REQUEST || kind == ErrorKind.NO_CONNECTIVITY
                || kind == ErrorKind.BACKEND_UNAVAILABLE || kind == ErrorKind.CIRCUIT_OPEN;
    }
}
