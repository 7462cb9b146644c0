package com.keyco.core.breaker;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.NotifyContexts;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.exception.ApiException;
import com.keyco.model.enums.Severity;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 后端熔断器, 状态机由 Resilience4j CircuitBreaker 承载
 * Closed --最近 N 次全部失败--> Open --冷却结束--> HalfOpen --成功--> Closed
 * HalfOpen 失败/探测失败/窗口超时 --> Open(重新冷却)
 * Open/HalfOpen 的截止时间取自注入的 Clock, 到期后在 currentState() 中显式迁移
 */
@Slf4j
public class BackendCircuitBreaker {

    /** 截止时间检查与显式迁移在同一把锁内完成 */
    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;

    private final Duration cooldown;

    private final Duration halfOpenTimeout;

    private final CircuitBreaker circuitBreaker;

    private final ClientMetrics metrics;

    private final NotifyingFacade notifier;

    private final String clientId;

    /** 由状态迁移事件写入 */
    private volatile CircuitState state = CircuitState.closed();

    /** 下一次关闭事件的原因 */
    private volatile String closeCause = "success";

    public BackendCircuitBreaker(KeycoClientProperties props, Clock clock,
                                 ClientMetrics metrics, NotifyingFacade notifier) {
        KeycoClientProperties.Breaker cfg = props.getBreaker();
        if (cfg.getFailureThreshold() < 1) {
            throw new IllegalArgumentException("keyco.client.breaker.failure-threshold must be >= 1");
        }
        if (cfg.getCooldown().isNegative() || cfg.getHalfOpenTimeout().isNegative()) {
            throw new IllegalArgumentException("keyco.client.breaker durations must not be negative");
        }
        this.clock = clock;
        this.cooldown = cfg.getCooldown();
        this.halfOpenTimeout = cfg.getHalfOpenTimeout();
        this.metrics = metrics;
        this.notifier = notifier;
        this.clientId = props.getClientId();

        // 窗口大小 = 阈值且要求 100% 失败, 等价于连续 N 次失败
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cfg.getFailureThreshold())
                .minimumNumberOfCalls(cfg.getFailureThreshold())
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                // 迁移由 currentState() 按注入时钟驱动, 此处只作兜底
                .waitDurationInOpenState(cooldown.compareTo(Duration.ofMillis(1)) < 0 ? Duration.ofMillis(1) : cooldown)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.circuitBreaker = CircuitBreaker.of("keyco-backend-" + clientId, config);
        this.circuitBreaker.getEventPublisher().onStateTransition(this::onTransition);
    }

    /**
     * 读取当前状态, 到期的 Open/HalfOpen 在此推进
     */
    public CircuitState currentState() {
        lock.lock();
        try {
            CircuitState s = state;
            if (s.isClosed() || clock.instant().isBefore(s.getUntil())) {
                return s;
            }
            if (s.isOpen()) {
                circuitBreaker.transitionToHalfOpenState();
            } else {
                circuitBreaker.transitionToOpenState();
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 成功: 非 Closed 时强制关闭
     */
    public void recordSuccess() {
        lock.lock();
        try {
            closeCause = "success";
            circuitBreaker.onSuccess(0, TimeUnit.NANOSECONDS);
            if (circuitBreaker.getState() != CircuitBreaker.State.CLOSED) {
                circuitBreaker.transitionToClosedState();
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(ApiException error) {
        lock.lock();
        try {
            currentState();
            circuitBreaker.onError(0, TimeUnit.NANOSECONDS, error);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 健康探测失败: 半开则重新打开, 打开则保持
     */
    public void recordProbeFailure() {
        lock.lock();
        try {
            if (currentState().isHalfOpen()) {
                circuitBreaker.transitionToOpenState();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 健康探测通过后强制关闭
     */
    public void reset() {
        lock.lock();
        try {
            closeCause = "reset";
            if (circuitBreaker.getState() == CircuitBreaker.State.CLOSED) {
                // 清空窗口内的失败
                circuitBreaker.reset();
            } else {
                circuitBreaker.transitionToClosedState();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 占用半开试探名额, 已被占用返回 false
     */
    public boolean tryAcquireTrial() {
        return circuitBreaker.tryAcquirePermission();
    }

    /**
     * 归还试探名额, 每次成功占用只可调用一次
     */
    public void releaseTrial() {
        circuitBreaker.releasePermission();
    }

    /**
     * 最近 failureThreshold 次调用中的失败数
     */
    public int recentFailures() {
        return circuitBreaker.getMetrics().getNumberOfFailedCalls();
    }

    private void onTransition(CircuitBreakerOnStateTransitionEvent event) {
        Instant now = clock.instant();
        CircuitBreaker.StateTransition transition = event.getStateTransition();
        switch (transition.getToState()) {
            case OPEN -> {
                state = CircuitState.open(now.plus(cooldown));
                int failures = recentFailures();
                log.warn("[Breaker] opened: recentFailures={}, until={}", failures, state.getUntil());
                metrics.incCircuitOpened();
                notifier.fire(NotifyContexts.ctxForCircuitOpened(clientId, state.getUntil(), failures, clock), Severity.ERROR);
            }
            case HALF_OPEN -> {
                state = CircuitState.halfOpen(now.plus(halfOpenTimeout));
                log.info("[Breaker] half-open until {}: next request is a trial", state.getUntil());
            }
            case CLOSED -> {
                state = CircuitState.closed();
                String cause = closeCause;
                log.info("[Breaker] closed by {}", cause);
                notifier.fire(NotifyContexts.ctxForCircuitClosed(clientId, cause, clock), Severity.INFO);
            }
            default -> log.warn("[Breaker] unexpected transition {}", transition);
        }
    }
}
