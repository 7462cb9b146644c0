package com.keyco.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 客户端配置（绑定前缀：keyco.client）
 *
 * YAML 示例：
 * keyco:
 *   client:
 *     enabled: true
 *     api-key: ${KEYCO_API_KEY:}
 *     default-locale: en-GB
 *     backend:
 *       base-url: https://keyco-backend.vercel.app
 *       health-path: /api/health
 *     timeouts:
 *       request: 15s
 *     retry:
 *       max-retries: 3
 *     backoff:
 *       strategy: exponential
 *       base: 1s
 *       min: 100ms
 *       max: 60s
 *       jitter-ratio: 0.3
 *     breaker:
 *       failure-threshold: 3
 *       cooldown: 8s
 *       half-open-timeout: 5s
 *     dedup:
 *       window: 5s
 *       retention: 5m
 *     preflight:
 *       connectivity-check-enabled: true
 *       connectivity-url: https://www.apple.com
 *       connectivity-timeout: 3s
 *       health-timeout: 2s
 *       watchdog-grace: 1s
 *     failsafe:
 *       timeout: 60s
 *     wheel:
 *       tick-duration: 50ms
 *       ticks-per-wheel: 512
 *     delivery:
 *       thread-name: keyco-delivery
 *     shutdown:
 *       await: 5s
 */
@ConfigurationProperties(prefix = "keyco.client")
public class KeycoClientProperties {

    /** 总开关 */
    private boolean enabled = true;

    /** Bearer 凭证, 未配置时不带 Authorization 头 */
    private String apiKey;

    /** 改写请求未指定 locale 时使用 */
    private String defaultLocale = "en-GB";

    /** 通知/日志中的客户端标识 */
    private String clientId = "keyco-keyboard";

    private Backend backend = new Backend();

    private Timeouts timeouts = new Timeouts();

    private Retry retry = new Retry();

    private Backoff backoff = new Backoff();

    private Breaker breaker = new Breaker();

    private Dedup dedup = new Dedup();

    private Preflight preflight = new Preflight();

    private Failsafe failsafe = new Failsafe();

    private Wheel wheel = new Wheel();

    private Delivery delivery = new Delivery();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Backend {
        private String baseUrl = "https://keyco-backend.vercel.app";

        private String healthPath = "/api/health";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }
    }

    public static class Timeouts {
        /** 单次请求超时（整个调用） */
        private Duration request = Duration.ofSeconds(15);

        public Duration getRequest() { return request; }
        public void setRequest(Duration request) { this.request = request; }
    }

    public static class Retry {
        /** 首次之后最多重试次数 */
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔 */
        private Duration base = Duration.ofSeconds(1);

        /** 最小间隔 */
        private Duration min = Duration.ofMillis(100);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(60);

        /** 抖动比例（0~1），0.3 表示 ±30% */
        private double jitterRatio = 0.3;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMin() { return min; }
        public void setMin(Duration min) { this.min = min; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Breaker {
        /** 连续失败达到阈值即打开 */
        private int failureThreshold = 3;

        /** 打开后的冷却时长, 建议 8s~30s */
        private Duration cooldown = Duration.ofSeconds(8);

        /** 半开窗口, 建议 5s~10s */
        private Duration halfOpenTimeout = Duration.ofSeconds(5);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
        public Duration getHalfOpenTimeout() { return halfOpenTimeout; }
        public void setHalfOpenTimeout(Duration halfOpenTimeout) { this.halfOpenTimeout = halfOpenTimeout; }
    }

    public static class Dedup {
        /** 判定重复的窗口 */
        private Duration window = Duration.ofSeconds(5);

        /** 记录保留时长, 超过即清理 */
        private Duration retention = Duration.ofMinutes(5);

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class Preflight {
        /** 首次尝试前探测外网连通性 */
        private boolean connectivityCheckEnabled = true;

        private String connectivityUrl = "https://www.apple.com";

        private Duration connectivityTimeout = Duration.ofSeconds(3);

        private Duration healthTimeout = Duration.ofSeconds(2);

        /** 探测超时后再等待的宽限, 之后视为失败 */
        private Duration watchdogGrace = Duration.ofSeconds(1);

        public boolean isConnectivityCheckEnabled() { return connectivityCheckEnabled; }
        public void setConnectivityCheckEnabled(boolean connectivityCheckEnabled) { this.connectivityCheckEnabled = connectivityCheckEnabled; }
        public String getConnectivityUrl() { return connectivityUrl; }
        public void setConnectivityUrl(String connectivityUrl) { this.connectivityUrl = connectivityUrl; }
        public Duration getConnectivityTimeout() { return connectivityTimeout; }
        public void setConnectivityTimeout(Duration connectivityTimeout) { this.connectivityTimeout = connectivityTimeout; }
        public Duration getHealthTimeout() { return healthTimeout; }
        public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }
        public Duration getWatchdogGrace() { return watchdogGrace; }
        public void setWatchdogGrace(Duration watchdogGrace) { this.watchdogGrace = watchdogGrace; }
    }

    public static class Failsafe {
        /** 与传输层超时无关的兜底上限 */
        private Duration timeout = Duration.ofSeconds(60);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(50);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 10_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Delivery {
        /** 回调交付线程名 */
        private String threadName = "keyco-delivery";

        public String getThreadName() { return threadName; }
        public void setThreadName(String threadName) { this.threadName = threadName; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(5);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getDefaultLocale() { return defaultLocale; }
    public void setDefaultLocale(String defaultLocale) { this.defaultLocale = defaultLocale; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }

    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }

    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }

    public Preflight getPreflight() { return preflight; }
    public void setPreflight(Preflight preflight) { this.preflight = preflight; }

    public Failsafe getFailsafe() { return failsafe; }
    public void setFailsafe(Failsafe failsafe) { this.failsafe = failsafe; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 退避：基础/最小/最大毫秒 */
    public long backoffBaseMillis() { return backoff.getBase().toMillis(); }
    public long backoffMinMillis() { return backoff.getMin().toMillis(); }
    public long backoffMaxMillis() { return backoff.getMax().toMillis(); }

    /** 去掉末尾 / 的后端地址 */
    public String normalizedBaseUrl() {
        String u = backend.getBaseUrl();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
