package com.keyco.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "keyco.client.notify")
public class KeycoNotifierProperties {

    private boolean enabled = false;

    private Async async = new Async();

    private RateLimit rateLimit = new RateLimit();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }
    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    public static class Async {
        /** 键盘进程资源紧张, 默认单线程 */
        private int corePoolSize = 1;

        private int maxPoolSize = 2;

        private int queueCapacity = 200;

        private Duration keepAlive = Duration.ofSeconds(30);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    public static class RateLimit {
        private Duration window = Duration.ofSeconds(30);

        /** 同类事件窗口内最多放行次数 */
        private int threshold = 20;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
    }
}
