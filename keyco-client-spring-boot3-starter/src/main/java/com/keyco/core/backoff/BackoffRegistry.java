package com.keyco.core.backoff;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy
 * - 未知名称回落到 exponential
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(8);

    private final KeycoClientProperties props;

    public BackoffRegistry(KeycoClientProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> register(p.name(), p));
        }
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT, new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry(KeycoClientProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry register(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /** 当前配置策略下的等待时长 */
    public BackoffPolicy current() {
        return resolve(props.getBackoff().getStrategy());
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        long min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        if (max < min) {
            throw new IllegalArgumentException("keyco.client.backoff.max must be >= keyco.client.backoff.min");
        }
        double jr = props.getBackoff().getJitterRatio();
        if (jr < 0 || jr >= 1) {
            throw new IllegalArgumentException("keyco.client.backoff.jitter-ratio must be in [0, 1)");
        }
        if (props.getRetry().getMaxRetries() < 0) {
            throw new IllegalArgumentException("keyco.client.retry.max-retries must be >= 0");
        }
        // 指数退避: 最后一次重试 (attempt = maxRetries - 1) 的抖动上界不能被 max 截断
        int maxRetries = props.getRetry().getMaxRetries();
        if (maxRetries > 0 && current() instanceof ExponentialJitterBackoffPolicy) {
            double upper = props.backoffBaseMillis() * Math.pow(2.0, maxRetries - 1) * (1 + jr);
            if (max < upper) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "keyco.client.backoff.max (%d ms) must be >= %.0f ms, the jittered delay of retry %d",
                        max, Math.ceil(upper), maxRetries));
            }
        }
    }
}
