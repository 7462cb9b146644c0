package com.keyco.core.backoff;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * base * 2^attempt, 按 ±jitterRatio 均匀抖动, 再夹在 [min, max]
 * BackoffRegistry 启动时保证 max 不小于最后一次重试的抖动上界, 截断只对超出 maxRetries 的调用生效
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, KeycoClientProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        // attempt 从 0 开始: 0 -> base, 1 -> base * 2 ...
        double ideal = Math.min((double) Long.MAX_VALUE, base * Math.pow(2.0, Math.max(0, attempt)));

        double jittered = ideal;
        if (jr > 0) {
            jittered = ideal + ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal;
        }
        long delay = Math.max(min, Math.min(Math.round(jittered), max));
        return Duration.ofMillis(Math.max(0, delay));
    }
}
