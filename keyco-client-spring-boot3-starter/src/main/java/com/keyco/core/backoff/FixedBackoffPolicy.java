package com.keyco.core.backoff;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, KeycoClientProperties props) {
        long base = props.backoffBaseMillis(), min = props.backoffMinMillis(), max = props.backoffMaxMillis();
        double jr = props.getBackoff().getJitterRatio();

        long delay = base;
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * base);
        }
        return Duration.ofMillis(Math.max(min, Math.min(delay, max)));
    }
}
