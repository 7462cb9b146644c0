package com.keyco.core.spi;

import com.keyco.config.KeycoClientProperties;

import java.time.Duration;

/**
 * 退避策略（计算下一次重试前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * @param attempt 刚失败的那次尝试序号, 从 0 开始
     * @param props   读取 base/min/max/jitterRatio
     */
    Duration delay(int attempt, KeycoClientProperties props);
}
