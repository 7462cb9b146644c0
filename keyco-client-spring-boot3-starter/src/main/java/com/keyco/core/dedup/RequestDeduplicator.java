package com.keyco.core.dedup;

import com.keyco.config.KeycoClientProperties;
import com.keyco.model.ApiResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 抑制短时间内的重复请求
 * 每次查询前先清理超过保留期的记录; 窗口内已有同键记录即为重复, 否则写入/刷新记录
 */
@Slf4j
public class RequestDeduplicator {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, DedupRecord> records = new HashMap<>();

    private final Clock clock;

    private final Duration window;

    private final Duration retention;

    public RequestDeduplicator(KeycoClientProperties props, Clock clock) {
        this(props.getDedup().getWindow(), props.getDedup().getRetention(), clock);
    }

    public RequestDeduplicator(Duration window, Duration retention, Clock clock) {
        if (retention.compareTo(window) < 0) {
            throw new IllegalArgumentException("keyco.client.dedup.retention must be >= keyco.client.dedup.window");
        }
        this.window = window;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * 重复返回 true, 否则记录该键并返回 false
     */
    public boolean isDuplicate(String key) {
        return check(key, null).isPresent();
    }

    /**
     * 重复时返回窗口内的原记录; 否则以 result 登记新记录并返回 empty
     */
    public Optional<DedupRecord> check(String key, CompletableFuture<ApiResult> result) {
        lock.lock();
        try {
            Instant now = clock.instant();
            purge(now);
            DedupRecord existing = records.get(key);
            if (existing != null && Duration.between(existing.getFirstSeen(), now).compareTo(window) < 0) {
                log.debug("[Dedup] suppressed key={}", key);
                return Optional.of(existing);
            }
            records.put(key, new DedupRecord(key, now, result));
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    // 须持锁调用
    private void purge(Instant now) {
        Instant cutoff = now.minus(retention);
        records.values().removeIf(r -> r.getFirstSeen().isBefore(cutoff));
    }
}
