package com.keyco.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.TimeUnit;

public final class ClientMetrics {
    private final MeterRegistry registry;
    private final Counter requests;
    private final Counter success;
    private final Counter failed;
    private final Counter retries;
    private final Counter dedupSuppressed;
    private final Counter circuitOpened;
    private final Counter failsafeFired;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private ClientMetrics(MeterRegistry reg) {
        this.registry = reg;
        this.requests = Counter.builder("keyco.client.requests").description("logical requests submitted").register(reg);
        this.success  = Counter.builder("keyco.client.success").description("requests succeeded").register(reg);
        this.failed   = Counter.builder("keyco.client.failed").description("requests failed").register(reg);
        this.retries  = Counter.builder("keyco.client.retries").description("retries scheduled").register(reg);
        this.dedupSuppressed = Counter.builder("keyco.client.dedup.suppressed").description("duplicates suppressed").register(reg);
        this.circuitOpened = Counter.builder("keyco.client.circuit.opened").description("breaker trips").register(reg);
        this.failsafeFired = Counter.builder("keyco.client.failsafe.fired").description("fail-safe completions").register(reg);
        this.notifySuppressed = Counter.builder("keyco.client.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("keyco.client.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("keyco.client.notify.failed").description("notify failed").register(reg);
        this.attempts = DistributionSummary.builder("keyco.client.attempts")
                .description("attempt count per request").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("keyco.client.exec.time").description("request time until delivery").register(reg);
    }

    public static ClientMetrics create(MeterRegistry reg) { return new ClientMetrics(reg); }

    /**
     * 绑定到应用已有的注册表: 无则 Simple, 单个直接使用, 多个合并为 Composite
     */
    public static ClientMetrics bindTo(List<MeterRegistry> registries) {
        if (registries == null || registries.isEmpty()) {
            return simple();
        }
        if (registries.size() == 1) {
            return create(registries.get(0));
        }
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        registries.forEach(composite::add);
        return create(composite);
    }

    /** 手工构造客户端或测试时使用 */
    public static ClientMetrics simple() { return new ClientMetrics(new SimpleMeterRegistry()); }

    public MeterRegistry registry() { return registry; }

    public void incRequests(){ requests.increment(); }
    public void incSuccess(){  success.increment(); }
    public void incFailed(){   failed.increment(); }
    public void incRetries(){  retries.increment(); }
    public void incDedupSuppressed(){ dedupSuppressed.increment(); }
    public void incCircuitOpened(){ circuitOpened.increment(); }
    public void incFailsafeFired(){ failsafeFired.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
