package com.keyco.core.notify;

import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.spi.notify.Notifier;
import com.keyco.core.spi.notify.NotifierFilter;
import com.keyco.core.spi.notify.NotifierRouter;
import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发, 不占用请求路径
 */
public class AsyncNotifyingService {

    private static final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private static final int MAX_ATTEMPTS = 3;

    private static final long INITIAL_BACKOFF_MS = 200;

    private static final long MAX_BACKOFF_MS = 4000;

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final ClientMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, ClientMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> router.route(ctx, sev).forEach(n -> deliver(n, ctx, sev)));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] event={} dropped: executor rejected", ctx.getType());
        }
    }

    private void deliver(Notifier n, NotifyContext ctx, Severity sev) {
        long backoff = INITIAL_BACKOFF_MS;
        for (int attempt = 1; ; attempt++) {
            try {
                n.notify(ctx, sev);
                metrics.incNotifySent();
                return;
            } catch (RuntimeException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    metrics.incNotifyFailed();
                    log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
                    return;
                }
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                return;
            }
            // 指数退避
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
        }
    }

    public void shutdown() {
        exec.shutdown();
    }
}
