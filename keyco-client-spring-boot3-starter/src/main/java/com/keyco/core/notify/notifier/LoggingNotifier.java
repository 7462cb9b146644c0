package com.keyco.core.notify.notifier;

import com.keyco.core.spi.notify.Notifier;
import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] op={}, request={}, attempt={}/{}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getOperation(), ctx.getRequestId(), ctx.getAttempt(), ctx.getMaxRetries(),
                    ctx.getReasonCode(), ctx.getLastError(), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] op={}, request={}, reason={}, attrs={}",
                    ctx.getType(), ctx.getOperation(), ctx.getRequestId(), ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] client={}, attrs={}", ctx.getType(), ctx.getClientId(), ctx.getAttributes());
        }
    }
}
