package com.keyco.core.failure.handler;

import com.keyco.core.engine.ExecutorOps;
import com.keyco.core.notify.NotifyContexts;
import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.OutcomeHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ApiResult;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

/**
 * 终态失败: 计入熔断, 标注耗尽, 通知并交付
 */
@Slf4j
public class TerminalOutcomeHandler implements OutcomeHandler {

    @Override
    public ErrorClassifier.Outcome support() {
        return ErrorClassifier.Outcome.FAIL;
    }

    @Override
    public void handle(RequestContext ctx, ApiException error, ExecutorOps ops) {
        ApiException fin = ops.scheduler().finalError(error, ctx.getAttempt());
        if (ops.countsAgainstBreaker(fin)) {
            ops.breaker().recordFailure(fin);
        }
        if (fin.getRetriesExhausted() > 0) {
            log.warn("[Retry] op={} request={} exhausted after {} retries: {}",
                    ctx.getRequest().operation(), ctx.getRequestId(), fin.getRetriesExhausted(), fin.getMessage());
            ops.notifier().fire(NotifyContexts.ctxForRetryExhausted(ops.clientId(), ctx, fin, ops.clock()), Severity.WARNING);
        } else if (!ops.isLocal(fin.getKind())) {
            log.warn("[Keyco-Client] op={} request={} attempt={} failed: {}",
                    ctx.getRequest().operation(), ctx.getRequestId(), ctx.getAttempt(), fin.getMessage());
            ops.notifier().fire(NotifyContexts.ctxForNonRetryable(ops.clientId(), ctx, fin, ops.clock()), Severity.WARNING);
        } else {
            log.info("[Keyco-Client] op={} request={} rejected locally: {}",
                    ctx.getRequest().operation(), ctx.getRequestId(), fin.getKind());
        }
        ops.deliver(ctx, ApiResult.failure(fin));
    }
}
