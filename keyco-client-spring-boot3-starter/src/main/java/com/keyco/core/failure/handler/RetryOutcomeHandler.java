package com.keyco.core.failure.handler;

import com.keyco.core.engine.ExecutorOps;
import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.OutcomeHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ApiResult;
import com.keyco.model.ctx.RequestContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;

/**
 * 重试处理: 按退避入时间轮, 重试对调用方静默
 */
@Slf4j
public class RetryOutcomeHandler implements OutcomeHandler {

    @Override
    public ErrorClassifier.Outcome support() {
        return ErrorClassifier.Outcome.RETRY;
    }

    @Override
    public void handle(RequestContext ctx, ApiException error, ExecutorOps ops) {
        if (!ops.running().getAsBoolean()) {
            ops.deliver(ctx, ApiResult.failure(error));
            return;
        }
        Duration delay = ops.scheduler().delay(ctx.getAttempt());
        RequestContext next = ctx.nextAttempt();
        log.info("[Retry] op={} request={} attempt {}/{} in {} ms, reason={}",
                ctx.getRequest().operation(), ctx.getRequestId(), next.getAttempt(), ctx.getMaxRetries(),
                delay.toMillis(), error.getMessage());
        ops.meter().incRetries();
        try {
            ops.scheduleRetry(next, delay);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或挂起任务已满
            log.warn("[Retry] request={} could not be scheduled: {}", ctx.getRequestId(), e.toString());
            ops.deliver(ctx, ApiResult.failure(error));
        }
    }
}
