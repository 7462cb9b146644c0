package com.keyco.core.failure.handler;

import com.keyco.core.engine.ExecutorOps;
import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.OutcomeHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ApiResult;
import com.keyco.model.ctx.RequestContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 取消: 不重试, 不计入熔断
 */
@Slf4j
public class CancelledOutcomeHandler implements OutcomeHandler {

    @Override
    public ErrorClassifier.Outcome support() {
        return ErrorClassifier.Outcome.CANCELLED;
    }

    @Override
    public void handle(RequestContext ctx, ApiException error, ExecutorOps ops) {
        log.info("[Keyco-Client] op={} request={} cancelled at attempt {}",
                ctx.getRequest().operation(), ctx.getRequestId(), ctx.getAttempt());
        ops.deliver(ctx, ApiResult.failure(error));
    }
}
