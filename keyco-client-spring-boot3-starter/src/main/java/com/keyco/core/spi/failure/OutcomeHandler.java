package com.keyco.core.spi.failure;

import com.keyco.core.engine.ExecutorOps;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;

/**
 * 根据去向作出处理
 */
public interface OutcomeHandler {

    ErrorClassifier.Outcome support();

    void handle(RequestContext ctx, ApiException error, ExecutorOps ops);
}
