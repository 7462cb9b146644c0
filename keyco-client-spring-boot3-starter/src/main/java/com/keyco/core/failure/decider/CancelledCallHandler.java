package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.exception.CallCancelledException;
import com.keyco.model.ctx.RequestContext;

/**
 * 调用方取消, 不重试
 */
public class CancelledCallHandler implements FailureCaseHandler<CallCancelledException> {
    @Override
    public Class<CallCancelledException> exceptionType() {
        return CallCancelledException.class;
    }

    @Override
    public ApiException classify(CallCancelledException ex, RequestContext ctx) {
        return ApiException.cancelled();
    }
}
