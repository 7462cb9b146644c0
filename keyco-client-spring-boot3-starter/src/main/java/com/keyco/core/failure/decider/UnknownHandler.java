package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;

/**
 * 未知异常, 兜底不重试
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public ApiException classify(Throwable ex, RequestContext ctx) {
        return ApiException.of(ErrorKind.INVALID_RESPONSE, ex.toString(), ex);
    }
}
