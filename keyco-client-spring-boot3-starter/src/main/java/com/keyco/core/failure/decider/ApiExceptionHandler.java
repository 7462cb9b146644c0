package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;

/**
 * 已分类的错误原样返回
 */
public class ApiExceptionHandler implements FailureCaseHandler<ApiException> {
    @Override
    public Class<ApiException> exceptionType() {
        return ApiException.class;
    }

    @Override
    public ApiException classify(ApiException ex, RequestContext ctx) {
        return ex;
    }
}
