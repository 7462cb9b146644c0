package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;

import java.io.IOException;

/**
 * 其余传输错误（DNS、连接被拒、连接重置等）, 可重试
 */
public class IoFailureHandler implements FailureCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public ApiException classify(IOException ex, RequestContext ctx) {
        String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return ApiException.network(detail, ex);
    }
}
