package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;

import java.io.InterruptedIOException;

/**
 * 超时处理, OkHttp 的 callTimeout 与 SocketTimeoutException 都落在这里
 */
public class TimeoutHandler implements FailureCaseHandler<InterruptedIOException> {
    @Override
    public Class<InterruptedIOException> exceptionType() {
        return InterruptedIOException.class;
    }

    @Override
    public ApiException classify(InterruptedIOException ex, RequestContext ctx) {
        return ApiException.of(ErrorKind.TIMEOUT, ex.getMessage(), ex);
    }
}
