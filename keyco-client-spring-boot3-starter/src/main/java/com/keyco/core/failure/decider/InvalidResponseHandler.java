package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.exception.InvalidResponseException;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;

public class InvalidResponseHandler implements FailureCaseHandler<InvalidResponseException> {
    @Override
    public Class<InvalidResponseException> exceptionType() {
        return InvalidResponseException.class;
    }

    @Override
    public ApiException classify(InvalidResponseException ex, RequestContext ctx) {
        ErrorKind kind = ex.isEmpty() ? ErrorKind.NO_DATA : ErrorKind.INVALID_RESPONSE;
        return ApiException.of(kind, ex.getMessage(), ex);
    }
}
