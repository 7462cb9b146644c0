package com.keyco.core.failure.decider;

import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.exception.HttpStatusException;
import com.keyco.model.ctx.RequestContext;

/**
 * 状态码错误, 是否重试由状态码决定（5xx / 429）
 */
public class HttpStatusHandler implements FailureCaseHandler<HttpStatusException> {
    @Override
    public Class<HttpStatusException> exceptionType() {
        return HttpStatusException.class;
    }

    @Override
    public ApiException classify(HttpStatusException ex, RequestContext ctx) {
        return ApiException.http(ex.getStatusCode(), ex.getDetail());
    }
}
