package com.keyco.core.spi.failure;

import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;

/**
 * 错误分类器: 传输/HTTP 异常 -> ApiException
 */
public interface ErrorClassifier {

    ApiException classify(Throwable t, RequestContext ctx);

    /** 分类后的去向 */
    enum Outcome { RETRY, FAIL, CANCELLED }
}
