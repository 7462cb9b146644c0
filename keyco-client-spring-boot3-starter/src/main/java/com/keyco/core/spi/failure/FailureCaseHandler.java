package com.keyco.core.spi.failure;

import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;

/**
 * 异常分类处理器 SPI
 */
public interface FailureCaseHandler<E extends Throwable> {

    /**
     * 返回能够处理的异常类型
     */
    Class<E> exceptionType();

    /** 是否匹配 */
    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    /** 归入封闭错误集合 */
    ApiException classify(E ex, RequestContext ctx);
}
