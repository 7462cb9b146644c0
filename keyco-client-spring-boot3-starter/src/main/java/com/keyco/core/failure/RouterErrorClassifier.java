package com.keyco.core.failure;

import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.exception.ApiException;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.ErrorKind;

import java.util.Comparator;
import java.util.List;

public class RouterErrorClassifier implements ErrorClassifier {

    private final List<FailureCaseHandler<?>> handlers;

    public RouterErrorClassifier(List<FailureCaseHandler<?>> handlers) {
        this.handlers = handlers.stream().distinct().toList();
    }

    /**
     * 先本体再逐级 cause, 同时匹配时选择离异常类最近的处理器
     */
    @Override
    public ApiException classify(Throwable t, RequestContext ctx) {
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e);
            if (matched != null) {
                return safeCall(matched, e, ctx);
            }
        }
        return ApiException.of(ErrorKind.INVALID_RESPONSE, t == null ? "unknown failure" : t.toString(), t);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private ApiException safeCall(FailureCaseHandler h, Throwable e, RequestContext ctx) {
        return h.classify(e, ctx);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e) {
        return handlers.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // from 向上继承到 to 的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
