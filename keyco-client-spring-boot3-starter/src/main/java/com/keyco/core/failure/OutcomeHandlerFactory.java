package com.keyco.core.failure;

import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.OutcomeHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 去向处理器注册中心, 未注册的去向按 FAIL 处理
 */
public class OutcomeHandlerFactory {

    private final Map<ErrorClassifier.Outcome, OutcomeHandler> handlers = new EnumMap<>(ErrorClassifier.Outcome.class);

    public OutcomeHandlerFactory(List<OutcomeHandler> discovered) {
        if (discovered != null) {
            discovered.forEach(h -> register(h.support(), h));
        }
        if (!handlers.containsKey(ErrorClassifier.Outcome.FAIL)) {
            throw new IllegalArgumentException("an OutcomeHandler for FAIL must be registered");
        }
    }

    public OutcomeHandler get(ErrorClassifier.Outcome outcome) {
        return handlers.getOrDefault(outcome, handlers.get(ErrorClassifier.Outcome.FAIL));
    }

    public OutcomeHandlerFactory register(ErrorClassifier.Outcome outcome, OutcomeHandler handler) {
        handlers.put(outcome, handler);
        return this;
    }

    /** 列出已注册去向 */
    public Set<ErrorClassifier.Outcome> names() { return Collections.unmodifiableSet(handlers.keySet()); }
}
