package com.keyco.core.notify.route;

import com.keyco.core.spi.notify.Notifier;
import com.keyco.core.spi.notify.NotifierRouter;
import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;

import java.util.List;

/**
 * 按 supports 过滤已注册渠道
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers.stream().filter(n -> n.supports(ctx)).toList();
    }
}
