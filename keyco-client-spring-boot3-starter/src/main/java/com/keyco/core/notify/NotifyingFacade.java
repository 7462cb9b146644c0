package com.keyco.core.notify;

import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

public class NotifyingFacade {

    private static final NotifyingFacade NOOP = new NotifyingFacade(() -> null);

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用 notify 则为 null
        this(p::getIfAvailable);
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade noop() {
        return NOOP;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
