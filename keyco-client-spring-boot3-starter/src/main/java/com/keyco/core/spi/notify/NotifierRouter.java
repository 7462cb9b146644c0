package com.keyco.core.spi.notify;

import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;

import java.util.List;

/**
 * 根据事件选择若干 Notifier
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
