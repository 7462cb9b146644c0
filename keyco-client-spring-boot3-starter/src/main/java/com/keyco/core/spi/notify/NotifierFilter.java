package com.keyco.core.spi.notify;

import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;

/**
 * 过滤器：限流、去抖
 */
public interface NotifierFilter {

    /** true 放行, false 抑制 */
    boolean allow(NotifyContext ctx, Severity severity);
}
