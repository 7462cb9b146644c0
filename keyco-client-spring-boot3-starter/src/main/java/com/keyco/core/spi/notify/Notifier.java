package com.keyco.core.spi.notify;

import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.enums.Severity;

/**
 * 事件通知渠道（熔断打开/重试耗尽/兜底触发等）
 */
public interface Notifier {

    /** 渠道名称, 用于日志与指标 */
    String name();

    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 同步派发, 框架层负责异步调用
     */
    void notify(NotifyContext ctx, Severity severity);
}
