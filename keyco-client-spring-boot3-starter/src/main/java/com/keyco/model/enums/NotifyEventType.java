package com.keyco.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 熔断打开 */
    CIRCUIT_OPENED,

    /** 熔断恢复（成功 / 健康探测通过 / 手动重置） */
    CIRCUIT_CLOSED,

    /** 重试次数耗尽 */
    RETRY_EXHAUSTED,

    /** 不可重试的失败 */
    NON_RETRYABLE_FAILED,

    /** 兜底定时器强制结束请求 */
    FAILSAFE_FIRED
}
