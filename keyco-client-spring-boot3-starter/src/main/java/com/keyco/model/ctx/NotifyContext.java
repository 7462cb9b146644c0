package com.keyco.model.ctx;

import com.keyco.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;
    private String clientId;
    // rewrite / chat, 熔断事件为空
    private String operation;
    private String requestId;
    private Integer attempt;
    private Integer maxRetries;
    // 分类码, 如 HTTP_503 / TIMEOUT / CIRCUIT
    private String reasonCode;
    // 只包含错误摘要, 不包含用户原文
    private String lastError;
    private Instant when;
    // 额外字段: state / until / recentFailures 等
    private Map<String, Object> attributes;
}
