package com.keyco.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 后端健康状态, 供 UI 主动检查
 */
@Getter
@ToString
@AllArgsConstructor
public class BackendStatus {

    private final boolean healthy;

    /** 健康时为 null */
    private final String message;

    public static BackendStatus of(boolean healthy) {
        return new BackendStatus(healthy, healthy ? null : "Backend service unavailable");
    }
}
