package com.keyco.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 后端逻辑操作
 */
@AllArgsConstructor
@Getter
public enum Operation {
    REWRITE("/api/rewrite"),
    CHAT("/api/chat")
    ;

    public final String path;
}
