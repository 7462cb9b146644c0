package com.keyco.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 错误分类（封闭集合）
 * HTTP_ERROR 的用户提示由状态码决定, 见 ApiException#userMessage
 */
@AllArgsConstructor
@Getter
public enum ErrorKind {
    NETWORK_ERROR("Connection problem. Please try again."),
    HTTP_ERROR("Something went wrong. Please try again."),
    INVALID_RESPONSE("Something went wrong. Please try again."),
    INVALID_REQUEST("Couldn't process that. Please try again."),
    CIRCUIT_OPEN("AI isn't responding. Please try again."),
    TIMEOUT("Taking too long. Please try again."),
    NO_DATA("No response. Please try again."),
    NO_CONNECTIVITY("No internet. Please try again."),
    BACKEND_UNAVAILABLE("AI isn't responding. Please try again.")
    ;

    /** 面向用户的默认提示 */
    private final String userMessage;
}
