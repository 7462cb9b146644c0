package com.keyco.exception;

/**
 * 2xx 响应无法解析成 {text}
 */
public class InvalidResponseException extends RuntimeException {

    /** 响应体为空 */
    private final boolean empty;

    public InvalidResponseException(String message, boolean empty) {
        super(message);
        this.empty = empty;
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
        this.empty = false;
    }

    public boolean isEmpty() {
        return empty;
    }
}
