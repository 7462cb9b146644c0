package com.keyco.exception;

/**
 * 后端返回了错误状态码, 或 2xx 响应体中带有 error 字段
 */
public class HttpStatusException extends RuntimeException {

    private final int statusCode;

    private final String detail;

    public HttpStatusException(int statusCode, String detail) {
        super("backend responded " + statusCode + (detail == null || detail.isEmpty() ? "" : ": " + detail));
        this.statusCode = statusCode;
        this.detail = detail == null ? "" : detail;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }
}
