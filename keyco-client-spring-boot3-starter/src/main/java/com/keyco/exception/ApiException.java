package com.keyco.exception;

import com.keyco.model.enums.ErrorKind;

/**
 * 客户端统一错误
 * 分类一次, 同时携带重试指令与用户提示, 下游不再解读原始状态码
 */
public class ApiException extends RuntimeException {

    private final ErrorKind kind;

    /** 仅 HTTP_ERROR 有值 */
    private final Integer statusCode;

    private final String detail;

    /** 调用方主动取消 */
    private final boolean cancelled;

    /** 已耗尽的重试次数, 0 表示未标注 */
    private final int retriesExhausted;

    private ApiException(ErrorKind kind, Integer statusCode, String detail, boolean cancelled,
                         int retriesExhausted, Throwable cause) {
        super(render(kind, statusCode, detail, retriesExhausted), cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.detail = detail == null ? "" : detail;
        this.cancelled = cancelled;
        this.retriesExhausted = retriesExhausted;
    }

    public static ApiException of(ErrorKind kind) {
        return new ApiException(kind, null, null, false, 0, null);
    }

    public static ApiException of(ErrorKind kind, String detail) {
        return new ApiException(kind, null, detail, false, 0, null);
    }

    public static ApiException of(ErrorKind kind, String detail, Throwable cause) {
        return new ApiException(kind, null, detail, false, 0, cause);
    }

    public static ApiException http(int statusCode, String detail) {
        return new ApiException(ErrorKind.HTTP_ERROR, statusCode, detail, false, 0, null);
    }

    public static ApiException network(String detail, Throwable cause) {
        return new ApiException(ErrorKind.NETWORK_ERROR, null, detail, false, 0, cause);
    }

    public static ApiException cancelled() {
        return new ApiException(ErrorKind.NETWORK_ERROR, null, "Request cancelled", true, 0, null);
    }

    /**
     * 标注重试耗尽, 返回新实例
     */
    public ApiException withRetriesExhausted(int retries) {
        return new ApiException(kind, statusCode, detail, cancelled, retries, getCause());
    }

    /**
     * 是否可重试, 只由分类/状态码/取消标记决定
     */
    public boolean shouldRetry() {
        switch (kind) {
            case NETWORK_ERROR:
                return !cancelled;
            case TIMEOUT:
                return true;
            case HTTP_ERROR:
                return statusCode != null && (statusCode == 429 || (statusCode >= 500 && statusCode <= 599));
            default:
                return false;
        }
    }

    /**
     * 面向用户的短提示, 与重试决策无关
     */
    public String userMessage() {
        String base = kind == ErrorKind.HTTP_ERROR && statusCode != null
                ? statusMessage(statusCode)
                : kind.getUserMessage();
        if (retriesExhausted > 0) {
            return base + " Retried " + retriesExhausted + " times without success.";
        }
        return base;
    }

    public static String statusMessage(int statusCode) {
        return switch (statusCode) {
            case 400 -> "Couldn't process that. Please try again.";
            case 401 -> "Authentication problem. Please try again.";
            case 403 -> "Access denied. Please try again.";
            case 404 -> "Couldn't find that. Please try again.";
            case 429 -> "Too many requests. Please wait and try again.";
            case 500, 502, 503 -> "AI isn't responding. Please try again.";
            case 504 -> "Taking too long. Please try again.";
            default -> "Something went wrong. Please try again.";
        };
    }

    public ErrorKind getKind() { return kind; }

    public Integer getStatusCode() { return statusCode; }

    public String getDetail() { return detail; }

    public boolean isCancelled() { return cancelled; }

    public int getRetriesExhausted() { return retriesExhausted; }

    private static String render(ErrorKind kind, Integer statusCode, String detail, int retries) {
        StringBuilder sb = new StringBuilder(kind.name());
        if (statusCode != null) {
            sb.append('(').append(statusCode).append(')');
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail);
        }
        if (retries > 0) {
            sb.append(" Retried ").append(retries).append(" times without success.");
        }
        return sb.toString();
    }
}
