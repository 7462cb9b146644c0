package com.keyco.core.http;

import com.keyco.core.spi.PayloadSerializer;
import com.keyco.exception.HttpStatusException;
import com.keyco.exception.InvalidResponseException;

import java.util.Map;

/**
 * 后端响应解析
 * 成功体 {text}, 错误体 {error, details?}
 */
public class ResponseParser {

    private final PayloadSerializer serializer;

    public ResponseParser(PayloadSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * 2xx 响应体 -> 去除首尾空白的 text
     */
    public String parseSuccess(int status, String body) {
        if (body == null || body.isEmpty()) {
            throw new InvalidResponseException("empty response body", true);
        }
        Map<String, Object> json;
        try {
            json = serializer.readObject(body);
        } catch (IllegalStateException e) {
            throw new InvalidResponseException("response is not a JSON object", e);
        }
        if (json == null) {
            throw new InvalidResponseException("response is not a JSON object", false);
        }
        String error = text(json, "error");
        if (error != null) {
            String details = text(json, "details");
            throw new HttpStatusException(status, details != null ? details : error);
        }
        String text = text(json, "text");
        if (text == null) {
            throw new InvalidResponseException("response has no text field", false);
        }
        return text.trim();
    }

    /**
     * 非 2xx 响应体 -> error ?? details ?? ""
     */
    public String extractErrorMessage(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        try {
            Map<String, Object> json = serializer.readObject(body);
            if (json == null) {
                return "";
            }
            String error = text(json, "error");
            if (error != null) {
                return error;
            }
            String details = text(json, "details");
            if (details != null) {
                return details;
            }
        } catch (IllegalStateException ignored) {
            // 非 JSON 错误体按空消息处理
            return "";
        }
        return "";
    }

    // 非字符串字段视为缺失
    private static String text(Map<String, Object> json, String field) {
        Object v = json.get(field);
        return v instanceof String ? (String) v : null;
    }
}
