package com.keyco.model;

import com.keyco.model.enums.Operation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对话请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatParams implements ApiRequest {

    private static final int DEDUP_PREFIX = 100;

    private String query;

    public static ChatParams of(String query) {
        return new ChatParams(query);
    }

    @Override
    public Operation operation() {
        return Operation.CHAT;
    }

    @Override
    public boolean isValid() {
        return query != null && !query.trim().isEmpty();
    }

    @Override
    public String dedupSource() {
        return RewriteParams.prefix(query == null ? "" : query, DEDUP_PREFIX);
    }

    @Override
    public Map<String, Object> toWireBody(String defaultLocale) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        return body;
    }

    @Override
    public int payloadLength() {
        return query == null ? 0 : query.length();
    }
}
