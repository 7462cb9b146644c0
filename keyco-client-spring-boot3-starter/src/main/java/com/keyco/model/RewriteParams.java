package com.keyco.model;

import com.keyco.model.enums.Operation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 改写请求
 * tone: 0 随意 ~ 1 正式; length: 0 详细 ~ 1 简短
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewriteParams implements ApiRequest {

    private static final int DEDUP_PREFIX = 50;

    private String text;

    private double tone;

    private double length;

    /** 预设, 如 fix_grammar / polish / tweet */
    private String presetId;

    /** 为空时使用 keyco.client.default-locale */
    private String locale;

    @Override
    public Operation operation() {
        return Operation.REWRITE;
    }

    @Override
    public boolean isValid() {
        return text != null && !text.trim().isEmpty() && inUnitRange(tone) && inUnitRange(length);
    }

    @Override
    public String dedupSource() {
        String t = text == null ? "" : text;
        return prefix(t, DEDUP_PREFIX) + "|" + tone + "|" + length;
    }

    @Override
    public Map<String, Object> toWireBody(String defaultLocale) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("tone", tone);
        body.put("length", length);
        body.put("locale", locale == null || locale.isBlank() ? defaultLocale : locale);
        if (presetId != null && !presetId.isBlank()) {
            body.put("preset", presetId);
        }
        return body;
    }

    @Override
    public int payloadLength() {
        return text == null ? 0 : text.length();
    }

    private static boolean inUnitRange(double v) {
        // NaN 比较恒为 false
        return v >= 0.0 && v <= 1.0;
    }

    static String prefix(String s, int n) {
        int end = s.offsetByCodePoints(0, Math.min(n, s.codePointCount(0, s.length())));
        return s.substring(0, end);
    }
}
