package com.keyco.core.dedup;

import com.keyco.model.ApiRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 去重键: 操作名 + SHA-256(截断原文) 前 16 位十六进制
 * 改写取 text 前 50 字符 + tone + length, 对话取 query 前 100 字符
 */
public final class RequestKeys {

    private static final int HEX_LEN = 16;

    private RequestKeys() {}

    public static String of(ApiRequest request) {
        return request.operation().name().toLowerCase(Locale.ROOT) + ":" + hash(request.dedupSource());
    }

    static String hash(String source) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HEX_LEN);
        } catch (NoSuchAlgorithmException e) {
            // JDK 必带 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
