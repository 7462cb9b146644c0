package com.keyco.core.spi;

import java.util.Map;

/**
 * 后端请求体/响应体编解码
 */
public interface PayloadSerializer {

    /**
     * 解析响应体, 顶层不是 JSON 对象时返回 null
     * 无法解析抛 IllegalStateException
     */
    Map<String, Object> readObject(String body);

    /** 请求字段序列化为 JSON, null 字段不输出 */
    String writeBody(Map<String, Object> fields);
}
