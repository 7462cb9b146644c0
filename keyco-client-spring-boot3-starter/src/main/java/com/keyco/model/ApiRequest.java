package com.keyco.model;

import com.keyco.model.enums.Operation;

import java.util.Map;

/**
 * 一次逻辑请求的参数
 */
public interface ApiRequest {

    Operation operation();

    /** 本地校验, 不访问网络 */
    boolean isValid();

    /** 去重键的原文, 只取截断后的相关字段 */
    String dedupSource();

    /** 序列化到后端的请求体 */
    Map<String, Object> toWireBody(String defaultLocale);

    /** 日志里只记录长度, 不记录用户原文 */
    int payloadLength();
}
