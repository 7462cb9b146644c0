package com.keyco.model;

import com.keyco.exception.ApiException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 请求结果: 成功时为去除首尾空白的 text, 失败时为分类后的错误
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResult {

    private final String text;

    private final ApiException error;

    public static ApiResult success(String text) {
        return new ApiResult(text, null);
    }

    public static ApiResult failure(ApiException error) {
        return new ApiResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
