package com.keyco.model.ctx;

import com.keyco.model.ApiRequest;
import com.keyco.model.ApiResult;
import com.keyco.model.RequestHandle;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Consumer;

/**
 * 单次尝试的上下文, 每次重试 attempt 恰好 +1
 */
@Getter
@Builder(toBuilder = true)
public class RequestContext {

    private final String requestId;
    private final ApiRequest request;
    private final int attempt;
    private final int maxRetries;
    // 可为空
    private final Consumer<String> onProgress;
    private final Consumer<ApiResult> onComplete;
    private final RequestHandle handle;
    // 首次尝试开始时间, 用于 exec timer
    private final long startedNanos;

    public RequestContext nextAttempt() {
        return toBuilder().attempt(attempt + 1).build();
    }

    public boolean hasRetriesLeft() {
        return attempt < maxRetries;
    }
}
