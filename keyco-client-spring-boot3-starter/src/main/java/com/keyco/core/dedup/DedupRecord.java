package com.keyco.core.dedup;

import com.keyco.model.ApiResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

@Getter
@AllArgsConstructor
public class DedupRecord {

    private final String key;

    private final Instant firstSeen;

    /** 首个请求的结果, 手工调用 isDuplicate 时为 null */
    private final CompletableFuture<ApiResult> result;
}
