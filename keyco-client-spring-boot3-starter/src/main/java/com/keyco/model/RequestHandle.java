package com.keyco.model;

import com.keyco.exception.ApiException;
import io.netty.util.Timeout;
import okhttp3.Call;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 调用方持有的请求句柄
 * result() 只完成一次, 且永不异常完成
 */
public class RequestHandle {

    private final String requestId;

    /** 被去重抑制的请求 */
    private final boolean duplicate;

    private final CompletableFuture<ApiResult> result;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** 当前在途的调用 */
    private volatile Call inFlight;

    /** 当前排队中的重试 */
    private volatile Timeout pendingRetry;

    private volatile Timeout failsafe;

    /** 取消后的交付逻辑, 由执行器绑定 */
    private volatile Consumer<ApiException> onCancel = e -> {};

    public RequestHandle(String requestId) {
        this(requestId, false, new CompletableFuture<>());
    }

    private RequestHandle(String requestId, boolean duplicate, CompletableFuture<ApiResult> result) {
        this.requestId = requestId;
        this.duplicate = duplicate;
        this.result = result;
    }

    /**
     * 重复请求的句柄, 结果跟随原请求
     */
    public static RequestHandle duplicateOf(String requestId, CompletableFuture<ApiResult> original) {
        return new RequestHandle(requestId, true, original);
    }

    /**
     * 取消在途调用与排队中的重试, 调用方收到 NETWORK_ERROR("Request cancelled")
     */
    public void cancel() {
        if (duplicate || result.isDone() || !cancelled.compareAndSet(false, true)) {
            return;
        }
        Timeout t = pendingRetry;
        if (t != null) {
            t.cancel();
        }
        Call c = inFlight;
        if (c != null) {
            c.cancel();
        }
        onCancel.accept(ApiException.cancelled());
    }

    /**
     * 首次完成返回 true, 之后的迟到结果一律丢弃
     */
    public boolean complete(ApiResult r) {
        if (!result.complete(r)) {
            return false;
        }
        Timeout f = failsafe;
        if (f != null) {
            f.cancel();
        }
        return true;
    }

    public void attachCall(Call call) {
        this.inFlight = call;
        if (cancelled.get()) {
            call.cancel();
        }
    }

    public void attachRetry(Timeout timeout) {
        this.pendingRetry = timeout;
        if (cancelled.get()) {
            timeout.cancel();
        }
    }

    public void attachFailsafe(Timeout timeout) {
        this.failsafe = timeout;
        if (result.isDone()) {
            timeout.cancel();
        }
    }

    public void bindOnCancel(Consumer<ApiException> onCancel) {
        this.onCancel = onCancel;
    }

    /**
     * 兜底触发时中止在途调用与排队中的重试
     */
    public void abort() {
        Timeout t = pendingRetry;
        if (t != null) {
            t.cancel();
        }
        Call c = inFlight;
        if (c != null) {
            c.cancel();
        }
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<ApiResult> result() {
        return result;
    }
}
