package com.keyco.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的请求级任务
 * 让时间轮返回的 Timeout 能识别所属请求
 */
public class WheelTask implements TimerTask {

    public enum Kind { RETRY, FAILSAFE, DEDUP_EXPIRE }

    private final Kind kind;

    private final String requestId;

    private final Runnable actual;

    public WheelTask(Kind kind, String requestId, Runnable actual) {
        this.kind = kind;
        this.requestId = requestId;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    /**
     * 停机时直接执行尚未到期的任务
     */
    public void fire() {
        actual.run();
    }

    public Kind getKind() {
        return kind;
    }

    public String getRequestId() {
        return requestId;
    }
}
