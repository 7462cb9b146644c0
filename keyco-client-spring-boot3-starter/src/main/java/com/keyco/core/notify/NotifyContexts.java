package com.keyco.core.notify;

import com.keyco.exception.ApiException;
import com.keyco.model.ctx.NotifyContext;
import com.keyco.model.ctx.RequestContext;
import com.keyco.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 500;

    private NotifyContexts() {}

    /* ========== 熔断事件 ========== */

    public static NotifyContext ctxForCircuitOpened(String clientId, Instant until, int recentFailures, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("state", "OPEN");
        attrs.put("until", until.toString());
        attrs.put("recentFailures", recentFailures);
        return new NotifyContext(NotifyEventType.CIRCUIT_OPENED, clientId, null, null, null, null,
                "CIRCUIT", null, Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForCircuitClosed(String clientId, String cause, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("state", "CLOSED");
        attrs.put("cause", cause);
        return new NotifyContext(NotifyEventType.CIRCUIT_CLOSED, clientId, null, null, null, null,
                "CIRCUIT", null, Instant.now(clock), attrs);
    }

    /* ========== 请求事件 ========== */

    public static NotifyContext ctxForRetryExhausted(String clientId, RequestContext ctx, ApiException e, Clock clock) {
        return requestCtx(NotifyEventType.RETRY_EXHAUSTED, clientId, ctx, e, clock);
    }

    public static NotifyContext ctxForNonRetryable(String clientId, RequestContext ctx, ApiException e, Clock clock) {
        return requestCtx(NotifyEventType.NON_RETRYABLE_FAILED, clientId, ctx, e, clock);
    }

    public static NotifyContext ctxForFailsafe(String clientId, RequestContext ctx, Clock clock) {
        NotifyContext n = requestCtx(NotifyEventType.FAILSAFE_FIRED, clientId, ctx, null, clock);
        n.setReasonCode("FAILSAFE");
        return n;
    }

    /* ========== 私有工具 ========== */

    private static NotifyContext requestCtx(NotifyEventType type, String clientId, RequestContext ctx,
                                            ApiException e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("payloadLength", ctx.getRequest().payloadLength());
        return new NotifyContext(
                type,
                clientId,
                ctx.getRequest().operation().name().toLowerCase(Locale.ROOT),
                ctx.getRequestId(),
                ctx.getAttempt(),
                ctx.getMaxRetries(),
                reasonCode(e),
                truncate(e == null ? null : e.getMessage()),
                Instant.now(clock),
                attrs
        );
    }

    static String reasonCode(ApiException e) {
        if (e == null) return null;
        return e.getStatusCode() == null ? e.getKind().name() : "HTTP_" + e.getStatusCode();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
