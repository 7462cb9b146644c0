package com.keyco.core.preflight;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.http.BackendEndpoints;
import com.keyco.model.WheelTask;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntPredicate;

/**
 * 快速探测, 超时均短于主请求
 * 连通性: HEAD 外部知名站点, 任意 HTTP 响应即视为联网
 * 后端健康: GET {base}/api/health, 仅 200 视为健康
 * 探测在 超时 + 宽限 后仍未返回则按失败处理
 */
@Slf4j
public class PreflightProbe {

    private final OkHttpClient connectivityClient;

    private final OkHttpClient healthClient;

    private final BackendEndpoints endpoints;

    private final Timer timer;

    private final Duration connectivityWatchdog;

    private final Duration healthWatchdog;

    public PreflightProbe(OkHttpClient base, BackendEndpoints endpoints, KeycoClientProperties props, Timer timer) {
        KeycoClientProperties.Preflight cfg = props.getPreflight();
        this.connectivityClient = base.newBuilder()
                .callTimeout(cfg.getConnectivityTimeout())
                .retryOnConnectionFailure(false)
                .followRedirects(false)
                .build();
        this.healthClient = base.newBuilder()
                .callTimeout(cfg.getHealthTimeout())
                .retryOnConnectionFailure(false)
                .build();
        this.endpoints = endpoints;
        this.timer = timer;
        this.connectivityWatchdog = cfg.getConnectivityTimeout().plus(cfg.getWatchdogGrace());
        this.healthWatchdog = cfg.getHealthTimeout().plus(cfg.getWatchdogGrace());
    }

    public CompletableFuture<Boolean> checkConnectivity() {
        Request request = new Request.Builder().url(endpoints.connectivity()).head().build();
        return probe("connectivity", connectivityClient.newCall(request), connectivityWatchdog, code -> true);
    }

    public CompletableFuture<Boolean> checkBackendHealth() {
        Request request = new Request.Builder().url(endpoints.health()).get().build();
        return probe("health", healthClient.newCall(request), healthWatchdog, code -> code == 200);
    }

    private CompletableFuture<Boolean> probe(String name, Call call, Duration watchdog, IntPredicate healthy) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Timeout guard = timer.newTimeout(new WheelTask(WheelTask.Kind.FAILSAFE, name, () -> {
            if (result.complete(false)) {
                log.warn("[Preflight] {} probe watchdog fired after {} ms", name, watchdog.toMillis());
                call.cancel();
            }
        }), watchdog.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((ok, e) -> guard.cancel());

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                if (result.complete(false)) {
                    log.info("[Preflight] {} probe failed: {}", name, e.toString());
                }
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    boolean ok = healthy.test(response.code());
                    if (result.complete(ok)) {
                        log.debug("[Preflight] {} probe status={} healthy={}", name, response.code(), ok);
                    }
                }
            }
        });
        return result;
    }
}
