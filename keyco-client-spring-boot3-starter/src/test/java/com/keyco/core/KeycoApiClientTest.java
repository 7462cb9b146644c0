package com.keyco.core;

import com.keyco.config.KeycoClientProperties;
import com.keyco.core.engine.ApiRequestExecutor;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.exception.ApiException;
import com.keyco.model.ApiResult;
import com.keyco.model.BackendStatus;
import com.keyco.model.ChatParams;
import com.keyco.model.RequestHandle;
import com.keyco.model.RewriteParams;
import com.keyco.model.enums.ErrorKind;
import com.keyco.testutil.MutableClock;
import com.keyco.testutil.RoutingDispatcher;
import com.keyco.testutil.TestProperties;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.keyco.testutil.RoutingDispatcher.json;
import static org.assertj.core.api.Assertions.assertThat;

class KeycoApiClientTest {

    private static final String REWRITE = "/api/rewrite";
    private static final String CHAT = "/api/chat";
    private static final String HEALTH = "/api/health";
    private static final ApiException DOWN = ApiException.http(503, "down");

    private MockWebServer server;
    private RoutingDispatcher dispatcher;
    private MutableClock clock;
    private ClientMetrics metrics;
    private KeycoClientProperties props;
    private KeycoApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = new RoutingDispatcher();
        server = new MockWebServer();
        server.setDispatcher(dispatcher);
        server.start();
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        metrics = ClientMetrics.simple();
        props = TestProperties.against(server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.close();
        }
        server.shutdown();
    }

    @Test
    void shouldReturnTrimmedTextAndSendAuthorizedJson() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"  Polished sentence. \"}"));
        client = build();
        AtomicInteger completions = new AtomicInteger();
        CountDownLatch delivered = new CountDownLatch(1);

        // Act
        RequestHandle handle = client.rewrite(rewrite("make this nicer"), result -> {
            completions.incrementAndGet();
            delivered.countDown();
        });
        ApiResult result = handle.result().get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(delivered.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("Polished sentence.");
        assertThat(completions.get()).isEqualTo(1);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8())
                .contains("\"text\":\"make this nicer\"")
                .contains("\"locale\":\"en-GB\"");
        assertThat(metrics.registry().get("keyco.client.success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldOmitAuthorizationWhenNoCredentialConfigured() throws Exception {
        // Arrange
        props.setApiKey(null);
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"ok\"}"));
        client = build();

        // Act
        client.rewrite(rewrite("no key")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getHeader("Authorization")).isNull();
    }

    @Test
    void shouldRejectInvalidParamsWithoutNetworkCall() throws Exception {
        // Arrange
        client = build();

        // Act
        ApiResult result = client.rewrite(RewriteParams.builder().text("hi").tone(1.5).length(0.5).build())
                .get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
        assertThat(result.getError().userMessage()).isEqualTo("Couldn't process that. Please try again.");
        assertThat(server.getRequestCount()).isZero();
        assertThat(client.breaker().recentFailures()).isZero();
    }

    @Test
    void shouldOpenCircuitAfterThreeFailuresAndShortCircuitOnUnhealthyBackend() throws Exception {
        // Arrange
        props.getRetry().setMaxRetries(0);
        dispatcher.always(REWRITE, json(503, "{\"error\":\"overloaded\"}"));
        dispatcher.always(HEALTH, new MockResponse().setResponseCode(503));
        client = build();

        // Act
        for (int i = 0; i < 3; i++) {
            ApiResult r = client.rewrite(rewrite("attempt " + i)).get(3, TimeUnit.SECONDS);
            assertThat(r.getError().getStatusCode()).isEqualTo(503);
        }
        ApiResult fourth = client.rewrite(rewrite("attempt 4")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(client.circuitState().isOpen()).isTrue();
        assertThat(fourth.getError().getKind()).isEqualTo(ErrorKind.BACKEND_UNAVAILABLE);
        assertThat(fourth.getError().userMessage()).isEqualTo("AI isn't responding. Please try again.");
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(3);
        assertThat(dispatcher.hits(HEALTH)).isEqualTo(1);
    }

    @Test
    void shouldCloseCircuitWhenHealthProbePassesWhileOpen() throws Exception {
        // Arrange
        dispatcher.always(HEALTH, new MockResponse().setResponseCode(200));
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"back\"}"));
        client = build();
        tripBreaker();

        // Act
        ApiResult result = client.rewrite(rewrite("after outage")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getText()).isEqualTo("back");
        assertThat(client.circuitState().isClosed()).isTrue();
        assertThat(dispatcher.hits(HEALTH)).isEqualTo(1);
    }

    @Test
    void shouldRetryThrottledRequestAfterJitteredDelayAndResetFailures() throws Exception {
        // Arrange
        props.getBackoff().setBase(Duration.ofSeconds(1));
        props.getBackoff().setMin(Duration.ofMillis(100));
        props.getBackoff().setJitterRatio(0.3);
        dispatcher.enqueue(REWRITE, json(429, "{\"error\":\"rate limited\"}"));
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"done\"}"));
        client = build();
        client.breaker().recordFailure(DOWN);
        client.breaker().recordFailure(DOWN);

        // Act
        ApiResult result = client.rewrite(rewrite("throttled")).get(5, TimeUnit.SECONDS);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(2);
        assertThat(metrics.registry().get("keyco.client.retries").counter().count()).isEqualTo(1.0);
        // 成功打断了连续失败, 再失败两次仍不打开
        client.breaker().recordFailure(DOWN);
        client.breaker().recordFailure(DOWN);
        assertThat(client.circuitState().isClosed()).isTrue();
    }

    @Test
    void shouldWaitAtLeastLowerJitterBoundBeforeRetry() throws Exception {
        // Arrange
        props.getBackoff().setBase(Duration.ofSeconds(1));
        props.getBackoff().setMin(Duration.ofMillis(100));
        props.getBackoff().setJitterRatio(0.3);
        dispatcher.enqueue(REWRITE, json(429, "{}"));
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"done\"}"));
        client = build();
        long started = System.nanoTime();

        // Act
        client.rewrite(rewrite("timed retry")).get(5, TimeUnit.SECONDS);

        // Assert
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(650));
        assertThat(elapsed).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void shouldFailFastWithoutConnectivityAndLeaveBreakerUntouched() throws Exception {
        // Arrange
        props.getPreflight().setConnectivityCheckEnabled(true);
        props.getPreflight().setConnectivityUrl("http://127.0.0.1:1/");
        client = build();

        // Act
        ApiResult result = client.rewrite(rewrite("offline")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.NO_CONNECTIVITY);
        assertThat(result.getError().userMessage()).isEqualTo("No internet. Please try again.");
        assertThat(dispatcher.hits(REWRITE)).isZero();
        assertThat(metrics.registry().get("keyco.client.retries").counter().count()).isZero();
        assertThat(client.circuitState().isClosed()).isTrue();
        assertThat(client.breaker().recentFailures()).isZero();
    }

    @Test
    void shouldAnnotateErrorWhenRetriesRunOut() throws Exception {
        // Arrange
        dispatcher.always(REWRITE, json(503, "{\"error\":\"down\"}"));
        client = build();

        // Act
        ApiResult result = client.rewrite(rewrite("keeps failing")).get(5, TimeUnit.SECONDS);

        // Assert
        ApiException error = result.getError();
        assertThat(error.getStatusCode()).isEqualTo(503);
        assertThat(error.getRetriesExhausted()).isEqualTo(3);
        assertThat(error.userMessage()).endsWith("Retried 3 times without success.");
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(4);
        assertThat(client.breaker().recentFailures()).isEqualTo(1);
    }

    @Test
    void shouldNotRetryClientErrors() throws Exception {
        // Arrange
        dispatcher.always(REWRITE, json(401, "{\"error\":\"bad token\"}"));
        client = build();

        // Act
        ApiResult result = client.rewrite(rewrite("unauthorized")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getError().getStatusCode()).isEqualTo(401);
        assertThat(result.getError().getDetail()).isEqualTo("bad token");
        assertThat(result.getError().userMessage()).isEqualTo("Authentication problem. Please try again.");
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(1);
    }

    @Test
    void shouldSurfaceErrorBodyOnSuccessStatusWithoutCountingFailure() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"error\":\"quota\",\"details\":\"monthly limit reached\"}"));
        client = build();

        // Act
        ApiResult result = client.rewrite(rewrite("quota")).get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP_ERROR);
        assertThat(result.getError().getStatusCode()).isEqualTo(200);
        assertThat(result.getError().getDetail()).isEqualTo("monthly limit reached");
        assertThat(client.breaker().recentFailures()).isZero();
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(1);
    }

    @Test
    void shouldReportNoDataForEmptySuccessBody() throws Exception {
        dispatcher.enqueue(REWRITE, new MockResponse().setResponseCode(200));
        client = build();

        ApiResult result = client.rewrite(rewrite("empty")).get(3, TimeUnit.SECONDS);

        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.NO_DATA);
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(1);
    }

    @Test
    void shouldSuppressDuplicateWithinWindowAndShareOriginalResult() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"once\"}").setHeadersDelay(300, TimeUnit.MILLISECONDS));
        client = build();
        List<String> progress = new CopyOnWriteArrayList<>();
        CountDownLatch progressed = new CountDownLatch(1);

        // Act
        RequestHandle first = client.rewrite(rewrite("same text"), null, r -> {});
        clock.advance(Duration.ofSeconds(2));
        RequestHandle second = client.rewrite(rewrite("same text"), msg -> {
            progress.add(msg);
            progressed.countDown();
        }, r -> {});

        // Assert
        assertThat(second.isDuplicate()).isTrue();
        assertThat(progressed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(progress).containsExactly(ApiRequestExecutor.DUPLICATE_PROGRESS);
        assertThat(second.result().get(3, TimeUnit.SECONDS).getText()).isEqualTo("once");
        assertThat(first.result().get(3, TimeUnit.SECONDS).getText()).isEqualTo("once");
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(1);
        assertThat(metrics.registry().get("keyco.client.dedup.suppressed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldExecuteSameRequestAgainAfterWindow() throws Exception {
        // Arrange
        dispatcher.always(REWRITE, json(200, "{\"text\":\"again\"}"));
        client = build();

        // Act
        client.rewrite(rewrite("repeat me")).get(3, TimeUnit.SECONDS);
        clock.advance(Duration.ofSeconds(6));
        RequestHandle later = client.rewrite(rewrite("repeat me"), r -> {});
        later.result().get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(later.isDuplicate()).isFalse();
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(2);
    }

    @Test
    void shouldDeliverCancellationWithoutTouchingBreaker() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"late\"}").setHeadersDelay(2, TimeUnit.SECONDS));
        client = build();
        RequestHandle handle = client.rewrite(rewrite("cancel me"), r -> {});
        server.takeRequest(2, TimeUnit.SECONDS);

        // Act
        handle.cancel();
        ApiResult result = handle.result().get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(handle.isCancelled()).isTrue();
        assertThat(result.getError().isCancelled()).isTrue();
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(result.getError().getDetail()).isEqualTo("Request cancelled");
        assertThat(client.breaker().recentFailures()).isZero();
    }

    @Test
    void shouldForceTimeoutWhenFailsafeFires() throws Exception {
        // Arrange
        props.getRetry().setMaxRetries(0);
        props.getFailsafe().setTimeout(Duration.ofMillis(300));
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"too late\"}").setHeadersDelay(1500, TimeUnit.MILLISECONDS));
        client = build();
        AtomicInteger completions = new AtomicInteger();

        // Act
        ApiResult result = client.rewrite(rewrite("stalled"), r -> completions.incrementAndGet())
                .result().get(3, TimeUnit.SECONDS);
        Thread.sleep(300);

        // Assert
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(result.getError().getDetail()).isEqualTo("no completion within 300 ms");
        assertThat(completions.get()).isEqualTo(1);
        assertThat(metrics.registry().get("keyco.client.failsafe.fired").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldAllowSingleTrialWhileHalfOpen() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"trial ok\"}").setHeadersDelay(300, TimeUnit.MILLISECONDS));
        client = build();
        tripBreaker();
        clock.advance(Duration.ofSeconds(8));

        // Act
        RequestHandle trial = client.rewrite(rewrite("trial"), r -> {});
        ApiResult rejected = client.rewrite(rewrite("second")).get(2, TimeUnit.SECONDS);
        ApiResult trialResult = trial.result().get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(rejected.getError().getKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(trialResult.getText()).isEqualTo("trial ok");
        assertThat(client.circuitState().isClosed()).isTrue();
        assertThat(dispatcher.hits(REWRITE)).isEqualTo(1);
    }

    @Test
    void shouldPostChatQuery() throws Exception {
        // Arrange
        dispatcher.enqueue(CHAT, json(200, "{\"text\":\"Sure!\"}"));
        client = build();

        // Act
        ApiResult result = client.chat("can you help?").get(3, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getText()).isEqualTo("Sure!");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo(CHAT);
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"query\":\"can you help?\"}");
    }

    @Test
    void shouldRejectBlankChatQuery() throws Exception {
        client = build();

        RequestHandle handle = client.chat(ChatParams.of("  "), r -> {});

        assertThat(handle.result().get(2, TimeUnit.SECONDS).getError().getKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldReportBackendStatus() throws Exception {
        // Arrange
        dispatcher.enqueue(HEALTH, new MockResponse().setResponseCode(200));
        dispatcher.enqueue(HEALTH, new MockResponse().setResponseCode(500));
        client = build();

        // Act
        BackendStatus up = client.checkBackendStatus().get(2, TimeUnit.SECONDS);
        BackendStatus down = client.checkBackendStatus().get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(up.isHealthy()).isTrue();
        assertThat(up.getMessage()).isNull();
        assertThat(down.isHealthy()).isFalse();
        assertThat(down.getMessage()).isEqualTo("Backend service unavailable");
    }

    @Test
    void shouldKeepDeliveringWhenCallbackThrows() throws Exception {
        // Arrange
        dispatcher.always(REWRITE, json(200, "{\"text\":\"fine\"}"));
        client = build();
        CountDownLatch second = new CountDownLatch(1);

        // Act
        client.rewrite(rewrite("first"), r -> { throw new IllegalStateException("ui bug"); })
                .result().get(3, TimeUnit.SECONDS);
        client.rewrite(rewrite("second"), r -> second.countDown());

        // Assert
        assertThat(second.await(3, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void shouldRejectRequestsAfterClose() throws Exception {
        // Arrange
        client = build();
        client.close();

        // Act
        ApiResult result = client.rewrite(rewrite("too late")).get(2, TimeUnit.SECONDS);

        // Assert
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldLeaveSharedHttpClientUsableAfterClose() throws Exception {
        // Arrange
        dispatcher.always(HEALTH, new MockResponse().setResponseCode(200));
        OkHttpClient shared = new OkHttpClient();
        client = KeycoApiClient.builder(props).okHttpClient(shared).clock(clock).metrics(metrics).build();

        // Act
        client.close();
        CompletableFuture<Integer> status = new CompletableFuture<>();
        shared.newCall(new Request.Builder().url(server.url(HEALTH)).build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                status.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    status.complete(response.code());
                }
            }
        });

        // Assert
        assertThat(status.get(3, TimeUnit.SECONDS)).isEqualTo(200);
        assertThat(shared.dispatcher().executorService().isShutdown()).isFalse();
    }

    @Test
    void shouldResolveOwnInFlightRequestWhenClosingOverSharedHttpClient() throws Exception {
        // Arrange
        dispatcher.enqueue(REWRITE, json(200, "{\"text\":\"too slow\"}").setHeadersDelay(2, TimeUnit.SECONDS));
        OkHttpClient shared = new OkHttpClient();
        client = KeycoApiClient.builder(props).okHttpClient(shared).clock(clock).metrics(metrics).build();
        RequestHandle handle = client.rewrite(rewrite("in flight"), r -> {});
        assertThat(server.takeRequest(2, TimeUnit.SECONDS)).isNotNull();

        // Act
        client.close();

        // Assert
        ApiResult result = handle.result().get(1, TimeUnit.SECONDS);
        assertThat(result.getError().getKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(result.getError().getDetail()).isEqualTo("client is shut down");
        assertThat(shared.dispatcher().executorService().isShutdown()).isFalse();
    }

    private KeycoApiClient build() {
        return KeycoApiClient.builder(props).clock(clock).metrics(metrics).build();
    }

    private void tripBreaker() {
        client.breaker().recordFailure(DOWN);
        client.breaker().recordFailure(DOWN);
        client.breaker().recordFailure(DOWN);
        assertThat(client.circuitState().isOpen()).isTrue();
    }

    private static RewriteParams rewrite(String text) {
        return RewriteParams.builder().text(text).tone(0.5).length(0.5).build();
    }
}
