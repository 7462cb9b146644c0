package com.keyco.testutil;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按路径排队响应, 并统计每条路径的命中次数
 * 队列耗尽后返回该路径的默认响应, 没有默认则 404
 */
public class RoutingDispatcher extends Dispatcher {

    private final Map<String, Queue<MockResponse>> queued = new ConcurrentHashMap<>();

    private final Map<String, MockResponse> fallback = new ConcurrentHashMap<>();

    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    public RoutingDispatcher enqueue(String path, MockResponse response) {
        queued.computeIfAbsent(path, p -> new ConcurrentLinkedQueue<>()).add(response);
        return this;
    }

    public RoutingDispatcher always(String path, MockResponse response) {
        fallback.put(path, response);
        return this;
    }

    public int hits(String path) {
        AtomicInteger n = hits.get(path);
        return n == null ? 0 : n.get();
    }

    @Override
    public MockResponse dispatch(RecordedRequest request) {
        String path = request.getRequestUrl() == null ? "" : request.getRequestUrl().encodedPath();
        hits.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
        Queue<MockResponse> q = queued.get(path);
        MockResponse next = q == null ? null : q.poll();
        if (next != null) {
            return next;
        }
        return fallback.getOrDefault(path, new MockResponse().setResponseCode(404));
    }

    public static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
