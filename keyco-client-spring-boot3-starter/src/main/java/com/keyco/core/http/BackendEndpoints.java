package com.keyco.core.http;

import com.keyco.config.KeycoClientProperties;
import com.keyco.model.enums.Operation;
import okhttp3.HttpUrl;

import java.util.EnumMap;
import java.util.Map;

/**
 * 后端地址解析, 启动时校验 base-url
 */
public class BackendEndpoints {

    private final Map<Operation, HttpUrl> operations = new EnumMap<>(Operation.class);

    private final HttpUrl health;

    private final HttpUrl connectivity;

    public BackendEndpoints(KeycoClientProperties props) {
        for (Operation op : Operation.values()) {
            operations.put(op, parse(props.normalizedBaseUrl() + op.getPath(), "keyco.client.backend.base-url"));
        }
        this.health = parse(props.normalizedBaseUrl() + props.getBackend().getHealthPath(),
                "keyco.client.backend.health-path");
        this.connectivity = parse(props.getPreflight().getConnectivityUrl(), "keyco.client.preflight.connectivity-url");
    }

    public HttpUrl of(Operation operation) {
        return operations.get(operation);
    }

    public HttpUrl health() {
        return health;
    }

    public HttpUrl connectivity() {
        return connectivity;
    }

    private static HttpUrl parse(String url, String property) {
        HttpUrl u = HttpUrl.parse(url);
        if (u == null) {
            throw new IllegalArgumentException(property + " is not a valid http(s) url: " + url);
        }
        return u;
    }
}
