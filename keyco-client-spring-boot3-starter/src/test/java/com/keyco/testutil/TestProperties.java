package com.keyco.testutil;

import com.keyco.config.KeycoClientProperties;

import java.time.Duration;

/**
 * 指向本地 MockWebServer 的快速配置
 */
public final class TestProperties {

    private TestProperties() {}

    public static KeycoClientProperties against(String baseUrl) {
        KeycoClientProperties props = new KeycoClientProperties();
        props.setApiKey("test-key");
        props.getBackend().setBaseUrl(baseUrl);
        props.getPreflight().setConnectivityCheckEnabled(false);
        props.getPreflight().setConnectivityTimeout(Duration.ofMillis(500));
        props.getPreflight().setHealthTimeout(Duration.ofMillis(500));
        props.getPreflight().setWatchdogGrace(Duration.ofMillis(200));
        props.getTimeouts().setRequest(Duration.ofSeconds(2));
        props.getBackoff().setBase(Duration.ofMillis(20));
        props.getBackoff().setMin(Duration.ofMillis(1));
        props.getBackoff().setJitterRatio(0.0);
        props.getWheel().setTickDuration(Duration.ofMillis(10));
        props.getShutdown().setAwait(Duration.ofSeconds(1));
        return props;
    }
}
