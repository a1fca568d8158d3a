package io.markwise.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(String host, int port) {

    public static GatewayConfig defaults() {
        return new GatewayConfig("127.0.0.1", 8787);
    }
}
