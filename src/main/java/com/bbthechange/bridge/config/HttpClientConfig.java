package com.bbthechange.bridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class HttpClientConfig {

    private final BridgeProperties properties;

    public HttpClientConfig(BridgeProperties properties) {
        this.properties = properties;
    }

    /**
     * Shared client for homeserver calls, avatar downloads and well-known discovery.
     */
    @Bean
    public HttpClient bridgeHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
