package com.bbthechange.bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection details of the local Matrix homeserver the bridge is registered with as an appservice.
 */
@Component
@ConfigurationProperties(prefix = "homeserver")
public class HomeserverProperties {

    /**
     * Base URL of the client-server API, e.g. {@code https://matrix.example.com}.
     */
    private String address = "http://localhost:8008";

    /**
     * Server name used in user IDs, e.g. {@code example.com}.
     */
    private String domain = "localhost";

    /**
     * Appservice token the bridge authenticates with when acting as a ghost.
     */
    private String asToken = "";

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public String getAsToken() {
        return asToken;
    }

    public void setAsToken(String asToken) {
        this.asToken = asToken;
    }
}
