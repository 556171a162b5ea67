package com.bbthechange.bridge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Puppet related bridge settings, bound from the {@code bridge.*} section of the application config.
 */
@Component
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    /**
     * Localpart template for ghost users. Must contain {@code {userid}} exactly once.
     */
    private String usernameTemplate = "linkedin_{userid}";

    /**
     * Profile fields to try, in order, when choosing the {@code {displayname}} value.
     */
    private List<String> displaynamePreference = new ArrayList<>(List.of("name", "first_name"));

    private String displaynameTemplate = "{displayname} (LinkedIn)";

    private boolean syncWithCustomPuppets = true;

    private Map<String, String> doublePuppetServerMap = new HashMap<>();

    private boolean doublePuppetAllowDiscovery = false;

    private Map<String, String> loginSharedSecretMap = new HashMap<>();

    private final Backfill backfill = new Backfill();

    private final Http http = new Http();

    public String getUsernameTemplate() {
        return usernameTemplate;
    }

    public void setUsernameTemplate(String usernameTemplate) {
        this.usernameTemplate = usernameTemplate;
    }

    public List<String> getDisplaynamePreference() {
        return displaynamePreference;
    }

    public void setDisplaynamePreference(List<String> displaynamePreference) {
        this.displaynamePreference = displaynamePreference;
    }

    public String getDisplaynameTemplate() {
        return displaynameTemplate;
    }

    public void setDisplaynameTemplate(String displaynameTemplate) {
        this.displaynameTemplate = displaynameTemplate;
    }

    public boolean isSyncWithCustomPuppets() {
        return syncWithCustomPuppets;
    }

    public void setSyncWithCustomPuppets(boolean syncWithCustomPuppets) {
        this.syncWithCustomPuppets = syncWithCustomPuppets;
    }

    public Map<String, String> getDoublePuppetServerMap() {
        return doublePuppetServerMap;
    }

    public void setDoublePuppetServerMap(Map<String, String> doublePuppetServerMap) {
        this.doublePuppetServerMap = doublePuppetServerMap;
    }

    public boolean isDoublePuppetAllowDiscovery() {
        return doublePuppetAllowDiscovery;
    }

    public void setDoublePuppetAllowDiscovery(boolean doublePuppetAllowDiscovery) {
        this.doublePuppetAllowDiscovery = doublePuppetAllowDiscovery;
    }

    public Map<String, String> getLoginSharedSecretMap() {
        return loginSharedSecretMap;
    }

    public void setLoginSharedSecretMap(Map<String, String> loginSharedSecretMap) {
        this.loginSharedSecretMap = loginSharedSecretMap;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public Http getHttp() {
        return http;
    }

    public static class Backfill {

        /**
         * Invite the user's own ghost (instead of the double puppet) while backfilling.
         */
        private boolean inviteOwnPuppet = true;

        public boolean isInviteOwnPuppet() {
            return inviteOwnPuppet;
        }

        public void setInviteOwnPuppet(boolean inviteOwnPuppet) {
            this.inviteOwnPuppet = inviteOwnPuppet;
        }
    }

    public static class Http {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(10);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(30);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
