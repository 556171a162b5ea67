package com.bbthechange.bridge.service;

import com.bbthechange.bridge.config.BridgeProperties;
import com.bbthechange.bridge.dto.CustomPuppetSession;
import com.bbthechange.bridge.exception.DoublePuppetException;
import com.bbthechange.bridge.model.Puppet;
import com.bbthechange.bridge.util.MxidTemplate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks double puppeting sessions: puppets linked to a real Matrix account, so that messages
 * from the LinkedIn side can be sent as that account instead of the ghost.
 *
 * Starting a session resolves the account's homeserver, from the configured server map or, when
 * allowed, through {@code .well-known} discovery. Access tokens are handled elsewhere.
 */
@Service
public class DoublePuppetService {

    private static final Logger logger = LoggerFactory.getLogger(DoublePuppetService.class);

    private final BridgeProperties bridgeProperties;
    private final MxidTemplate mxidTemplate;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, CustomPuppetSession> sessions = new ConcurrentHashMap<>();

    public DoublePuppetService(BridgeProperties bridgeProperties,
                               MxidTemplate mxidTemplate,
                               HttpClient httpClient,
                               ObjectMapper objectMapper) {
        this.bridgeProperties = bridgeProperties;
        this.mxidTemplate = mxidTemplate;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Start the double puppeting session of a puppet, if it has a custom mxid.
     *
     * @return true if a session is active afterwards; failures are logged, never thrown
     */
    public boolean tryStart(Puppet puppet) {
        String customMxid = puppet.getCustomMxid();
        if (customMxid == null) {
            return false;
        }
        try {
            CustomPuppetSession session = start(puppet);
            logger.info("Started double puppeting for {} as {} via {} (sync {})",
                    puppet.getRemoteUserKey(), customMxid, session.homeserverUrl(),
                    session.syncEnabled() ? "enabled" : "disabled");
            return true;
        } catch (Exception e) {
            logger.warn("Failed to start double puppeting for {} as {}", puppet.getRemoteUserKey(), customMxid, e);
            return false;
        }
    }

    CustomPuppetSession start(Puppet puppet) {
        String customMxid = puppet.getCustomMxid();
        String server = serverName(customMxid);
        URI homeserverUrl = resolveHomeserverUrl(server);
        CustomPuppetSession session = new CustomPuppetSession(
                customMxid,
                puppet.getRemoteUserKey(),
                homeserverUrl,
                puppet.getSyncToken(),
                bridgeProperties.isSyncWithCustomPuppets(),
                bridgeProperties.getLoginSharedSecretMap().containsKey(server));
        sessions.put(customMxid, session);
        return session;
    }

    public void stop(String customMxid) {
        if (sessions.remove(customMxid) != null) {
            logger.info("Stopped double puppeting for {}", customMxid);
        }
    }

    public Optional<CustomPuppetSession> getSession(String customMxid) {
        return Optional.ofNullable(sessions.get(customMxid));
    }

    public boolean isActive(Puppet puppet) {
        return puppet.getCustomMxid() != null && sessions.containsKey(puppet.getCustomMxid());
    }

    /**
     * The user to act as for a puppet in a portal.
     *
     * The ghost is used in the puppet's own direct chat, and while backfilling when the own ghost
     * is invited for backfill. Otherwise the linked real account is used if its session is active.
     *
     * @param portalOtherUserKey remote key of the other participant of the portal, null for group chats
     */
    public String intentMxidFor(Puppet puppet, String portalOtherUserKey, boolean backfillInProgress) {
        String ghostMxid = mxidTemplate.format(puppet.getRemoteUserKey());
        if (puppet.getRemoteUserKey().equals(portalOtherUserKey)
                || (backfillInProgress && bridgeProperties.getBackfill().isInviteOwnPuppet())) {
            return ghostMxid;
        }
        return isActive(puppet) ? puppet.getCustomMxid() : ghostMxid;
    }

    URI resolveHomeserverUrl(String server) {
        String configured = bridgeProperties.getDoublePuppetServerMap().get(server);
        if (configured != null) {
            return URI.create(configured);
        }
        if (!bridgeProperties.isDoublePuppetAllowDiscovery()) {
            throw new DoublePuppetException("No homeserver URL configured for " + server + " and discovery is disabled");
        }
        return discover(server);
    }

    private URI discover(String server) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("https://" + server + "/.well-known/matrix/client"))
                .timeout(bridgeProperties.getHttp().getRequestTimeout())
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new DoublePuppetException("Well-known lookup for " + server + " returned " + response.statusCode());
            }
            JsonNode wellKnown = objectMapper.readTree(response.body());
            String baseUrl = wellKnown.path("m.homeserver").path("base_url").asText(null);
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new DoublePuppetException("Well-known of " + server + " has no m.homeserver base_url");
            }
            return URI.create(baseUrl);
        } catch (IOException e) {
            throw new DoublePuppetException("Well-known lookup for " + server + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DoublePuppetException("Interrupted during well-known lookup for " + server, e);
        }
    }

    private static String serverName(String mxid) {
        int separator = mxid.indexOf(':');
        if (!mxid.startsWith("@") || separator < 0 || separator == mxid.length() - 1) {
            throw new DoublePuppetException("Invalid custom mxid " + mxid);
        }
        return mxid.substring(separator + 1);
    }
}
