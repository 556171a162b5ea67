package com.bbthechange.bridge.client;

import com.bbthechange.bridge.config.BridgeProperties;
import com.bbthechange.bridge.config.HomeserverProperties;
import com.bbthechange.bridge.exception.MatrixRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Client for the homeserver's client-server API, acting as ghost users through the appservice token.
 * Every request masquerades as the given user with the {@code user_id} query parameter.
 */
@Component
public class MatrixIntentClient {

    private static final Logger logger = LoggerFactory.getLogger(MatrixIntentClient.class);

    private static final String CLIENT_PATH = "/_matrix/client/v3";
    private static final String MEDIA_PATH = "/_matrix/media/v3";
    static final String USER_IN_USE = "M_USER_IN_USE";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String asToken;
    private final Duration requestTimeout;

    @Autowired
    public MatrixIntentClient(HttpClient httpClient,
                              ObjectMapper objectMapper,
                              HomeserverProperties homeserverProperties,
                              BridgeProperties bridgeProperties) {
        this(httpClient, objectMapper, homeserverProperties.getAddress(), homeserverProperties.getAsToken(),
                bridgeProperties.getHttp().getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    MatrixIntentClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String asToken,
                       Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.asToken = asToken;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Register the ghost account. An account that already exists counts as registered.
     */
    public void ensureRegistered(String mxid) {
        String localpart = mxid.substring(1, mxid.indexOf(':'));
        Map<String, String> body = Map.of("type", "m.login.application_service", "username", localpart);
        try {
            send(jsonRequest(CLIENT_PATH + "/register", null).POST(jsonBody(body)).build());
            logger.info("Registered ghost {}", mxid);
        } catch (MatrixRequestException e) {
            if (!e.hasErrcode(USER_IN_USE)) {
                throw e;
            }
            logger.debug("Ghost {} was already registered", mxid);
        }
    }

    public void setDisplayName(String mxid, String displayName) {
        String path = CLIENT_PATH + "/profile/" + encode(mxid) + "/displayname";
        send(jsonRequest(path, mxid).PUT(jsonBody(Map.of("displayname", displayName))).build());
        logger.debug("Set displayname of {} to {}", mxid, displayName);
    }

    /**
     * Set the avatar of a user. An empty content URI removes the avatar.
     */
    public void setAvatarUrl(String mxid, String contentUri) {
        String path = CLIENT_PATH + "/profile/" + encode(mxid) + "/avatar_url";
        send(jsonRequest(path, mxid).PUT(jsonBody(Map.of("avatar_url", contentUri))).build());
        logger.debug("Set avatar of {} to {}", mxid, contentUri);
    }

    /**
     * Upload media to the homeserver's content repository as the given user.
     *
     * @return the {@code mxc://} content URI of the upload
     */
    public String uploadMedia(String mxid, byte[] data, String mimeType) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(MEDIA_PATH + "/upload", mxid))
                .header("Authorization", "Bearer " + asToken)
                .header("Content-Type", mimeType)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofByteArray(data))
                .build();
        JsonNode response = send(request);
        String contentUri = response.path("content_uri").asText(null);
        if (contentUri == null || !contentUri.startsWith("mxc://")) {
            throw new MatrixRequestException(200, null, "Upload response did not contain a content URI");
        }
        logger.debug("Uploaded {} bytes of {} as {}: {}", data.length, mimeType, mxid, contentUri);
        return contentUri;
    }

    private HttpRequest.Builder jsonRequest(String path, String mxid) {
        return HttpRequest.newBuilder()
                .uri(uri(path, mxid))
                .header("Authorization", "Bearer " + asToken)
                .header("Content-Type", "application/json")
                .timeout(requestTimeout);
    }

    private URI uri(String path, String mxid) {
        String url = baseUrl + path;
        if (mxid != null) {
            url += "?user_id=" + encode(mxid);
        }
        return URI.create(url);
    }

    private HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable", e);
        }
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MatrixRequestException(request.method() + " " + request.uri().getPath() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatrixRequestException("Interrupted during " + request.method() + " " + request.uri().getPath(), e);
        }

        int statusCode = response.statusCode();
        JsonNode body = parse(response.body());
        if (statusCode < 200 || statusCode >= 300) {
            String errcode = body.path("errcode").asText(null);
            String error = body.path("error").asText("no error message");
            throw new MatrixRequestException(statusCode, errcode,
                    request.method() + " " + request.uri().getPath() + " returned " + statusCode
                            + (errcode != null ? " " + errcode : "") + ": " + error);
        }
        return body;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.warn("Homeserver returned a non-JSON body: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
