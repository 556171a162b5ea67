package com.bbthechange.bridge.service;

import com.bbthechange.bridge.client.MatrixIntentClient;
import com.bbthechange.bridge.config.BridgeProperties;
import com.bbthechange.bridge.exception.AvatarFetchException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Copies remote profile pictures into the homeserver's content repository.
 * The MIME type is sniffed from the downloaded bytes; the remote Content-Type header is ignored.
 */
@Service
@Slf4j
public class AvatarReuploadService {

    private static final String USER_AGENT = "LinkedInMatrixBridge/1.0";

    private final HttpClient httpClient;
    private final MatrixIntentClient matrixIntentClient;
    private final Duration requestTimeout;
    private final Tika tika = new Tika();

    @Autowired
    public AvatarReuploadService(HttpClient httpClient,
                                 MatrixIntentClient matrixIntentClient,
                                 BridgeProperties bridgeProperties) {
        this(httpClient, matrixIntentClient, bridgeProperties.getHttp().getRequestTimeout());
    }

    AvatarReuploadService(HttpClient httpClient, MatrixIntentClient matrixIntentClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.matrixIntentClient = matrixIntentClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Download an image and upload it as the given ghost.
     *
     * @return the content URI of the uploaded copy
     * @throws AvatarFetchException if the download fails or returns a non-success status
     * @throws com.bbthechange.bridge.exception.MatrixRequestException if the upload is rejected
     */
    public String reupload(String ghostMxid, String url) {
        byte[] data = download(url);
        String mimeType = tika.detect(data);
        log.debug("Reuploading {} bytes of {} from {} for {}", data.length, mimeType, url, ghostMxid);
        return matrixIntentClient.uploadMedia(ghostMxid, data, mimeType);
    }

    private byte[] download(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("User-Agent", USER_AGENT)
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new AvatarFetchException(url, e);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new AvatarFetchException(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AvatarFetchException(url, e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new AvatarFetchException(url, statusCode);
        }
        return response.body();
    }
}
