package com.bbthechange.bridge.service;

import com.bbthechange.bridge.client.MatrixIntentClient;
import com.bbthechange.bridge.exception.AvatarFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AvatarReuploadServiceTest {

    private static final String GHOST = "@linkedin_ada:example.com";
    private static final String URL = "https://media.licdn.com/dms/image/ABC123/profile-displayphoto-shrink_100_100/0";

    private static final byte[] PNG = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n',
            0, 0, 0, 0x0d, 'I', 'H', 'D', 'R', 0, 0, 0, 1, 0, 0, 0, 1, 8, 6, 0, 0, 0
    };
    private static final byte[] JPEG = {
            (byte) 0xff, (byte) 0xd8, (byte) 0xff, (byte) 0xe0, 0, 0x10, 'J', 'F', 'I', 'F', 0, 1, 1, 0, 0, 1
    };

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<byte[]> httpResponse;

    @Mock
    private MatrixIntentClient matrixIntentClient;

    private AvatarReuploadService avatarReuploadService;

    @BeforeEach
    void setUp() {
        avatarReuploadService = new AvatarReuploadService(httpClient, matrixIntentClient, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should upload the downloaded bytes with the sniffed PNG type")
    void reupload_PngImage_UploadsAsPng() throws Exception {
        // Given
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any()))
                .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(PNG);
        when(matrixIntentClient.uploadMedia(GHOST, PNG, "image/png")).thenReturn("mxc://example.com/png");

        // When
        String contentUri = avatarReuploadService.reupload(GHOST, URL);

        // Then
        assertThat(contentUri).isEqualTo("mxc://example.com/png");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any());
        assertThat(request.getValue().uri().toString()).isEqualTo(URL);
        assertThat(request.getValue().method()).isEqualTo("GET");
    }

    @Test
    @DisplayName("should detect JPEG from the content rather than any header")
    void reupload_JpegImage_UploadsAsJpeg() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any()))
                .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(JPEG);
        when(matrixIntentClient.uploadMedia(eq(GHOST), eq(JPEG), eq("image/jpeg"))).thenReturn("mxc://example.com/jpg");

        assertThat(avatarReuploadService.reupload(GHOST, URL)).isEqualTo("mxc://example.com/jpg");
    }

    @Test
    @DisplayName("should fail with AvatarFetchException on a non-success status")
    void reupload_NotFound_ThrowsFetchException() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any()))
                .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(404);

        assertThatThrownBy(() -> avatarReuploadService.reupload(GHOST, URL))
                .isInstanceOf(AvatarFetchException.class)
                .satisfies(e -> assertThat(((AvatarFetchException) e).getStatusCode()).isEqualTo(404));
        verifyNoInteractions(matrixIntentClient);
    }

    @Test
    @DisplayName("should wrap I/O failures in AvatarFetchException")
    void reupload_IoError_ThrowsFetchException() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any()))
                .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> avatarReuploadService.reupload(GHOST, URL))
                .isInstanceOf(AvatarFetchException.class)
                .hasCauseInstanceOf(IOException.class);
        verifyNoInteractions(matrixIntentClient);
    }

    @Test
    @DisplayName("should reject URLs that cannot be requested")
    void reupload_InvalidUrl_ThrowsFetchException() {
        assertThatThrownBy(() -> avatarReuploadService.reupload(GHOST, "not a url"))
                .isInstanceOf(AvatarFetchException.class);
        verifyNoInteractions(httpClient, matrixIntentClient);
    }
}
