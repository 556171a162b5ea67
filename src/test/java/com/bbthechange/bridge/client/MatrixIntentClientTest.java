package com.bbthechange.bridge.client;

import com.bbthechange.bridge.exception.MatrixRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatrixIntentClientTest {

    private static final String GHOST = "@linkedin_ada:example.com";
    private static final String ENCODED_GHOST = "%40linkedin_ada%3Aexample.com";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private MatrixIntentClient client;

    @BeforeEach
    void setUp() {
        client = new MatrixIntentClient(httpClient, new ObjectMapper(), "https://matrix.example.com/",
                "as-token", Duration.ofSeconds(5));
    }

    private void respond(int status, String body) throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(status);
        when(httpResponse.body()).thenReturn(body);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("profile updates")
    class ProfileTests {

        @Test
        @DisplayName("should PUT the displayname as the ghost")
        void setDisplayName_Success_MasqueradesAsGhost() throws Exception {
            respond(200, "{}");

            client.setDisplayName(GHOST, "Ada Lovelace");

            HttpRequest request = sentRequest();
            assertThat(request.method()).isEqualTo("PUT");
            assertThat(request.uri().toString()).isEqualTo(
                    "https://matrix.example.com/_matrix/client/v3/profile/" + ENCODED_GHOST
                            + "/displayname?user_id=" + ENCODED_GHOST);
            assertThat(request.headers().firstValue("Authorization")).contains("Bearer as-token");
        }

        @Test
        @DisplayName("should PUT the avatar URL")
        void setAvatarUrl_Success_UsesAvatarEndpoint() throws Exception {
            respond(200, "{}");

            client.setAvatarUrl(GHOST, "mxc://example.com/abc");

            assertThat(sentRequest().uri().getRawPath()).endsWith("/avatar_url");
        }

        @Test
        @DisplayName("should raise MatrixRequestException with the errcode on rejection")
        void setDisplayName_Forbidden_Throws() throws Exception {
            respond(403, "{\"errcode\": \"M_FORBIDDEN\", \"error\": \"not allowed\"}");

            assertThatThrownBy(() -> client.setDisplayName(GHOST, "Ada"))
                    .isInstanceOf(MatrixRequestException.class)
                    .hasMessageContaining("M_FORBIDDEN")
                    .satisfies(e -> {
                        MatrixRequestException ex = (MatrixRequestException) e;
                        assertThat(ex.getStatusCode()).isEqualTo(403);
                        assertThat(ex.getErrcode()).isEqualTo("M_FORBIDDEN");
                    });
        }

        @Test
        @DisplayName("should wrap I/O errors")
        void setDisplayName_IoError_Throws() throws Exception {
            when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                    .thenThrow(new IOException("refused"));

            assertThatThrownBy(() -> client.setDisplayName(GHOST, "Ada"))
                    .isInstanceOf(MatrixRequestException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .satisfies(e -> assertThat(((MatrixRequestException) e).getStatusCode()).isEqualTo(-1));
        }
    }

    @Nested
    @DisplayName("ensureRegistered")
    class RegisterTests {

        @Test
        @DisplayName("should register the ghost localpart")
        void ensureRegistered_New_Registers() throws Exception {
            respond(200, "{\"user_id\": \"" + GHOST + "\"}");

            client.ensureRegistered(GHOST);

            HttpRequest request = sentRequest();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri().toString()).isEqualTo("https://matrix.example.com/_matrix/client/v3/register");
        }

        @Test
        @DisplayName("should accept an existing account")
        void ensureRegistered_UserInUse_Succeeds() throws Exception {
            respond(400, "{\"errcode\": \"M_USER_IN_USE\", \"error\": \"taken\"}");

            assertThatCode(() -> client.ensureRegistered(GHOST)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should propagate other registration errors")
        void ensureRegistered_Exclusive_Throws() throws Exception {
            respond(400, "{\"errcode\": \"M_EXCLUSIVE\", \"error\": \"reserved\"}");

            assertThatThrownBy(() -> client.ensureRegistered(GHOST))
                    .isInstanceOf(MatrixRequestException.class);
        }
    }

    @Nested
    @DisplayName("uploadMedia")
    class UploadTests {

        @Test
        @DisplayName("should return the content URI and send the given content type")
        void uploadMedia_Success_ReturnsContentUri() throws Exception {
            respond(200, "{\"content_uri\": \"mxc://example.com/xyz\"}");

            String contentUri = client.uploadMedia(GHOST, new byte[]{1, 2, 3}, "image/png");

            assertThat(contentUri).isEqualTo("mxc://example.com/xyz");
            HttpRequest request = sentRequest();
            assertThat(request.uri().getRawPath()).isEqualTo("/_matrix/media/v3/upload");
            assertThat(request.headers().firstValue("Content-Type")).contains("image/png");
            assertThat(request.bodyPublisher()).hasValueSatisfying(body ->
                    assertThat(body.contentLength()).isEqualTo(3L));
        }

        @Test
        @DisplayName("should fail when the response has no content URI")
        void uploadMedia_MissingContentUri_Throws() throws Exception {
            respond(200, "{}");

            assertThatThrownBy(() -> client.uploadMedia(GHOST, new byte[]{1}, "image/png"))
                    .isInstanceOf(MatrixRequestException.class);
        }

        @Test
        @DisplayName("should fail on a rejected upload with a non-JSON body")
        void uploadMedia_ServerError_Throws() throws Exception {
            respond(502, "<html>Bad gateway</html>");

            assertThatThrownBy(() -> client.uploadMedia(GHOST, new byte[]{1}, "image/png"))
                    .isInstanceOf(MatrixRequestException.class)
                    .satisfies(e -> assertThat(((MatrixRequestException) e).getStatusCode()).isEqualTo(502));
        }
    }
}
