package tore.relay.service.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.RelayDeliveryException;
import tore.relay.support.QueueFixtures;

@ExtendWith(MockitoExtension.class)
class DownstreamRelayClientTest {

    private static final String BASE_URL = "https://api.example.com/";

    @Mock
    private OkHttpClient okHttpClient;

    @Mock
    private Call call;

    @Mock
    private Response response;

    @Mock
    private ResponseBody responseBody;

    private final ObjectMapper mapper = new ObjectMapper();
    private DownstreamRelayClient relayClient;

    @BeforeEach
    void setUp() {
        relayClient = new DownstreamRelayClient(new OkHttpClient(), mapper, BASE_URL);
        ReflectionTestUtils.setField(relayClient, "client", okHttpClient);
    }

    @Nested
    @DisplayName("Endpoint Tests")
    class EndpointTests {

        @Test
        @DisplayName("Should trim trailing slashes and kebab-case the event name")
        void shouldBuildEndpoint() {
            assertThat(relayClient.getBaseUrl()).isEqualTo("https://api.example.com");
            assertThat(relayClient.endpointFor("NftLocked")).isEqualTo("https://api.example.com/api/events/nft-locked");
            assertThat(relayClient.endpointFor("NFTListed")).isEqualTo("https://api.example.com/api/events/nft-listed");
        }

        @Test
        @DisplayName("Should require a base URL")
        void shouldRequireBaseUrl() {
            assertThatThrownBy(() -> new DownstreamRelayClient(new OkHttpClient(), mapper, " "))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Relay Tests")
    class RelayTests {

        @Test
        @DisplayName("Should POST the canonical event as JSON")
        void shouldPostPayload() throws IOException {
            CanonicalEvent event = QueueFixtures.event("NftLocked", 120, 3);
            when(okHttpClient.newCall(any(Request.class))).thenReturn(call);
            when(call.execute()).thenReturn(response);
            when(response.isSuccessful()).thenReturn(true);
            when(response.code()).thenReturn(202);

            relayClient.relay("NftLocked", event);

            ArgumentCaptor<Request> requestCaptor = ArgumentCaptor.forClass(Request.class);
            verify(okHttpClient).newCall(requestCaptor.capture());
            Request request = requestCaptor.getValue();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.url().toString()).isEqualTo("https://api.example.com/api/events/nft-locked");
            assertThat(request.body().contentType().toString()).startsWith("application/json");

            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            JsonNode body = mapper.readTree(buffer.readUtf8());
            assertThat(body.get("eventName").asText()).isEqualTo("NftLocked");
            assertThat(body.get("blockNumber").asLong()).isEqualTo(120);
            assertThat(body.get("logIndex").asLong()).isEqualTo(3);
            assertThat(body.get("removed").asBoolean()).isFalse();
            assertThat(body.get("sourceContract").asText()).isEqualTo("NftVault");
            assertThat(body.get("args").get("tokenId").asText()).isEqualTo("120");
            verify(response).close();
        }

        @Test
        @DisplayName("Should fail with the status code on non-2xx responses")
        void shouldFailOnServerError() throws IOException {
            when(okHttpClient.newCall(any(Request.class))).thenReturn(call);
            when(call.execute()).thenReturn(response);
            when(response.isSuccessful()).thenReturn(false);
            when(response.code()).thenReturn(500);
            when(response.body()).thenReturn(responseBody);
            when(responseBody.string()).thenReturn("Internal Server Error");

            assertThatThrownBy(() -> relayClient.relay("NftLocked", QueueFixtures.event("NftLocked", 1, 0)))
                .isInstanceOf(RelayDeliveryException.class)
                .hasMessageContaining("500")
                .hasMessageContaining("Internal Server Error")
                .satisfies(e -> assertThat(((RelayDeliveryException) e).getStatusCode()).isEqualTo(500));
        }

        @Test
        @DisplayName("Should fail without a status code when the service is unreachable")
        void shouldFailWhenUnreachable() throws IOException {
            when(okHttpClient.newCall(any(Request.class))).thenReturn(call);
            when(call.execute()).thenThrow(new IOException("Connection refused"));

            assertThatThrownBy(() -> relayClient.relay("NftLocked", QueueFixtures.event("NftLocked", 1, 0)))
                .isInstanceOf(RelayDeliveryException.class)
                .hasMessageContaining("unreachable")
                .satisfies(e -> assertThat(((RelayDeliveryException) e).hasResponse()).isFalse());
        }
    }
}
