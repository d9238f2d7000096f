package tore.relay.service.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.RelayDeliveryException;
import tore.relay.util.EventNames;
import tore.relay.util.LogSanitizer;

/**
 * Posts canonical events to {@code {baseUrl}/api/events/{kebab-case event name}}.
 * Any 2xx answer is a success; everything else raises {@link RelayDeliveryException}.
 */
@Slf4j
public class DownstreamRelayClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public DownstreamRelayClient(OkHttpClient client, ObjectMapper mapper, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Downstream base URL cannot be null or empty");
        }
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.trim().replaceAll("/+$", "");
    }

    public String endpointFor(String eventName) {
        return baseUrl + "/api/events/" + EventNames.toKebabCase(eventName);
    }

    public void relay(String eventName, CanonicalEvent payload) {
        String endpoint = endpointFor(eventName);
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RelayDeliveryException("Cannot serialize " + eventName + " payload: " + e.getOriginalMessage(), e);
        }

        Request request = new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(body, JSON))
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                ResponseBody responseBody = response.body();
                String detail = responseBody != null ? LogSanitizer.truncate(responseBody.string()) : "";
                throw new RelayDeliveryException(
                    response.code(),
                    "Downstream " + endpoint + " responded with " + response.code() + (detail.isEmpty() ? "" : ": " + detail)
                );
            }
            log.debug("Relayed {} to {} ({})", eventName, endpoint, response.code());
        } catch (IOException e) {
            throw new RelayDeliveryException("Downstream " + endpoint + " unreachable: " + e.getMessage(), e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
