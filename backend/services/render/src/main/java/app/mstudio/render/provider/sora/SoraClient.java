package app.mstudio.render.provider.sora;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * OpenAI videos API.
 */
@Component
public class SoraClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public SoraClient(RestClient.Builder restClientBuilder, SoraProps props, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = props.baseUrl();
    }

    public SoraVideoJob createVideo(String apiKey, String model, String prompt, String size, int seconds) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("size", size);
        payload.put("seconds", String.valueOf(seconds));

        JsonNode response = restClient.post()
                .uri("/v1/videos")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        return response == null ? null : parseVideoJob(response);
    }

    public SoraVideoJob getVideo(String apiKey, String videoId) {
        JsonNode response = restClient.get()
                .uri("/v1/videos/{videoId}", videoId)
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .retrieve()
                .body(JsonNode.class);

        return response == null ? null : parseVideoJob(response);
    }

    public byte[] downloadContent(String apiKey, String videoId) {
        return restClient.get()
                .uri("/v1/videos/{videoId}/content", videoId)
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .retrieve()
                .body(byte[].class);
    }

    public String contentUrl(String videoId) {
        return baseUrl + "/v1/videos/" + videoId + "/content";
    }

    private SoraVideoJob parseVideoJob(JsonNode response) {
        String id = response.path("id").asText(null);
        String status = response.path("status").asText("");
        Integer progress = response.hasNonNull("progress") ? response.path("progress").asInt() : null;
        String model = response.path("model").asText(null);
        String error = response.path("error").path("message").asText(null);
        return new SoraVideoJob(id, status, progress, model, error);
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
