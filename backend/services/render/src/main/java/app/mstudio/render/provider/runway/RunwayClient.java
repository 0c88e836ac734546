package app.mstudio.render.provider.runway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

@Component
public class RunwayClient {

    private static final String VERSION_HEADER = "X-Runway-Version";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiVersion;

    public RunwayClient(RestClient.Builder restClientBuilder, RunwayProps props, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
        this.objectMapper = objectMapper;
        this.apiVersion = props.apiVersion();
    }

    /**
     * Starts a text-to-video task and returns its id.
     */
    public String createTextToVideo(String apiKey, String model, String promptText, String ratio, int duration) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("promptText", promptText);
        payload.put("ratio", ratio);
        payload.put("duration", duration);

        JsonNode response = restClient.post()
                .uri("/v1/text_to_video")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .header(VERSION_HEADER, apiVersion)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            return null;
        }
        String id = response.path("id").asText(null);
        return id != null ? id : response.path("taskId").asText(null);
    }

    public RunwayTask getTask(String apiKey, String taskId) {
        JsonNode response = restClient.get()
                .uri("/v1/tasks/{taskId}", taskId)
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .header(VERSION_HEADER, apiVersion)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            return null;
        }
        return parseTask(response);
    }

    private RunwayTask parseTask(JsonNode response) {
        JsonNode outputNode = response.path("output");
        List<String> output = new ArrayList<>();
        if (outputNode.isArray()) {
            outputNode.forEach(item -> output.add(item.asText()));
        } else if (outputNode.isTextual()) {
            output.add(outputNode.asText());
        }
        Double progress = response.hasNonNull("progress") ? response.get("progress").asDouble() : null;
        String failure = response.hasNonNull("error")
                ? response.get("error").asText()
                : response.path("failure").asText(null);
        return new RunwayTask(
                response.path("id").asText(null),
                response.path("status").asText(""),
                progress,
                output,
                response.path("thumbnail").asText(null),
                failure
        );
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
