package app.mstudio.render.provider.heygen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class HeyGenClient {

    private static final String API_KEY_HEADER = "X-Api-Key";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HeyGenClient(RestClient.Builder restClientBuilder, HeyGenProps props, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
        this.objectMapper = objectMapper;
    }

    /**
     * Requests an avatar video reading the script aloud and returns the video id.
     */
    public String generateAvatarVideo(String apiKey, String avatarId, String voiceId, String script, int width, int height) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode input = payload.putArray("video_inputs").addObject();
        ObjectNode character = input.putObject("character");
        character.put("type", "avatar");
        character.put("avatar_id", avatarId);
        character.put("avatar_style", "normal");
        ObjectNode voice = input.putObject("voice");
        voice.put("type", "text");
        voice.put("input_text", script);
        voice.put("voice_id", voiceId);
        ObjectNode dimension = payload.putObject("dimension");
        dimension.put("width", width);
        dimension.put("height", height);

        JsonNode response = restClient.post()
                .uri("/v2/video/generate")
                .header(API_KEY_HEADER, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        return response == null ? null : response.path("data").path("video_id").asText(null);
    }

    public HeyGenVideoStatus getVideoStatus(String apiKey, String videoId) {
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/v1/video_status.get")
                        .queryParam("video_id", videoId)
                        .build())
                .header(API_KEY_HEADER, apiKey)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            return null;
        }
        JsonNode data = response.path("data");
        JsonNode error = data.path("error");
        String errorMessage = error.isObject() ? error.path("message").asText(null) : error.asText(null);
        return new HeyGenVideoStatus(
                data.path("status").asText(""),
                data.path("video_url").asText(null),
                data.path("thumbnail_url").asText(null),
                errorMessage
        );
    }
}
