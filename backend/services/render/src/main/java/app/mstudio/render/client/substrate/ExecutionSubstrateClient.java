package app.mstudio.render.client.substrate;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Publishes render events to the durable execution substrate. The substrate calls back into the internal
 * step endpoints with its own retries.
 */
@Component
public class ExecutionSubstrateClient {

    private final RestClient restClient;
    private final SubstrateProps props;

    public ExecutionSubstrateClient(RestClient.Builder restClientBuilder, SubstrateProps props) {
        this.restClient = restClientBuilder.build();
        this.props = props;
    }

    public void send(RenderEventData data) {
        if (props.eventUrl() == null || props.eventUrl().isBlank()) {
            throw new IllegalStateException("app.render.substrate.event-url is not configured");
        }
        RestClient.RequestBodySpec request = restClient.post()
                .uri(props.eventUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("name", props.eventName(), "data", data));
        if (props.eventKey() != null && !props.eventKey().isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + props.eventKey());
        }
        request.retrieve().toBodilessEntity();
    }
}
