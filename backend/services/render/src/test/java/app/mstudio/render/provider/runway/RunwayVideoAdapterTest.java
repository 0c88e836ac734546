package app.mstudio.render.provider.runway;

import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.provider.ProviderErrorKind;
import app.mstudio.render.provider.ProviderException;
import app.mstudio.render.provider.ProviderPollResult;
import app.mstudio.render.provider.ProviderSubmission;
import app.mstudio.render.provider.ProviderSubmitRequest;
import app.mstudio.render.support.RenderEvents;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RunwayVideoAdapterTest {

    private static final String BASE = "https://api.dev.runwayml.com";

    MockRestServiceServer server;
    RunwayVideoAdapter adapter;

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RunwayProps props = new RunwayProps(null, null, null);
        RunwayClient client = new RunwayClient(builder, props, new ObjectMapper());
        adapter = new RunwayVideoAdapter(client, props, new RenderEvents(new SimpleMeterRegistry()));
    }

    @Test
    void estimateCost_snapsDurationUpAndCapsAtLongest() {
        assertThat(adapter.estimateCost(8, null)).isEqualByComparingTo(new BigDecimal("2.72"));
        assertThat(adapter.estimateCost(5, null)).isEqualByComparingTo(new BigDecimal("2.04"));
        assertThat(adapter.estimateCost(10, null)).isEqualByComparingTo(new BigDecimal("2.72"));
    }

    @Test
    void submit_sendsVersionHeaderAndMappedRatio() {
        server.expect(requestTo(BASE + "/v1/text_to_video"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer rw-key"))
                .andExpect(header("X-Runway-Version", "2024-11-06"))
                .andExpect(jsonPath("$.ratio").value("720:1280"))
                .andExpect(jsonPath("$.duration").value(6))
                .andExpect(jsonPath("$.model").value("veo3.1"))
                .andRespond(withSuccess("{\"id\":\"task-1\"}", MediaType.APPLICATION_JSON));

        ProviderSubmission submission = adapter.submit(
                new ProviderSubmitRequest("A quiet harbour at dawn", 5, "9:16", null, "rw-key"));

        assertThat(submission.providerJobId()).isEqualTo("task-1");
        assertThat(submission.status()).isEqualTo(RenderJobStatus.QUEUED);
        server.verify();
    }

    @Test
    void submit_truncatesLongPrompt() {
        server.expect(requestTo(BASE + "/v1/text_to_video"))
                .andExpect(jsonPath("$.promptText").value("x".repeat(RunwayVideoAdapter.MAX_PROMPT_LENGTH)))
                .andRespond(withSuccess("{\"taskId\":\"task-2\"}", MediaType.APPLICATION_JSON));

        ProviderSubmission submission = adapter.submit(
                new ProviderSubmitRequest("x".repeat(1500), 8, "16:9", null, "rw-key"));

        assertThat(submission.providerJobId()).isEqualTo("task-2");
    }

    @Test
    void submit_unauthorizedIsNotRetryable() {
        server.expect(requestTo(BASE + "/v1/text_to_video"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> adapter.submit(new ProviderSubmitRequest("p", 4, "16:9", null, "bad")))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProviderErrorKind.AUTH);
                    assertThat(ex.getKind().retryable()).isFalse();
                });
    }

    @Test
    void poll_rateLimitIsRetryable() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> adapter.poll("task-1", "rw-key"))
                .isInstanceOfSatisfying(ProviderException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProviderErrorKind.RATE_LIMITED));
    }

    @Test
    void poll_serverErrorIsUpstream() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> adapter.poll("task-1", "rw-key"))
                .isInstanceOfSatisfying(ProviderException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProviderErrorKind.UPSTREAM));
    }

    @Test
    void poll_mapsRunningProgressToPercent() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"id\":\"task-1\",\"status\":\"RUNNING\",\"progress\":0.42}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("task-1", "rw-key");

        assertThat(result.status()).isEqualTo(RenderJobStatus.PROCESSING);
        assertThat(result.progress()).isEqualTo(42);
    }

    @Test
    void poll_throttledIsQueued() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withSuccess("{\"id\":\"task-1\",\"status\":\"THROTTLED\"}", MediaType.APPLICATION_JSON));

        assertThat(adapter.poll("task-1", "rw-key").status()).isEqualTo(RenderJobStatus.QUEUED);
    }

    @Test
    void poll_succeededReturnsFirstOutput() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withSuccess("""
                        {"id":"task-1","status":"SUCCEEDED","output":["https://cdn.example/v.mp4"],
                         "thumbnail":"https://cdn.example/t.jpg"}
                        """, MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("task-1", "rw-key");

        assertThat(result.status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(result.outputUrl()).isEqualTo("https://cdn.example/v.mp4");
        assertThat(result.thumbnailUrl()).isEqualTo("https://cdn.example/t.jpg");
        assertThat(result.requiresDownload()).isFalse();
    }

    @Test
    void poll_succeededWithoutOutputCompletesWithNoUrl() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withSuccess("{\"id\":\"task-1\",\"status\":\"SUCCEEDED\",\"output\":[]}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("task-1", "rw-key");

        assertThat(result.status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(result.outputUrl()).isNull();
        assertThat(result.requiresDownload()).isFalse();
    }

    @Test
    void poll_failedCarriesVendorMessage() {
        server.expect(requestTo(BASE + "/v1/tasks/task-1"))
                .andRespond(withSuccess("{\"id\":\"task-1\",\"status\":\"FAILED\",\"failure\":\"Content moderated\"}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("task-1", "rw-key");

        assertThat(result.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(result.errorMessage()).isEqualTo("Content moderated");
    }
}
