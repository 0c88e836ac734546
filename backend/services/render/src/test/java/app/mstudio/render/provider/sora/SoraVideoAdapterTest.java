package app.mstudio.render.provider.sora;

import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.provider.ProviderErrorKind;
import app.mstudio.render.provider.ProviderException;
import app.mstudio.render.provider.ProviderPollResult;
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
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SoraVideoAdapterTest {

    MockRestServiceServer server;
    SoraVideoAdapter adapter;

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        SoraProps props = new SoraProps(null, null);
        adapter = new SoraVideoAdapter(new SoraClient(builder, props, new ObjectMapper()), props,
                new RenderEvents(new SimpleMeterRegistry()));
    }

    @Test
    void estimateCost_usesProRateAndDurations() {
        assertThat(adapter.estimateCost(8, "sora-2")).isEqualByComparingTo(new BigDecimal("0.80"));
        assertThat(adapter.estimateCost(8, "sora-2-pro")).isEqualByComparingTo(new BigDecimal("3.00"));
        assertThat(adapter.estimateCost(40, "sora-2-pro")).isEqualByComparingTo(new BigDecimal("7.50"));
    }

    @Test
    void submit_sendsSecondsAsStringAndMappedSize() {
        server.expect(requestTo("https://api.openai.com/v1/videos"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("sora-2"))
                .andExpect(jsonPath("$.size").value("720x1280"))
                .andExpect(jsonPath("$.seconds").value("8"))
                .andRespond(withSuccess("{\"id\":\"video_1\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        assertThat(adapter.submit(new ProviderSubmitRequest("City lights", 6, "9:16", null, "sk-test"))
                .providerJobId()).isEqualTo("video_1");
        server.verify();
    }

    @Test
    void submit_badRequestIsPayloadError() {
        server.expect(requestTo("https://api.openai.com/v1/videos"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> adapter.submit(new ProviderSubmitRequest("p", 4, "16:9", null, "sk-test")))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProviderErrorKind.PAYLOAD);
                    assertThat(ex.getKind().retryable()).isFalse();
                });
    }

    @Test
    void poll_completedRequiresDownload() {
        server.expect(requestTo("https://api.openai.com/v1/videos/video_1"))
                .andRespond(withSuccess("{\"id\":\"video_1\",\"status\":\"completed\",\"progress\":100}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("video_1", "sk-test");

        assertThat(result.status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(result.requiresDownload()).isTrue();
        assertThat(result.outputUrl()).isEqualTo("https://api.openai.com/v1/videos/video_1/content");
    }

    @Test
    void poll_inProgressKeepsProgress() {
        server.expect(requestTo("https://api.openai.com/v1/videos/video_1"))
                .andRespond(withSuccess("{\"id\":\"video_1\",\"status\":\"in_progress\",\"progress\":35}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("video_1", "sk-test");

        assertThat(result.status()).isEqualTo(RenderJobStatus.PROCESSING);
        assertThat(result.progress()).isEqualTo(35);
    }

    @Test
    void poll_failedUsesErrorMessage() {
        server.expect(requestTo("https://api.openai.com/v1/videos/video_1"))
                .andRespond(withSuccess("{\"id\":\"video_1\",\"status\":\"failed\",\"error\":{\"message\":\"policy\"}}",
                        MediaType.APPLICATION_JSON));

        ProviderPollResult result = adapter.poll("video_1", "sk-test");

        assertThat(result.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(result.errorMessage()).isEqualTo("policy");
    }

    @Test
    void download_returnsBytes() {
        server.expect(requestTo("https://api.openai.com/v1/videos/video_1/content"))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.parseMediaType("video/mp4")));

        assertThat(adapter.download("video_1", "sk-test")).containsExactly(1, 2, 3);
    }

    @Test
    void download_emptyBodyIsUpstreamError() {
        server.expect(requestTo("https://api.openai.com/v1/videos/video_1/content"))
                .andRespond(withSuccess(new byte[0], MediaType.parseMediaType("video/mp4")));

        assertThatThrownBy(() -> adapter.download("video_1", "sk-test"))
                .isInstanceOfSatisfying(ProviderException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ProviderErrorKind.UPSTREAM));
    }
}
