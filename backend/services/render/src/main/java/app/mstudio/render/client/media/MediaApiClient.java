package app.mstudio.render.client.media;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class MediaApiClient {

    private final RestClient restClient;
    private final MediaClientProps props;

    public MediaApiClient(RestClient.Builder restClientBuilder, MediaClientProps props) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.props = props;
    }

    /**
     * Uploads a finished render on behalf of the owning workspace and returns the new media id.
     */
    public UUID uploadRenderOutput(UUID ownerWorkspaceId,
                                   UUID renderJobId,
                                   String contentType,
                                   String fileName,
                                   byte[] content) {
        if (!props.hasInternalToken()) {
            throw new IllegalStateException("app.render.media.internal-token is required to store render outputs");
        }

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("meta", new MediaDirectUploadRequest(
                        props.outputKind(), contentType, fileName, ownerWorkspaceId, renderJobId))
                .contentType(MediaType.APPLICATION_JSON);
        builder.part("file", new NamedByteArrayResource(content, fileName))
                .contentType(MediaType.parseMediaType(contentType));

        MediaUploadReceipt receipt = restClient.post()
                .uri("/internal/uploads")
                .header(HttpHeaders.AUTHORIZATION, bearer(props.internalToken()))
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(builder.build())
                .retrieve()
                .body(MediaUploadReceipt.class);

        if (receipt == null || !receipt.accepted()) {
            throw new IllegalStateException("Media service did not accept render output " + fileName);
        }
        return receipt.mediaId();
    }

    public Optional<MediaResolved> resolve(UUID mediaId) {
        Map<String, Object> payload = Map.of("mediaIds", List.of(mediaId));
        RestClient.RequestBodySpec request = restClient.post()
                .uri("/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload);
        if (props.hasInternalToken()) {
            request.header(HttpHeaders.AUTHORIZATION, bearer(props.internalToken()));
        }
        List<MediaResolved> resolved = request.retrieve()
                .body(new ParameterizedTypeReference<List<MediaResolved>>() {});
        if (resolved == null) {
            return Optional.empty();
        }
        return resolved.stream()
                .filter(item -> mediaId.equals(item.mediaId()) && item.downloadable())
                .findFirst();
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }

    private static class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] content, String filename) {
            super(content);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
