package app.mstudio.render.job;

import app.mstudio.render.client.media.MediaApiClient;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Moves provider output that needs authenticated download into durable media storage.
 */
@Component
public class RenderOutputStorage {

    static final String VIDEO_MP4 = "video/mp4";

    private final MediaApiClient mediaApiClient;
    private final RenderEvents events;

    public RenderOutputStorage(MediaApiClient mediaApiClient, RenderEvents events) {
        this.mediaApiClient = mediaApiClient;
        this.events = events;
    }

    public RenderOutput store(RenderJobEntity job, byte[] video) {
        if (video == null || video.length == 0) {
            throw new IllegalStateException("Provider returned an empty video for job " + job.getJobId());
        }
        String fileName = "render-" + job.getJobId() + ".mp4";
        UUID mediaId = mediaApiClient.uploadRenderOutput(
                job.getWorkspaceId(), job.getJobId(), VIDEO_MP4, fileName, video);
        events.info("STORAGE:UPLOAD", "jobId={} mediaId={} bytes={}", job.getJobId(), mediaId, video.length);
        return new RenderOutput(null, null, mediaId, null);
    }
}
