package app.mstudio.render.job;

import app.mstudio.render.domain.entity.RenderJobEntity;

import java.util.UUID;

/**
 * A newly opened job and, when a stuck job was reset to make room for it, the id of that job.
 */
public record JobAdmission(RenderJobEntity job, UUID replacedJobId) {
}
