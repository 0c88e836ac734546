package app.mstudio.render.domain.entity;

import app.mstudio.render.domain.RenderJobConfig;
import app.mstudio.render.domain.type.RenderErrorCode;
import app.mstudio.render.domain.type.RenderJobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "render_jobs", schema = "app_render")
public class RenderJobEntity {

    @Id
    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    @Column(name = "content_id")
    private UUID contentId;

    @Column(name = "version_id")
    private UUID versionId;

    @Column(name = "scene_number")
    private Integer sceneNumber;

    @Column(name = "previous_job_id")
    private UUID previousJobId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "status", columnDefinition = "render_job_status", nullable = false)
    private RenderJobStatus status;

    @Column(name = "progress", nullable = false)
    private Integer progress;

    @Column(name = "progress_message")
    private String progressMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code")
    private RenderErrorCode errorCode;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "provider", nullable = false)
    private String provider;

    @Column(name = "provider_job_id")
    private String providerJobId;

    @Column(name = "provider_status")
    private String providerStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config", columnDefinition = "jsonb", nullable = false)
    private RenderJobConfig config;

    @Column(name = "input_prompt")
    private String inputPrompt;

    @Column(name = "estimated_cost")
    private BigDecimal estimatedCost;

    @Column(name = "actual_cost")
    private BigDecimal actualCost;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "ledger_entry_id")
    private Long ledgerEntryId;

    @Column(name = "output_url")
    private String outputUrl;

    @Column(name = "thumbnail_url")
    private String thumbnailUrl;

    @Column(name = "output_media_id")
    private UUID outputMediaId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "storyboard", columnDefinition = "jsonb")
    private JsonNode storyboard;

    @Column(name = "placeholder_output", nullable = false)
    private boolean placeholderOutput;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public RenderJobEntity() {
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(UUID workspaceId) {
        this.workspaceId = workspaceId;
    }

    public UUID getContentId() {
        return contentId;
    }

    public void setContentId(UUID contentId) {
        this.contentId = contentId;
    }

    public UUID getVersionId() {
        return versionId;
    }

    public void setVersionId(UUID versionId) {
        this.versionId = versionId;
    }

    public Integer getSceneNumber() {
        return sceneNumber;
    }

    public void setSceneNumber(Integer sceneNumber) {
        this.sceneNumber = sceneNumber;
    }

    public UUID getPreviousJobId() {
        return previousJobId;
    }

    public void setPreviousJobId(UUID previousJobId) {
        this.previousJobId = previousJobId;
    }

    public RenderJobStatus getStatus() {
        return status;
    }

    public void setStatus(RenderJobStatus status) {
        this.status = status;
    }

    public Integer getProgress() {
        return progress;
    }

    public void setProgress(Integer progress) {
        this.progress = progress;
    }

    public String getProgressMessage() {
        return progressMessage;
    }

    public void setProgressMessage(String progressMessage) {
        this.progressMessage = progressMessage;
    }

    public RenderErrorCode getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(RenderErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getProviderJobId() {
        return providerJobId;
    }

    public void setProviderJobId(String providerJobId) {
        this.providerJobId = providerJobId;
    }

    public String getProviderStatus() {
        return providerStatus;
    }

    public void setProviderStatus(String providerStatus) {
        this.providerStatus = providerStatus;
    }

    public RenderJobConfig getConfig() {
        return config;
    }

    public void setConfig(RenderJobConfig config) {
        this.config = config;
    }

    public String getInputPrompt() {
        return inputPrompt;
    }

    public void setInputPrompt(String inputPrompt) {
        this.inputPrompt = inputPrompt;
    }

    public BigDecimal getEstimatedCost() {
        return estimatedCost;
    }

    public void setEstimatedCost(BigDecimal estimatedCost) {
        this.estimatedCost = estimatedCost;
    }

    public BigDecimal getActualCost() {
        return actualCost;
    }

    public void setActualCost(BigDecimal actualCost) {
        this.actualCost = actualCost;
    }

    public Integer getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(Integer retryCount) {
        this.retryCount = retryCount;
    }

    public Long getLedgerEntryId() {
        return ledgerEntryId;
    }

    public void setLedgerEntryId(Long ledgerEntryId) {
        this.ledgerEntryId = ledgerEntryId;
    }

    public String getOutputUrl() {
        return outputUrl;
    }

    public void setOutputUrl(String outputUrl) {
        this.outputUrl = outputUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public UUID getOutputMediaId() {
        return outputMediaId;
    }

    public void setOutputMediaId(UUID outputMediaId) {
        this.outputMediaId = outputMediaId;
    }

    public JsonNode getStoryboard() {
        return storyboard;
    }

    public void setStoryboard(JsonNode storyboard) {
        this.storyboard = storyboard;
    }

    public boolean isPlaceholderOutput() {
        return placeholderOutput;
    }

    public void setPlaceholderOutput(boolean placeholderOutput) {
        this.placeholderOutput = placeholderOutput;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public void setQueuedAt(Instant queuedAt) {
        this.queuedAt = queuedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
