package app.mstudio.render.domain.type;

public enum RenderJobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
