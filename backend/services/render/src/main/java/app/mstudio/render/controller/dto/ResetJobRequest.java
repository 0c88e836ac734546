package app.mstudio.render.controller.dto;

public record ResetJobRequest(
        boolean force
) {
}
