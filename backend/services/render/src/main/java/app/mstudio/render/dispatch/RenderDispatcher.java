package app.mstudio.render.dispatch;

import app.mstudio.render.domain.entity.RenderJobEntity;

/**
 * Hands a QUEUED job over for execution. Implementations return once the hand-off is done; they never wait
 * for the render itself.
 */
public interface RenderDispatcher {

    DispatchOutcome dispatch(RenderJobEntity job);
}
