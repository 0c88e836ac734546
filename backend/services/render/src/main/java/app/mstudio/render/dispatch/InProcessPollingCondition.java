package app.mstudio.render.dispatch;

import org.springframework.boot.autoconfigure.condition.AnyNestedCondition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

/**
 * Matches whenever a job can end up submitted in-process: direct mode, substrate mode with direct fallback,
 * or an explicit {@code app.render.poller.enabled=true}.
 */
class InProcessPollingCondition extends AnyNestedCondition {

    InProcessPollingCondition() {
        super(ConfigurationPhase.REGISTER_BEAN);
    }

    @ConditionalOnProperty(name = "app.render.poller.enabled", havingValue = "true")
    static class PollerEnabled {
    }

    @ConditionalOnProperty(name = "app.render.dispatch.mode", havingValue = "direct")
    static class DirectMode {
    }

    @ConditionalOnProperty(name = "app.render.dispatch.direct-fallback", havingValue = "true")
    static class DirectFallback {
    }
}
