package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.render.jobs")
public record RenderJobProps(
        Duration stuckThreshold,
        Duration renderTimeout,
        Integer pollBatchSize,
        Integer concurrentPolls
) {
    public RenderJobProps {
        if (stuckThreshold == null || stuckThreshold.isNegative() || stuckThreshold.isZero()) {
            stuckThreshold = Duration.ofMinutes(5);
        }
        if (renderTimeout == null || renderTimeout.isNegative() || renderTimeout.isZero()) {
            renderTimeout = Duration.ofMinutes(10);
        }
        if (pollBatchSize == null || pollBatchSize < 1) {
            pollBatchSize = 20;
        }
        if (concurrentPolls == null || concurrentPolls < 1) {
            concurrentPolls = 4;
        }
    }
}
