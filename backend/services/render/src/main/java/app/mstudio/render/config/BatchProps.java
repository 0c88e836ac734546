package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.render.batch")
public record BatchProps(
        Integer windowSize,
        Integer executorThreads
) {
    public BatchProps {
        if (windowSize == null || windowSize < 1) {
            windowSize = 2;
        }
        if (executorThreads == null || executorThreads < windowSize) {
            executorThreads = windowSize;
        }
    }
}
