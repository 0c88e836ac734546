package app.mstudio.render.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Runs scene submissions of a render plan. Window size is enforced by the concurrency gate, not the pool.
     */
    @Bean(name = "renderDispatchExecutor")
    public ThreadPoolTaskExecutor renderDispatchExecutor(BatchProps props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.executorThreads());
        executor.setMaxPoolSize(props.executorThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("render-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "renderPollExecutor")
    public ThreadPoolTaskExecutor renderPollExecutor(RenderJobProps props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.concurrentPolls());
        executor.setMaxPoolSize(props.concurrentPolls());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("render-poll-");
        executor.initialize();
        return executor;
    }
}
