package app.mstudio.render.dispatch;

import app.mstudio.render.config.RenderJobProps;
import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderJobStatus;
import app.mstudio.render.repository.RenderJobRepository;
import app.mstudio.render.support.RenderEvents;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Conditional;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * In-process stand-in for the substrate's poll loop, active whenever a job can be submitted directly. Young jobs
 * are polled every 15 seconds, jobs older than two minutes every 30 seconds.
 */
@Service
@Conditional(InProcessPollingCondition.class)
public class RenderPollWorker {

    static final Duration FAST_INTERVAL = Duration.ofSeconds(15);
    static final Duration SLOW_INTERVAL = Duration.ofSeconds(30);
    static final Duration SLOW_AFTER = Duration.ofMinutes(2);

    private final RenderJobRepository jobRepository;
    private final RenderStepExecutor stepExecutor;
    private final TaskExecutor executor;
    private final RenderEvents events;
    private final Clock clock;
    private final int batchSize;
    private final Semaphore pollSlots;
    private final Map<UUID, Instant> lastPolled = new ConcurrentHashMap<>();

    public RenderPollWorker(RenderJobRepository jobRepository,
                            RenderStepExecutor stepExecutor,
                            @Qualifier("renderPollExecutor") TaskExecutor executor,
                            RenderJobProps props,
                            RenderEvents events,
                            Clock clock) {
        this.jobRepository = jobRepository;
        this.stepExecutor = stepExecutor;
        this.executor = executor;
        this.events = events;
        this.clock = clock;
        this.batchSize = props.pollBatchSize();
        this.pollSlots = new Semaphore(props.concurrentPolls());
    }

    @Scheduled(fixedDelayString = "${app.render.poller.interval-ms:15000}")
    public void pollActiveJobs() {
        List<RenderJobEntity> active = jobRepository.findByStatusInAndProviderJobIdIsNotNullOrderByUpdatedAtAsc(
                EnumSet.of(RenderJobStatus.QUEUED, RenderJobStatus.PROCESSING),
                PageRequest.of(0, batchSize)
        );
        Set<UUID> activeIds = new HashSet<>();
        for (RenderJobEntity job : active) {
            activeIds.add(job.getJobId());
        }
        // jobs finished outside this worker (stuck reset, forced reset, dispatch failure)
        lastPolled.keySet().retainAll(activeIds);

        Instant now = Instant.now(clock);
        for (RenderJobEntity job : active) {
            if (!isDue(job, now)) {
                continue;
            }
            if (!pollSlots.tryAcquire()) {
                return;
            }
            submitPoll(job.getJobId(), now);
        }
    }

    boolean isDue(RenderJobEntity job, Instant now) {
        Instant previous = lastPolled.get(job.getJobId());
        if (previous == null) {
            return true;
        }
        Instant started = job.getStartedAt() != null ? job.getStartedAt() : job.getQueuedAt();
        Duration interval = started != null && Duration.between(started, now).compareTo(SLOW_AFTER) > 0
                ? SLOW_INTERVAL
                : FAST_INTERVAL;
        return Duration.between(previous, now).compareTo(interval) >= 0;
    }

    int trackedJobs() {
        return lastPolled.size();
    }

    private void submitPoll(UUID jobId, Instant now) {
        lastPolled.put(jobId, now);
        try {
            executor.execute(() -> {
                try {
                    StepOutcome outcome = stepExecutor.poll(jobId);
                    if (outcome.finished() || outcome.status() == null) {
                        lastPolled.remove(jobId);
                    }
                } catch (RuntimeException ex) {
                    events.error("JOB:POLL", "jobId={} error={}", jobId, RenderEvents.safeMessage(ex, 300));
                } finally {
                    pollSlots.release();
                }
            });
        } catch (TaskRejectedException ex) {
            pollSlots.release();
            lastPolled.remove(jobId);
            events.warn("JOB:POLL", "poll executor rejected jobId={}", jobId);
        }
    }
}
