package app.mstudio.render.batch;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs tasks in fixed windows: a window of at most {@code windowSize} tasks runs concurrently, and the next
 * window starts only after every task of the current one finished.
 */
@Component
public class ConcurrencyGate {

    private final Executor executor;

    public ConcurrencyGate(@Qualifier("renderDispatchExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * A task that throws aborts the remaining windows; callers that need per-item results catch inside the task.
     *
     * @return results in input order
     */
    public <T, R> List<R> runInWindows(List<T> items, int windowSize, Function<T, R> task) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        List<R> results = new ArrayList<>(items.size());
        for (int start = 0; start < items.size(); start += windowSize) {
            List<T> window = items.subList(start, Math.min(start + windowSize, items.size()));
            List<CompletableFuture<R>> futures = new ArrayList<>(window.size());
            for (T item : window) {
                futures.add(CompletableFuture.supplyAsync(() -> task.apply(item), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<R> future : futures) {
                results.add(future.join());
            }
        }
        return results;
    }
}
