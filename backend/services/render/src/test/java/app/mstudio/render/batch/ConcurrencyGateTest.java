package app.mstudio.render.batch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGateTest {

    ExecutorService pool;
    ConcurrencyGate gate;

    @BeforeEach
    void setup() {
        pool = Executors.newFixedThreadPool(8);
        gate = new ConcurrencyGate(pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void runInWindows_neverExceedsWindowSize() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<String> results = gate.runInWindows(List.of(1, 2, 3, 4, 5), 2, item -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleep(40);
            inFlight.decrementAndGet();
            return "scene-" + item;
        });

        assertThat(results).containsExactly("scene-1", "scene-2", "scene-3", "scene-4", "scene-5");
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(inFlight.get()).isZero();
    }

    @Test
    void runInWindows_startsNextWindowOnlyAfterCurrentOneFinished() {
        List<String> log = Collections.synchronizedList(new ArrayList<>());

        gate.runInWindows(List.of(1, 2, 3), 2, item -> {
            log.add("start-" + item);
            sleep(item == 1 ? 60 : 10);
            log.add("end-" + item);
            return item;
        });

        assertThat(log.indexOf("start-3")).isGreaterThan(log.indexOf("end-1"));
        assertThat(log.indexOf("start-3")).isGreaterThan(log.indexOf("end-2"));
    }

    @Test
    void runInWindows_emptyInputRunsNothing() {
        assertThat(gate.runInWindows(List.<Integer>of(), 3, item -> item)).isEmpty();
    }

    @Test
    void runInWindows_rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> gate.runInWindows(List.of(1), 0, item -> item))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runInWindows_failingTaskAbortsLaterWindows() {
        AtomicInteger started = new AtomicInteger();

        assertThatThrownBy(() -> gate.runInWindows(List.of(1, 2, 3, 4), 2, item -> {
            started.incrementAndGet();
            if (item == 2) {
                throw new IllegalStateException("boom");
            }
            return item;
        })).isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(started.get()).isEqualTo(2);
    }

    private static void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
