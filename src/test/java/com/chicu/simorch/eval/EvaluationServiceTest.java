package com.chicu.simorch.eval;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationException;
import com.chicu.simorch.common.error.SimulationFailedException;
import com.chicu.simorch.simulator.ProcessOutcome;
import com.chicu.simorch.support.EvaluationFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final AtomicInteger calls = new AtomicInteger();
    private final List<List<String>> seenArgs = new CopyOnWriteArrayList<>();
    private EvaluationFixture fx;

    @AfterEach
    void tearDown() {
        if (fx != null) fx.close();
    }

    private static EvaluationParams softPhysics() {
        return EvaluationParams.builder()
                .threshold(Threshold.SOFT)
                .beta(30.0)
                .xpmMode(XpmMode.PHYSICS)
                .build();
    }

    @Test
    void secondCallWithinTtl_shouldBeServedFromCache_evenIfSimulatorWouldFail() {
        fx = new EvaluationFixture((args, timeout) -> {
            if (calls.incrementAndGet() == 1) {
                return ProcessOutcome.of(0, "{\"logic_margin\": 5.0, \"ber_estimate\": 0.01}", "");
            }
            throw new IllegalStateException("simulator must not be called twice");
        });

        EvaluationResult first = fx.service.evaluate(softPhysics(), TIMEOUT);
        EvaluationResult second = fx.service.evaluate(softPhysics(), TIMEOUT);

        assertEquals(1, calls.get());
        assertEquals(5.0, first.metrics().get("logic_margin"));
        assertEquals(0.01, first.metrics().get("ber_estimate"));
        assertEquals(first.metrics(), second.metrics());
        assertEquals(first.runId(), second.runId());
        assertEquals(first.rawOutput(), second.rawOutput());
    }

    @Test
    void afterTtl_shouldInvokeSimulatorAgain() {
        fx = new EvaluationFixture((args, timeout) -> {
            calls.incrementAndGet();
            return ProcessOutcome.of(0, "{\"logic_margin\": 1.0}", "");
        });

        fx.service.evaluate(softPhysics(), TIMEOUT);
        fx.nanos.addAndGet(fx.cacheProps.ttl().plusSeconds(1).toNanos());
        fx.service.evaluate(softPhysics(), TIMEOUT);

        assertEquals(2, calls.get());
    }

    @Test
    void slowSimulator_shouldFailWithTimeoutKind() {
        fx = new EvaluationFixture((args, timeout) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProcessOutcome.of(0, "{}", "");
        });

        SimulationException e = assertThrows(SimulationException.class,
                () -> fx.service.evaluate(softPhysics(), Duration.ofMillis(200)));
        assertEquals(ErrorKind.TIMEOUT, e.kind());
    }

    @Test
    void expiredDeadline_shouldNotStartQueuedSimulatorRuns() throws Exception {
        // один worker: первый вызов занимает его дольше дедлайна, остальные ждут в очереди
        fx = new EvaluationFixture((args, timeout) -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(600);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProcessOutcome.of(0, "{}", "");
        }, 1);

        List<CompletableFuture<EvaluationResult>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            EvaluationParams p = softPhysics().toBuilder().beta(10.0 + i).build();
            futures.add(fx.service.evaluateAsync(p, Duration.ofMillis(200)));
        }
        for (CompletableFuture<EvaluationResult> f : futures) {
            CompletionException e = assertThrows(CompletionException.class, f::join);
            assertEquals(ErrorKind.TIMEOUT, ErrorKind.of(e.getCause()));
        }

        // пул FIFO: пустая задача выполнится только после всех ранее поставленных
        fx.executors.workers().submit(() -> { }).get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get(), "просроченные задачи из очереди не должны запускать симулятор");
    }

    @Test
    void simulator_shouldGetOnlyRemainingDeadline() {
        List<Duration> granted = new CopyOnWriteArrayList<>();
        fx = new EvaluationFixture((args, timeout) -> {
            granted.add(timeout);
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProcessOutcome.of(0, "{}", "");
        }, 1);

        Duration deadline = Duration.ofMillis(1_500);
        CompletableFuture<EvaluationResult> first = fx.service.evaluateAsync(softPhysics(), deadline);
        CompletableFuture<EvaluationResult> second = fx.service.evaluateAsync(softPhysics().toBuilder().beta(31.0).build(), deadline);
        first.join();
        second.join();

        assertEquals(2, granted.size());
        assertTrue(granted.get(0).compareTo(deadline) <= 0);
        // второй ждал первого ~300 мс, значит его бюджет меньше полного
        assertTrue(granted.get(1).compareTo(deadline.minusMillis(250)) < 0,
                "второй процесс получил " + granted.get(1));
    }

    @Test
    void nonZeroExit_shouldFailWithStderr_andNotBeCached() {
        fx = new EvaluationFixture((args, timeout) -> {
            calls.incrementAndGet();
            return ProcessOutcome.of(2, "", "bad geometry");
        });

        SimulationFailedException e = assertThrows(SimulationFailedException.class,
                () -> fx.service.evaluate(softPhysics(), TIMEOUT));
        assertEquals("bad geometry", e.stderr());
        assertEquals(2, e.exitCode());

        assertThrows(SimulationFailedException.class, () -> fx.service.evaluate(softPhysics(), TIMEOUT));
        assertEquals(2, calls.get());
    }

    @Test
    void textOutput_shouldBeWrappedAsRaw_withBestEffortMetrics() {
        fx = new EvaluationFixture((args, timeout) -> ProcessOutcome.of(0, "margin=2.5 ber=0.001", ""));

        EvaluationResult r = fx.service.evaluate(softPhysics(), TIMEOUT);

        assertEquals("margin=2.5 ber=0.001", r.rawOutput().get("raw").asText());
        assertEquals(2.5, r.metrics().get("logic_margin"));
        assertEquals(0.001, r.metrics().get("ber_estimate"));
    }

    @Test
    void commandLine_shouldCarryParams_andOnlySanitizedExtras() {
        fx = new EvaluationFixture((args, timeout) -> {
            seenArgs.add(new ArrayList<>(args));
            return ProcessOutcome.of(0, "{}", "");
        });

        EvaluationParams p = softPhysics().toBuilder()
                .n2(1e-17)
                .gGeom(0.8)
                .extra(List.of("--fast", "; rm -rf /"))
                .build();
        EvaluationResult r = fx.service.evaluate(p, TIMEOUT);

        List<String> args = seenArgs.get(0);
        assertEquals(List.of("cascade", "--threshold", "soft", "--beta", "30.0", "--xpm-mode", "physics",
                "--n2", "1.0E-17", "--g-geom", "0.8", "--fast"), args);
        assertFalse(args.contains("; rm -rf /"));
        assertEquals(List.of("--fast"), r.params().extra());
        assertTrue(r.metrics().isEmpty());
    }

    @Test
    void metrics_shouldCountRunsAndCacheLookups() {
        fx = new EvaluationFixture((args, timeout) -> ProcessOutcome.of(0, "{\"logic_margin\": 1.0}", ""));

        fx.service.evaluate(softPhysics(), TIMEOUT);
        fx.service.evaluate(softPhysics(), TIMEOUT);

        assertEquals(1.0, fx.registry.get("plogic.cascade.total").counter().count());
        assertEquals(1.0, fx.registry.get("plogic.cache.lookups").tag("result", "hit").counter().count());
        assertEquals(1.0, fx.registry.get("plogic.cache.lookups").tag("result", "miss").counter().count());
    }
}
