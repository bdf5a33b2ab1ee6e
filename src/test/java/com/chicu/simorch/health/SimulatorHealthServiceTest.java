package com.chicu.simorch.health;

import com.chicu.simorch.common.error.SimulationTimeoutException;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.simulator.ProcessOutcome;
import com.chicu.simorch.simulator.SimulatorProcessRunner;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulatorHealthServiceTest {

    @Mock private SimulatorProcessRunner processRunner;

    private final SimulatorProperties props = new SimulatorProperties();
    private final SimulationExecutors executors = new SimulationExecutors(1);
    private SimulatorHealthService service;

    @BeforeEach
    void setUp() {
        service = new SimulatorHealthService(processRunner, props, executors);
    }

    @AfterEach
    void tearDown() {
        executors.shutdown();
    }

    @Test
    void helpExitZero_shouldBeHealthy_withShortTimeout() {
        when(processRunner.run(eq(List.of("--help")), any())).thenReturn(ProcessOutcome.of(0, "usage", ""));

        HealthStatus s = service.health();

        assertTrue(s.isHealthy());
        assertEquals("healthy", s.status());
        verify(processRunner).run(List.of("--help"), Duration.ofSeconds(5));
    }

    @Test
    void helpCheck_shouldRunOnWorkerThread() {
        AtomicReference<String> thread = new AtomicReference<>();
        when(processRunner.run(anyList(), any())).thenAnswer(inv -> {
            thread.set(Thread.currentThread().getName());
            return ProcessOutcome.of(0, "usage", "");
        });

        service.health();

        assertTrue(thread.get().startsWith("plogic-worker"), "запуск был на " + thread.get());
    }

    @Test
    void nonZeroExit_shouldBeUnhealthy_withTruncatedStderr() {
        when(processRunner.run(anyList(), any())).thenReturn(ProcessOutcome.of(1, "", "x".repeat(1_000)));

        HealthStatus s = service.health();

        assertEquals("unhealthy", s.status());
        assertEquals(300, s.detail().length());
    }

    @Test
    void exception_shouldBeUnhealthy_notThrown() {
        when(processRunner.run(anyList(), any())).thenThrow(new SimulationTimeoutException("--help", Duration.ofSeconds(5)));

        HealthStatus s = assertDoesNotThrow(() -> service.health());

        assertFalse(s.isHealthy());
        assertTrue(s.detail().contains("timed out"));
    }

    @Test
    void indicator_shouldMapToActuatorStatus() {
        when(processRunner.run(anyList(), any())).thenReturn(ProcessOutcome.of(2, "", "no module plogic"));

        SimulatorHealthIndicator indicator = new SimulatorHealthIndicator(service);

        assertEquals(Status.DOWN, indicator.health().getStatus());
        assertEquals("no module plogic", indicator.health().getDetails().get("detail"));
    }
}
