package com.chicu.simorch.config;

import com.chicu.simorch.simulator.props.SimulatorProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Два домена исполнения:
 * - coordinator: один поток, владеет кэшем и раздачей задач (аналог event loop);
 * - workers: блокирующие вызовы симулятора;
 * - optimizer: блокирующие циклы модельного оптимизатора.
 * Циклы оптимизатора живут в своём пуле, чтобы не занимать workers, иначе
 * при workerPoolSize параллельных bo_run пул симулятора встанет.
 */
@Slf4j
@Component
public class SimulationExecutors {

    private final int poolSize;
    private final ExecutorService coordinator;
    private final ExecutorService workers;
    private final ExecutorService optimizer;

    @Autowired
    public SimulationExecutors(SimulatorProperties props) {
        this(props.effectiveWorkerPoolSize());
    }

    public SimulationExecutors(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        this.poolSize = poolSize;
        this.coordinator = Executors.newSingleThreadExecutor(daemon("plogic-coord"));
        this.workers = Executors.newFixedThreadPool(poolSize, daemon("plogic-worker"));
        this.optimizer = Executors.newFixedThreadPool(poolSize, daemon("plogic-bo"));

        log.info("🧵 SimulationExecutors поднят: workers={} optimizer={}", poolSize, poolSize);
    }

    public ExecutorService coordinator() {
        return coordinator;
    }

    public ExecutorService workers() {
        return workers;
    }

    public ExecutorService optimizer() {
        return optimizer;
    }

    public int poolSize() {
        return poolSize;
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 SimulationExecutors shutting down…");
        optimizer.shutdownNow();
        workers.shutdownNow();
        coordinator.shutdownNow();
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(prefix + "-" + seq.incrementAndGet());
            return t;
        };
    }
}
