package com.chicu.simorch.eval;

import com.chicu.simorch.cache.CacheKeyFactory;
import com.chicu.simorch.cache.CacheProperties;
import com.chicu.simorch.cache.ResultCache;
import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationException;
import com.chicu.simorch.common.error.SimulationTimeoutException;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.simulator.ArgumentSanitizer;
import com.chicu.simorch.simulator.ProcessOutcome;
import com.chicu.simorch.simulator.SimulatorOutputParser;
import com.chicu.simorch.simulator.SimulatorProcessRunner;
import com.chicu.simorch.tracking.ExperimentTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * evaluate(params) = sanitizer -> кэш -> симулятор -> метрики, всё под одним дедлайном.
 *
 * Кэш и сборка результата идут на coordinator, сам процесс на workers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    public static final String OPERATION = "cascade";

    private final ArgumentSanitizer sanitizer;
    private final SimulatorProcessRunner processRunner;
    private final SimulatorOutputParser outputParser;
    private final MetricExtractor metricExtractor;
    private final ResultCache cache;
    private final CacheKeyFactory keyFactory;
    private final CacheProperties cacheProps;
    private final SimulationExecutors executors;
    private final SimulationMetrics metrics;
    private final ExperimentTracker tracker;
    private final ObjectMapper objectMapper;

    /**
     * Блокирующая версия для одиночных вызовов.
     *
     * @throws SimulationException TIMEOUT / SIMULATION_FAILED / INVALID_ARGUMENT
     */
    public EvaluationResult evaluate(EvaluationParams params, Duration timeout) {
        try {
            return evaluateAsync(params, timeout).join();
        } catch (RuntimeException e) {
            Throwable cause = ErrorKind.unwrap(e);
            if (cause instanceof RuntimeException re) throw re;
            throw new SimulationException(ErrorKind.INTERNAL, cause.getMessage(), cause);
        }
    }

    /**
     * Future завершается либо результатом, либо SimulationException (никогда сырым TimeoutException).
     */
    public CompletableFuture<EvaluationResult> evaluateAsync(EvaluationParams params, Duration timeout) {
        if (params == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("params is null"));
        }

        EvaluationParams clean = params.withExtra(sanitizer.sanitize(params.extra()));
        String key = keyFactory.cascadeKey(clean);
        long deadline = System.nanoTime() + timeout.toNanos();
        AtomicReference<CompletableFuture<ProcessOutcome>> work = new AtomicReference<>();

        CompletableFuture<EvaluationResult> pipeline = CompletableFuture
                .supplyAsync(() -> lookup(key), executors.coordinator())
                .thenCompose(hit -> hit != null
                        ? CompletableFuture.completedFuture(hit)
                        : runFresh(clean, key, timeout, deadline, work));

        CompletableFuture<EvaluationResult> result = new CompletableFuture<>();
        pipeline.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((r, e) -> {
                    if (e == null) {
                        track(r);
                        result.complete(r);
                        return;
                    }
                    abandon(work.get(), key);
                    RuntimeException err = translate(e, timeout);
                    metrics.error(ErrorKind.of(err));
                    log.warn("❌ CASCADE FAILED key={} kind={} : {}", key, ErrorKind.of(err), shrink(err.getMessage()));
                    result.completeExceptionally(err);
                });
        return result;
    }

    // =========================================================
    // pipeline stages
    // =========================================================

    private EvaluationResult lookup(String key) {
        String payload = cache.get(key).orElse(null);
        metrics.cacheLookup(payload != null);
        if (payload == null) return null;

        try {
            EvaluationResult hit = objectMapper.readValue(payload, EvaluationResult.class);
            log.debug("🗄 CACHE HIT key={} run={}", key, hit.runId());
            return hit;
        } catch (JsonProcessingException e) {
            // битая запись = промах, пересчитаем и перезапишем
            log.warn("⚠️ CACHE ENTRY CORRUPT key={} : {}", key, e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Процесс получает только остаток дедлайна. Ссылка на worker-задачу уходит в {@code work},
     * чтобы по истечении дедлайна её можно было снять с очереди.
     */
    private CompletableFuture<EvaluationResult> runFresh(EvaluationParams params, String key, Duration timeout,
                                                         long deadline,
                                                         AtomicReference<CompletableFuture<ProcessOutcome>> work) {
        List<String> args = commandArgs(params);
        CompletableFuture<ProcessOutcome> process = CompletableFuture.supplyAsync(() -> {
            Duration left = remaining(deadline);
            if (left.isZero()) {
                // дедлайн истёк, пока задача стояла в очереди: симулятор не запускаем
                throw new SimulationTimeoutException(OPERATION, timeout);
            }
            return processRunner.run(args, left);
        }, executors.workers());
        work.set(process);
        return process.thenApplyAsync(outcome -> toResult(params, key, outcome), executors.coordinator());
    }

    /**
     * Ещё не стартовавшая задача после cancel из очереди исполнителя уже не запустится.
     * Уже идущий процесс добивает сам runner по своему (оставшемуся) таймауту.
     */
    private static void abandon(CompletableFuture<ProcessOutcome> process, String key) {
        if (process != null && process.cancel(false)) {
            log.debug("⏹ CASCADE ABANDONED key={}", key);
        }
    }

    static Duration remaining(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    private EvaluationResult toResult(EvaluationParams params, String key, ProcessOutcome outcome) {
        metrics.cascadeRun(outcome.took());
        outcome.requireSuccess(OPERATION);

        JsonNode parsed = outputParser.parse(outcome.stdout());
        Map<String, Double> extracted = metricExtractor.extract(parsed, outcome.stdout());

        // не-объектный JSON (массив/скаляр) тоже считаем сырым текстом
        JsonNode output = parsed.isObject() ? parsed : outputParser.raw(outcome.stdout());

        EvaluationResult result = EvaluationResult.builder()
                .runId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .params(params)
                .rawOutput(output)
                .metrics(extracted)
                .durationSeconds(outcome.took().toNanos() / 1e9)
                .build();

        store(key, result);

        log.info("✅ CASCADE DONE run={} tookMs={} metrics={}",
                result.runId(), outcome.took().toMillis(), extracted);
        return result;
    }

    private void store(String key, EvaluationResult result) {
        try {
            cache.put(key, objectMapper.writeValueAsString(result), cacheProps.ttl());
        } catch (JsonProcessingException e) {
            log.warn("⚠️ CACHE PUT skipped key={} : {}", key, e.getOriginalMessage());
        }
    }

    private void track(EvaluationResult r) {
        Map<String, Object> params = paramsOf(r.params());
        CompletableFuture
                .runAsync(() -> tracker.logRun(params, r.metrics()), executors.workers())
                .exceptionally(e -> {
                    log.debug("tracking skipped: {}", e.getMessage());
                    return null;
                });
    }

    // =========================================================
    // helpers
    // =========================================================

    static List<String> commandArgs(EvaluationParams p) {
        List<String> args = new ArrayList<>();
        args.add(OPERATION);
        args.add("--threshold");
        args.add(p.threshold().wire());
        args.add("--beta");
        args.add(String.valueOf(p.beta()));
        args.add("--xpm-mode");
        args.add(p.xpmMode().wire());
        addOptional(args, "--n2", p.n2());
        addOptional(args, "--a-eff", p.aEff());
        addOptional(args, "--n-eff", p.nEff());
        addOptional(args, "--g-geom", p.gGeom());
        args.addAll(p.extra());
        return args;
    }

    static Map<String, Object> paramsOf(EvaluationParams p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("threshold", p.threshold().wire());
        m.put("beta", p.beta());
        m.put("xpm_mode", p.xpmMode().wire());
        if (p.n2() != null) m.put("n2", p.n2());
        if (p.aEff() != null) m.put("a_eff", p.aEff());
        if (p.nEff() != null) m.put("n_eff", p.nEff());
        if (p.gGeom() != null) m.put("g_geom", p.gGeom());
        if (!p.extra().isEmpty()) m.put("extra", String.join(" ", p.extra()));
        return m;
    }

    private static void addOptional(List<String> args, String flag, Double value) {
        if (value == null) return;
        args.add(flag);
        args.add(String.valueOf(value));
    }

    private static RuntimeException translate(Throwable e, Duration timeout) {
        Throwable cause = ErrorKind.unwrap(e);
        if (cause instanceof TimeoutException) {
            return new SimulationTimeoutException(OPERATION, timeout);
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new SimulationException(ErrorKind.INTERNAL, cause.getMessage(), cause);
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        return x.length() <= 300 ? x : x.substring(0, 300) + "...";
    }
}
