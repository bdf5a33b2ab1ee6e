package com.chicu.simorch.sweep;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.eval.EvaluationParams;
import com.chicu.simorch.eval.EvaluationResult;
import com.chicu.simorch.eval.EvaluationService;
import com.chicu.simorch.persistence.ResultsStore;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * N независимых cascade параллельно. Без fail-fast: ошибка элемента = запись в errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SweepExecutor {

    private final EvaluationService evaluationService;
    private final ResultsStore resultsStore;
    private final SimulatorProperties simulatorProps;

    public SweepResult sweep(List<EvaluationParams> requests) {
        return sweep(requests, Function.identity());
    }

    /**
     * Сырые конфиги разбираются поштучно: неразборчивый элемент становится
     * ошибкой INVALID_ARGUMENT со своим индексом, остальные считаются как обычно.
     */
    public <T> SweepResult sweep(List<T> configs, Function<? super T, EvaluationParams> parser) {
        if (configs == null) {
            throw new IllegalArgumentException("configs is null");
        }

        long started = System.currentTimeMillis();
        Duration timeout = simulatorProps.cascadeTimeout();

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(configs.size());
        for (int i = 0; i < configs.size(); i++) {
            futures.add(submit(i, configs.get(i), parser, timeout));
        }

        // каждый future сам завершается по своему дедлайну, join не бросает
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<EvaluationResult> ok = new ArrayList<>();
        List<SweepError> errors = new ArrayList<>();
        for (CompletableFuture<Outcome> f : futures) {
            Outcome o = f.join();
            if (o.error() == null) {
                ok.add(o.result());
            } else {
                errors.add(o.error());
            }
        }

        SweepResult result = SweepResult.builder()
                .runId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .countOk(ok.size())
                .countError(errors.size())
                .results(ok)
                .errors(errors)
                .build();

        log.info("📊 SWEEP DONE run={} total={} ok={} errors={} tookMs={}",
                result.runId(), configs.size(), ok.size(), errors.size(), System.currentTimeMillis() - started);

        persist(result);
        return result;
    }

    private <T> CompletableFuture<Outcome> submit(int index, T config,
                                                  Function<? super T, EvaluationParams> parser,
                                                  Duration timeout) {
        EvaluationParams params;
        try {
            params = parser.apply(config);
        } catch (RuntimeException e) {
            log.warn("⚠️ SWEEP CONFIG REJECTED index={} : {}", index, e.getMessage());
            return CompletableFuture.completedFuture(new Outcome(null, errorOf(index, null, e)));
        }

        CompletableFuture<EvaluationResult> f;
        try {
            f = evaluationService.evaluateAsync(params, timeout);
        } catch (RuntimeException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.handle((r, e) -> e == null
                ? new Outcome(r, null)
                : new Outcome(null, errorOf(index, params, e)));
    }

    private static SweepError errorOf(int index, EvaluationParams params, Throwable e) {
        Throwable cause = ErrorKind.unwrap(e);
        String msg = cause.getMessage();
        return SweepError.builder()
                .index(index)
                .message(msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg)
                .kind(ErrorKind.of(cause))
                .cause(cause.getClass().getSimpleName())
                .params(params)
                .build();
    }

    private void persist(SweepResult result) {
        try {
            resultsStore.write("sweep", result.runId(), result);
        } catch (RuntimeException e) {
            // результат уже посчитан, отдаём его даже если диск подвёл
            log.error("❌ SWEEP NOT SAVED run={} : {}", result.runId(), e.getMessage(), e);
        }
    }

    private record Outcome(EvaluationResult result, SweepError error) {}
}
