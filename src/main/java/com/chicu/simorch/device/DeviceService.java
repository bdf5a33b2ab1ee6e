package com.chicu.simorch.device;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationException;
import com.chicu.simorch.config.SimulationExecutors;
import com.chicu.simorch.simulator.ProcessOutcome;
import com.chicu.simorch.simulator.SimulatorOutputParser;
import com.chicu.simorch.simulator.SimulatorProcessRunner;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Некэшируемые операции устройства: characterize и truth-table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceService {

    private final SimulatorProcessRunner processRunner;
    private final SimulatorOutputParser outputParser;
    private final SimulatorProperties props;
    private final SimulationExecutors executors;

    private final CsvMapper csvMapper = new CsvMapper();

    public JsonNode characterize() {
        ProcessOutcome outcome = runBlocking(List.of("characterize"), props.characterizeTimeout());
        outcome.requireSuccess("characterize");

        JsonNode out = outputParser.parse(outcome.stdout());
        if (out instanceof ObjectNode obj && !SimulatorOutputParser.isRaw(obj)) {
            // свои run_id/timestamp симулятора не перетираем
            if (!obj.has("run_id")) obj.put("run_id", UUID.randomUUID().toString());
            if (!obj.has("timestamp")) obj.put("timestamp", Instant.now().toString());
        }
        log.info("✅ CHARACTERIZE DONE tookMs={}", outcome.took().toMillis());
        return out;
    }

    public TruthTableResult truthTable(List<Double> ctrl, String outCsv) {
        if (ctrl == null || ctrl.isEmpty()) {
            throw new IllegalArgumentException("ctrl: нужен хотя бы один управляющий уровень");
        }

        Path out = outputPath(outCsv);

        List<String> args = new ArrayList<>();
        args.add("truth-table");
        for (Double c : ctrl) {
            if (c == null || !Double.isFinite(c)) {
                throw new IllegalArgumentException("ctrl: недопустимое значение " + c);
            }
            args.add("--ctrl");
            args.add(String.valueOf(c));
        }
        args.add("--out");
        args.add(out.toString());

        ProcessOutcome outcome = runBlocking(args, props.truthTableTimeout());
        outcome.requireSuccess("truth-table");

        List<Map<String, String>> rows = readCsv(out);
        TruthTableResult result = TruthTableResult.builder()
                .runId(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .path(out.toString())
                .rows(rows)
                .build();

        log.info("✅ TRUTH TABLE DONE run={} rows={} path={} tookMs={}",
                result.runId(), rows.size(), out, outcome.took().toMillis());
        return result;
    }

    // =========================================================
    // helpers
    // =========================================================

    private ProcessOutcome runBlocking(List<String> args, Duration timeout) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> processRunner.run(args, timeout), executors.workers())
                    .join();
        } catch (RuntimeException e) {
            Throwable cause = ErrorKind.unwrap(e);
            if (cause instanceof RuntimeException re) throw re;
            throw new SimulationException(ErrorKind.INTERNAL, cause.getMessage(), cause);
        }
    }

    private static Path outputPath(String outCsv) {
        if (outCsv != null && !outCsv.isBlank()) {
            return Paths.get(outCsv.trim());
        }
        try {
            return Files.createTempFile("truth_table_", ".csv");
        } catch (IOException e) {
            throw new SimulationException(ErrorKind.INTERNAL, "cannot create temp csv: " + e.getMessage(), e);
        }
    }

    List<Map<String, String>> readCsv(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SimulationException(ErrorKind.SIMULATION_FAILED, "truth-table did not produce " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new SimulationException(ErrorKind.SIMULATION_FAILED, "truth-table csv unreadable: " + e.getMessage(), e);
        }
    }
}
