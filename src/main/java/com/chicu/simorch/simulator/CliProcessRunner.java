package com.chicu.simorch.simulator;

import com.chicu.simorch.common.error.ErrorKind;
import com.chicu.simorch.common.error.SimulationException;
import com.chicu.simorch.common.error.SimulationTimeoutException;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class CliProcessRunner implements SimulatorProcessRunner {

    private final SimulatorProperties props;

    public CliProcessRunner(SimulatorProperties props) {
        if (props.getExecutable() == null || props.getExecutable().isEmpty()
                || props.getExecutable().get(0).isBlank()) {
            throw new IllegalStateException("simorch.simulator.executable не задан");
        }
        this.props = props;
    }

    @Override
    public ProcessOutcome run(List<String> args, Duration timeout) {
        List<String> command = new ArrayList<>(props.getExecutable());
        command.addAll(args);

        String stage = args.isEmpty() ? "call" : args.get(0);
        long started = System.nanoTime();

        Path out = null;
        Path err = null;
        Process process = null;

        try {
            // stdout/stderr в файлы: не упираемся в буфер пайпа при болтливом симуляторе
            out = Files.createTempFile("plogic-", ".out");
            err = Files.createTempFile("plogic-", ".err");

            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());

            Map<String, String> env = environmentFor(pb.environment(), props);
            pb.environment().clear();
            pb.environment().putAll(env);

            log.debug("🧪 PLOGIC EXEC stage={} cmd={}", stage, command);
            process = pb.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("⏱ PLOGIC TIMEOUT stage={} timeoutMs={}", stage, timeout.toMillis());
                throw new SimulationTimeoutException(stage, timeout);
            }

            Duration took = Duration.ofNanos(System.nanoTime() - started);
            return new ProcessOutcome(process.exitValue(), read(out), read(err), took);

        } catch (IOException e) {
            throw new SimulationException(ErrorKind.INTERNAL,
                    "plogic " + stage + " could not be started: " + e.getMessage(), e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) process.destroyForcibly();
            throw new SimulationException(ErrorKind.INTERNAL, "plogic " + stage + " interrupted", e);

        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    /**
     * Наследуемое окружение + каталог исходников в search path (если каталог существует).
     */
    static Map<String, String> environmentFor(Map<String, String> inherited, SimulatorProperties props) {
        Map<String, String> env = new HashMap<>(inherited);

        String src = props.getSourceDir();
        String var = props.getSearchPathVariable();
        if (src == null || src.isBlank() || var == null || var.isBlank()) return env;
        if (!new File(src).isDirectory()) return env;

        String current = env.getOrDefault(var, "");
        env.put(var, current.isEmpty() ? src : current + File.pathSeparator + src);
        return env;
    }

    private static String read(Path p) throws IOException {
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("temp file not deleted: {} ({})", p, e.getMessage());
        }
    }
}
