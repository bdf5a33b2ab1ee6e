package com.chicu.simorch.tools;

import com.chicu.simorch.device.DeviceService;
import com.chicu.simorch.eval.EvaluationParams;
import com.chicu.simorch.eval.EvaluationService;
import com.chicu.simorch.health.CapabilityReporter;
import com.chicu.simorch.health.SimulatorHealthService;
import com.chicu.simorch.optimize.OptimizationDriver;
import com.chicu.simorch.optimize.OptimizationRequest;
import com.chicu.simorch.simulator.props.SimulatorProperties;
import com.chicu.simorch.sweep.SweepExecutor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Регистрация операций оркестратора для внешнего шлюза.
 */
@Configuration
public class SimulationToolConfig {

    public static final String TRUTH_TABLE = "plogic_truth_table";
    public static final String CASCADE = "plogic_cascade";
    public static final String SWEEP = "plogic_sweep_parallel";
    public static final String BO_RUN = "plogic_bo_run";
    public static final String HEALTH = "plogic_health";
    public static final String SCHEMA = "plogic_schema";
    public static final String CHARACTERIZE = "plogic_characterize";

    @Bean
    public ToolRegistry toolRegistry(DeviceService deviceService,
                                     EvaluationService evaluationService,
                                     SweepExecutor sweepExecutor,
                                     OptimizationDriver optimizationDriver,
                                     SimulatorHealthService healthService,
                                     CapabilityReporter capabilityReporter,
                                     SimulatorProperties simulatorProps,
                                     ObjectMapper objectMapper) {

        List<ToolSpec> specs = new ArrayList<>();

        specs.add(new ToolSpec(TRUTH_TABLE,
                "Run truth-table for the given control levels and return the CSV rows",
                object(props(
                        "ctrl", Map.of("type", "array", "items", number("control level"), "minItems", 1),
                        "out_csv", string("optional output CSV path")
                ), "ctrl"),
                args -> deviceService.truthTable(
                        objectMapper.convertValue(args.get("ctrl"), new TypeReference<List<Double>>() {}),
                        text(args, "out_csv"))));

        specs.add(new ToolSpec(CASCADE,
                "Evaluate one cascade configuration (cached, timeout-bounded)",
                cascadeSchema(),
                args -> evaluationService.evaluate(cascadeParams(args, objectMapper), simulatorProps.cascadeTimeout())));

        specs.add(new ToolSpec(SWEEP,
                "Evaluate many cascade configurations in parallel",
                object(props(
                        "configs", Map.of("type", "array", "items", cascadeSchema())
                ), "configs"),
                args -> sweepExecutor.sweep(configs(args), c -> sweepConfig(c, objectMapper))));

        specs.add(new ToolSpec(BO_RUN,
                "Minimize ber - weight * margin over the cascade parameter space",
                object(props(
                        "n_calls", Map.of("type", "integer", "minimum", 1, "default", OptimizationRequest.DEFAULT_N_CALLS),
                        "threshold", enumOf("hard", "soft"),
                        "xpm_mode", enumOf("linear", "physics"),
                        "space_bounds", Map.of("type", "object",
                                "description", "name -> [low, high]",
                                "additionalProperties", Map.of("type", "array", "items", number("bound"),
                                        "minItems", 2, "maxItems", 2)),
                        "fixed_params", Map.of("type", "object"),
                        "objective_margin_weight", Map.of("type", "number", "default", OptimizationRequest.DEFAULT_MARGIN_WEIGHT),
                        "random_starts", Map.of("type", "integer", "minimum", 1, "default", OptimizationRequest.DEFAULT_RANDOM_STARTS),
                        "seed", Map.of("type", "integer")
                )),
                args -> optimizationDriver.optimize(objectMapper.convertValue(args, OptimizationRequest.class))));

        specs.add(new ToolSpec(HEALTH,
                "Check that the simulator CLI is reachable",
                object(props()),
                args -> healthService.health()));

        specs.add(new ToolSpec(SCHEMA,
                "Describe active capabilities",
                object(props()),
                args -> capabilityReporter.schema()));

        specs.add(new ToolSpec(CHARACTERIZE,
                "Run device characterization",
                object(props()),
                args -> deviceService.characterize()));

        return new ToolRegistry(specs);
    }

    // =========================================================
    // arguments
    // =========================================================

    /**
     * Как у cascade-инструмента: n2 не передан -> 1e-17.
     */
    static EvaluationParams cascadeParams(JsonNode args, ObjectMapper objectMapper) {
        EvaluationParams p = objectMapper.convertValue(args, EvaluationParams.class);
        if (!args.has("n2")) {
            p = p.toBuilder().n2(EvaluationParams.DEFAULT_N2).build();
        }
        return p;
    }

    /**
     * Сам массив обязателен. Элементы разбирает sweep поштучно, см. {@link #sweepConfig}.
     */
    private static List<JsonNode> configs(JsonNode args) {
        JsonNode configs = args.get("configs");
        if (configs == null || !configs.isArray()) {
            throw new IllegalArgumentException("configs: ожидается массив");
        }
        List<JsonNode> out = new ArrayList<>(configs.size());
        configs.forEach(out::add);
        return out;
    }

    static EvaluationParams sweepConfig(JsonNode config, ObjectMapper objectMapper) {
        if (config == null || !config.isObject()) {
            throw new IllegalArgumentException("config должен быть объектом, получено: " + config);
        }
        return cascadeParams(config, objectMapper);
    }

    private static String text(JsonNode args, String field) {
        JsonNode n = args.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    // =========================================================
    // schema helpers
    // =========================================================

    private static Map<String, Object> cascadeSchema() {
        return object(props(
                "threshold", enumOf("hard", "soft"),
                "beta", Map.of("type", "number", "exclusiveMinimum", 0, "default", EvaluationParams.DEFAULT_BETA),
                "xpm_mode", enumOf("linear", "physics"),
                "n2", Map.of("type", "number", "default", EvaluationParams.DEFAULT_N2),
                "a_eff", number("effective area"),
                "n_eff", number("effective index"),
                "g_geom", number("geometry factor"),
                "extra", Map.of("type", "array", "items", string("--flag or --flag=value"))
        ));
    }

    private static Map<String, Object> object(Map<String, Object> properties, String... required) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "object");
        m.put("properties", properties);
        if (required.length > 0) {
            m.put("required", List.of(required));
        }
        return m;
    }

    private static Map<String, Object> props(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    private static Map<String, Object> number(String description) {
        return Map.of("type", "number", "description", description);
    }

    private static Map<String, Object> string(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> enumOf(String... values) {
        return Map.of("type", "string", "enum", List.of(values));
    }
}
