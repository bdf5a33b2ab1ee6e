package com.chicu.simorch.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MLflow REST: runs/create -> runs/log-batch -> runs/update(FINISHED).
 */
@Slf4j
public class MlflowExperimentTracker implements ExperimentTracker {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final TrackingProperties props;

    /**
     * @param client уже настроенный клиент (таймауты из simorch.tracking, см. HttpClientConfig)
     */
    public MlflowExperimentTracker(OkHttpClient client, ObjectMapper objectMapper, TrackingProperties props) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public void logRun(Map<String, ?> params, Map<String, Double> metrics) {
        try {
            long now = System.currentTimeMillis();

            JsonNode created = post("/api/2.0/mlflow/runs/create",
                    Map.of("experiment_id", props.getExperimentId(), "start_time", now));
            String runId = created.path("run").path("info").path("run_id").asText("");
            if (runId.isEmpty()) {
                throw new IllegalStateException("MLflow runs/create without run_id");
            }

            Map<String, Object> batch = new LinkedHashMap<>();
            batch.put("run_id", runId);
            batch.put("params", loggableParams(params));
            batch.put("metrics", finiteMetrics(metrics, now));
            post("/api/2.0/mlflow/runs/log-batch", batch);

            post("/api/2.0/mlflow/runs/update",
                    Map.of("run_id", runId, "status", "FINISHED", "end_time", System.currentTimeMillis()));

        } catch (Exception e) {
            log.debug("MLflow logging skipped: {}", e.getMessage());
        }
    }

    @Override
    public String backendName() {
        return "mlflow";
    }

    /**
     * Только скаляры: строки, числа, boolean, enum.
     */
    static List<Map<String, String>> loggableParams(Map<String, ?> params) {
        List<Map<String, String>> out = new ArrayList<>();
        if (params == null) return out;
        params.forEach((k, v) -> {
            if (v instanceof Number || v instanceof CharSequence || v instanceof Boolean || v instanceof Enum<?>) {
                out.add(Map.of("key", k, "value", String.valueOf(v)));
            }
        });
        return out;
    }

    static List<Map<String, Object>> finiteMetrics(Map<String, Double> metrics, long timestamp) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (metrics == null) return out;
        metrics.forEach((k, v) -> {
            if (v != null && Double.isFinite(v)) {
                out.add(Map.of("key", k, "value", v, "timestamp", timestamp, "step", 0));
            }
        });
        return out;
    }

    private JsonNode post(String path, Object body) throws IOException {
        String url = props.getMlflowUrl().replaceAll("/+$", "") + path;

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();

        try (Response resp = client.newCall(request).execute()) {
            String respBody = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("MLflow HTTP " + resp.code() + " " + path);
            }
            return respBody.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(respBody);
        }
    }
}
