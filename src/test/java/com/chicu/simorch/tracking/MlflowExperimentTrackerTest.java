package com.chicu.simorch.tracking;

import com.chicu.simorch.support.TestJson;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MlflowExperimentTrackerTest {

    @Test
    void loggableParams_shouldKeepOnlyScalars() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("beta", 30.0);
        params.put("threshold", "soft");
        params.put("flag", true);
        params.put("extra", List.of("--a"));
        params.put("nothing", null);

        List<Map<String, String>> out = MlflowExperimentTracker.loggableParams(params);

        assertEquals(List.of(
                Map.of("key", "beta", "value", "30.0"),
                Map.of("key", "threshold", "value", "soft"),
                Map.of("key", "flag", "value", "true")), out);
    }

    @Test
    void finiteMetrics_shouldDropNanAndInfinity() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("ber_estimate", 0.01);
        metrics.put("bad", Double.NaN);
        metrics.put("worse", Double.POSITIVE_INFINITY);

        List<Map<String, Object>> out = MlflowExperimentTracker.finiteMetrics(metrics, 5L);

        assertEquals(1, out.size());
        assertEquals("ber_estimate", out.get(0).get("key"));
        assertEquals(0.01, out.get(0).get("value"));
    }

    @Test
    void logRun_unreachableServer_shouldNotThrow() {
        TrackingProperties props = new TrackingProperties();
        props.setMlflowUrl("http://127.0.0.1:1");
        props.setConnectTimeoutMs(200);
        props.setReadTimeoutMs(200);

        MlflowExperimentTracker tracker = new MlflowExperimentTracker(new OkHttpClient(), TestJson.mapper(), props);

        assertDoesNotThrow(() -> tracker.logRun(Map.of("beta", 30.0), Map.of("ber_estimate", 0.01)));
        assertEquals("mlflow", tracker.backendName());
    }
}
