package com.chicu.simorch.config;

import com.chicu.simorch.tracking.TrackingProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /** Ниже этого таймауты не опускаем, иначе MLflow не успевает даже на localhost. */
    static final long MIN_TIMEOUT_MS = 100;

    /**
     * 🌐 OkHttpClient трекера экспериментов.
     * Трекинг best-effort: короткие таймауты из simorch.tracking.*, без повторов,
     * чтобы лежащий MLflow не держал worker-поток.
     */
    @Bean
    public OkHttpClient trackingHttpClient(TrackingProperties props) {
        return trackingClient(props);
    }

    static OkHttpClient trackingClient(TrackingProperties props) {
        Duration connect = Duration.ofMillis(Math.max(MIN_TIMEOUT_MS, props.getConnectTimeoutMs()));
        Duration read = Duration.ofMillis(Math.max(MIN_TIMEOUT_MS, props.getReadTimeoutMs()));
        return new OkHttpClient.Builder()
                .connectTimeout(connect)
                .readTimeout(read)
                .writeTimeout(read)
                .callTimeout(connect.plus(read).multipliedBy(2))
                .retryOnConnectionFailure(false)
                .build();
    }
}
