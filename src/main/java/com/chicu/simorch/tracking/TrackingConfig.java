package com.chicu.simorch.tracking;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TrackingConfig {

    @Bean
    public ExperimentTracker experimentTracker(TrackingProperties props,
                                               OkHttpClient trackingHttpClient,
                                               ObjectMapper objectMapper) {
        String url = props.getMlflowUrl();
        if (url == null || url.isBlank()) {
            return new NoopExperimentTracker();
        }
        log.info("📒 Experiment tracking: MLflow {} experiment={}", url, props.getExperimentId());
        return new MlflowExperimentTracker(trackingHttpClient, objectMapper, props);
    }
}
