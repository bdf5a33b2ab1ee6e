package com.chicu.simorch.tracking;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "simorch.tracking")
public class TrackingProperties {

    /**
     * Пример: http://127.0.0.1:5000
     * Пусто = трекинг выключен.
     */
    private String mlflowUrl = "";

    private String experimentId = "0";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 3000;
}
