package com.chicu.simorch.persistence;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "simorch.results")
public class ResultsProperties {

    /**
     * Каталог для sweep_*.json / bo_run_*.json.
     */
    private String dir = "./data/plogic_results";
}
