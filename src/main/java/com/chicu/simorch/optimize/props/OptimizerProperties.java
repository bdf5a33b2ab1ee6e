package com.chicu.simorch.optimize.props;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "simorch.optimizer")
public class OptimizerProperties {

    public enum Strategy { MODEL, RANDOM }

    /** MODEL = BOBYQA (при d >= 2), RANDOM = только случайный поиск */
    private Strategy strategy = Strategy.MODEL;

    private int traceCap = 500;
    private int traceTrimTo = 400;
    private int transportTraceLimit = 200;

    /** конечный штраф для упавшей точки (NaN модельный оптимизатор не переваривает) */
    private double failurePenalty = 1e6;

    private int maxBatch = 8;

    // BOBYQA работает в единичном кубе
    private double initialTrustRegionRadius = 0.3;
    private double stoppingTrustRegionRadius = 1e-6;
}
