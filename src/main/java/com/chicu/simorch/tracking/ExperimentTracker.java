package com.chicu.simorch.tracking;

import java.util.Map;

/**
 * Боковой канал для трекинга экспериментов.
 * Реализации не бросают: ошибка трекинга никогда не доходит до вызывающего.
 */
public interface ExperimentTracker {

    void logRun(Map<String, ?> params, Map<String, Double> metrics);

    String backendName();
}
