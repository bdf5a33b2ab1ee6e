package com.chicu.simorch.eval;

import com.chicu.simorch.simulator.SimulatorOutputParser;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Достаёт метрики из вывода симулятора. Промах = метрики нет, не ошибка.
 */
@Slf4j
@Component
public class MetricExtractor {

    public static final String LOGIC_MARGIN = "logic_margin";
    public static final String BER_ESTIMATE = "ber_estimate";
    public static final String POWER_MW = "power_mw";
    public static final String CONTRAST_DB = "contrast_db";

    public static final List<String> STRUCTURED_FIELDS = List.of(LOGIC_MARGIN, BER_ESTIMATE, POWER_MW, CONTRAST_DB);

    private static final Pattern MARGIN = Pattern.compile("margin[:=]\\s*([0-9.]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BER = Pattern.compile("ber[_\\s-]?(estimate)?[:=]\\s*([0-9.eE+-]+)", Pattern.CASE_INSENSITIVE);

    public Map<String, Double> extract(JsonNode output, String stdout) {
        Map<String, Double> out = new LinkedHashMap<>();

        if (output != null && output.isObject() && !SimulatorOutputParser.isRaw(output)) {
            for (String field : STRUCTURED_FIELDS) {
                JsonNode v = output.get(field);
                if (v != null && v.isNumber()) {
                    out.put(field, v.doubleValue());
                }
            }
            return out;
        }

        // неструктурированный текст: best-effort
        String text = stdout == null ? "" : stdout;
        put(out, LOGIC_MARGIN, MARGIN.matcher(text), 1);
        put(out, BER_ESTIMATE, BER.matcher(text), 2);
        return out;
    }

    private static void put(Map<String, Double> out, String name, Matcher m, int group) {
        if (!m.find()) return;
        try {
            out.put(name, Double.parseDouble(m.group(group)));
        } catch (NumberFormatException e) {
            log.debug("metric {} not parsed from '{}'", name, m.group(group));
        }
    }
}
