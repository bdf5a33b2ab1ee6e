package com.chicu.simorch.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * stdout симулятора -> JSON; если это не JSON, отдаём {"raw": text} вместо ошибки.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatorOutputParser {

    public static final String RAW_FIELD = "raw";

    private final ObjectMapper objectMapper;

    public JsonNode parse(String stdout) {
        String text = stdout == null ? "" : stdout;
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (IOException e) {
            log.debug("stdout is not JSON ({}), wrapping as raw", e.getClass().getSimpleName());
        }
        return raw(text);
    }

    public ObjectNode raw(String text) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(RAW_FIELD, text == null ? "" : text);
        return node;
    }

    public static boolean isRaw(JsonNode node) {
        return node != null && node.isObject() && node.size() == 1 && node.has(RAW_FIELD);
    }
}
