package com.chicu.simorch.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Явный реестр операций (имя -> spec + handler). Строится один раз при старте.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolSpec> tools = new LinkedHashMap<>();

    public ToolRegistry(List<ToolSpec> specs) {
        for (ToolSpec spec : specs) {
            ToolSpec prev = tools.putIfAbsent(spec.name(), spec);
            if (prev != null) {
                throw new IllegalArgumentException("tool registered twice: " + spec.name());
            }
        }
        log.info("🛠 ToolRegistry поднят. Операций зарегистрировано: {}", tools.size());
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<ToolSpec> specs() {
        return List.copyOf(tools.values());
    }

    public Optional<ToolSpec> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public Object invoke(String name, JsonNode args) {
        ToolSpec spec = find(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + name + ", available " + names()));

        JsonNode safeArgs = args == null || args.isNull() || args.isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : args;
        if (!safeArgs.isObject()) {
            throw new IllegalArgumentException("tool arguments must be a JSON object: " + name);
        }

        log.debug("🛠 TOOL {} args={}", name, safeArgs);
        return spec.handler().handle(safeArgs);
    }
}
