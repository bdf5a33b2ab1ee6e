package com.chicu.simorch.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * Описание операции для шлюза: имя, текст, JSON-Schema параметров и обработчик.
 */
public record ToolSpec(
        String name,
        String description,
        Map<String, Object> parameters,
        @JsonIgnore ToolHandler handler
) {

    public ToolSpec {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("tool name is blank");
        if (handler == null) throw new IllegalArgumentException("tool handler is null: " + name);
        parameters = parameters == null ? Map.of("type", "object", "properties", Map.of()) : parameters;
    }
}
