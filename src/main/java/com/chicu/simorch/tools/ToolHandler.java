package com.chicu.simorch.tools;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface ToolHandler {

    /**
     * @param args аргументы вызова (всегда JSON-объект, пустой если аргументов нет)
     * @return значение, которое шлюз сериализует в ответ
     */
    Object handle(JsonNode args);
}
