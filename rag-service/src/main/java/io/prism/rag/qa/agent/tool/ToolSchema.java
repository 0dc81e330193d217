package io.prism.rag.qa.agent.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-neutral declaration of a tool. Adapters render it into each provider's shape via a
 * {@link ToolFormat}.
 *
 * @param properties JSON-schema property definitions keyed by parameter name
 */
public record ToolSchema(String name, String description, Map<String, Object> properties, List<String> required) {

    public ToolSchema {
        properties = properties != null ? Map.copyOf(properties) : Map.of();
        required = required != null ? List.copyOf(required) : List.of();
    }

    /**
     * The JSON-schema object: {@code {type: "object", properties: {...}, required: [...]}}.
     */
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("type", "object");
        parameters.put("properties", properties);
        parameters.put("required", required);
        return parameters;
    }

    public static Map<String, Object> stringParam(String description) {
        return Map.of("type", "string", "description", description);
    }

    public static Map<String, Object> integerParam(String description) {
        return Map.of("type", "integer", "description", description);
    }
}
