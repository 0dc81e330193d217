package io.prism.rag.qa.agent.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Gemini {@code functionDeclarations} entry. Gemini's schema dialect spells types in upper
 * case ({@code OBJECT}, {@code STRING}), so {@code type} values are rewritten at every level.
 */
public class GeminiToolFormat implements ToolFormat<Map<String, Object>> {

    public static final GeminiToolFormat INSTANCE = new GeminiToolFormat();

    @Override
    public Map<String, Object> render(ToolSchema schema) {
        Map<String, Object> declaration = new LinkedHashMap<>();
        declaration.put("name", schema.name());
        declaration.put("description", schema.description());
        declaration.put("parameters", upperCaseTypes(schema.parameters()));
        return declaration;
    }

    @SuppressWarnings("unchecked")
    static Object upperCaseTypes(Object node) {
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((key, value) -> {
                if ("type".equals(key) && value instanceof String type) {
                    out.put("type", type.toUpperCase(Locale.ROOT));
                } else if ("properties".equals(key) && value instanceof Map<?, ?> properties) {
                    Map<String, Object> converted = new LinkedHashMap<>();
                    ((Map<String, Object>) properties).forEach((name, def) -> converted.put(name, upperCaseTypes(def)));
                    out.put("properties", converted);
                } else {
                    out.put(String.valueOf(key), upperCaseTypes(value));
                }
            });
            return out;
        }
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(upperCaseTypes(item)));
            return out;
        }
        return node;
    }
}
