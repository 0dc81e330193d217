package io.prism.rag.qa.agent.tool;

import java.util.Map;

/**
 * Lenient readers for model-supplied arguments, which arrive as strings as often as numbers.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String string(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static int integer(Map<String, Object> arguments, String name, int defaultValue, int min, int max) {
        Object value = arguments.get(name);
        int parsed = defaultValue;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value != null) {
            try {
                parsed = (int) Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                parsed = defaultValue;
            }
        }
        return Math.max(min, Math.min(max, parsed));
    }
}
