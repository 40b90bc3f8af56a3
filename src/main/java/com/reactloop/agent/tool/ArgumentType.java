package com.reactloop.agent.tool;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * JSON-level types a tool argument can declare.
 * Values arrive already decoded by Jackson, so the checks are against Jackson's Java mapping.
 */
public enum ArgumentType {

    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ANY("any");

    private final String jsonName;

    ArgumentType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public boolean accepts(Object value) {
        return switch (this) {
            case ANY -> true;
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte || value instanceof BigInteger
                    || (value instanceof BigDecimal d && d.stripTrailingZeros().scale() <= 0);
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map;
            case ARRAY -> value instanceof List;
        };
    }

    /** Name of the JSON type of an actual value, used in validation messages */
    public static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return STRING.jsonName;
        if (value instanceof Boolean) return BOOLEAN.jsonName;
        if (INTEGER.accepts(value)) return INTEGER.jsonName;
        if (value instanceof Number) return NUMBER.jsonName;
        if (value instanceof Map) return OBJECT.jsonName;
        if (value instanceof List) return ARRAY.jsonName;
        return value.getClass().getSimpleName();
    }
}
