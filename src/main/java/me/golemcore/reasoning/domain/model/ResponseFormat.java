package me.golemcore.reasoning.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * Shape the model is asked to answer in. Structured formats are checked before
 * a final answer is accepted.
 *
 * @param type
 *            text, any JSON object, or JSON conforming to {@code schema}
 * @param name
 *            schema name sent to providers that want one
 * @param schema
 *            JSON-Schema-like map; only set for {@link Type#JSON_SCHEMA}
 */
public record ResponseFormat(Type type, String name, Map<String, Object> schema) {

    public enum Type {
        TEXT, JSON_OBJECT, JSON_SCHEMA
    }

    private static final String DEFAULT_SCHEMA_NAME = "response";
    private static final ResponseFormat TEXT = new ResponseFormat(Type.TEXT, null, null);
    private static final ResponseFormat JSON_OBJECT = new ResponseFormat(Type.JSON_OBJECT, null, null);

    public ResponseFormat {
        Objects.requireNonNull(type, "type");
        if (type == Type.JSON_SCHEMA && (schema == null || schema.isEmpty())) {
            throw new IllegalArgumentException("JSON_SCHEMA response format requires a schema");
        }
        schema = schema != null ? Map.copyOf(schema) : null;
    }

    public static ResponseFormat text() {
        return TEXT;
    }

    public static ResponseFormat jsonObject() {
        return JSON_OBJECT;
    }

    public static ResponseFormat jsonSchema(String name, Map<String, Object> schema) {
        return new ResponseFormat(Type.JSON_SCHEMA, name != null && !name.isBlank() ? name : DEFAULT_SCHEMA_NAME,
                schema);
    }

    public boolean isStructured() {
        return type != Type.TEXT;
    }
}
