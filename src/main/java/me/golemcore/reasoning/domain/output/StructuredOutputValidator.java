package me.golemcore.reasoning.domain.output;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reasoning.domain.model.ResponseFormat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a final answer against the run's {@link ResponseFormat}.
 *
 * <p>
 * Markdown code fences around the answer are stripped, the rest must parse as
 * JSON, and for {@link ResponseFormat.Type#JSON_SCHEMA} it must satisfy the
 * schema. Supported keywords: {@code type}, {@code properties},
 * {@code required}, {@code additionalProperties: false}, {@code enum},
 * {@code items}, {@code minimum}, {@code maximum}, {@code minLength},
 * {@code maxLength}, {@code minItems} and {@code maxItems}. Other keywords are
 * ignored.
 */
public class StructuredOutputValidator {

    private static final int RAW_PREFIX_LENGTH = 100;
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public StructuredOutputValidator() {
        this(new ObjectMapper());
    }

    public StructuredOutputValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OutputValidation validate(String answer, ResponseFormat format) {
        if (format == null || !format.isStructured()) {
            return OutputValidation.accepted(answer != null ? answer : "");
        }

        String cleaned = stripMarkdownFences(answer);
        JsonNode value;
        try {
            value = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location != null ? location.getLineNr() : 0;
            int column = location != null ? location.getColumnNr() : 0;
            return OutputValidation.notJson(e.getOriginalMessage(), line, column, prefixOf(cleaned));
        }
        if (value == null || value.isMissingNode()) {
            return OutputValidation.notJson("No content to map", 1, 1, prefixOf(cleaned));
        }

        List<String> violations = new ArrayList<>();
        if (format.type() == ResponseFormat.Type.JSON_OBJECT) {
            if (!value.isObject()) {
                violations.add("expected a JSON object but got " + typeOf(value));
            }
        } else {
            check(value, format.schema(), "$", violations);
        }
        return violations.isEmpty()
                ? OutputValidation.accepted(cleaned)
                : OutputValidation.violated(violations);
    }

    static String stripMarkdownFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith(FENCE)) {
            return trimmed;
        }
        String rest = trimmed.substring(FENCE.length());
        int newline = rest.indexOf('\n');
        // first line holds the language tag
        String content = newline >= 0 ? rest.substring(newline + 1) : rest;
        if (content.endsWith(FENCE)) {
            content = content.substring(0, content.length() - FENCE.length());
        }
        return content.strip();
    }

    @SuppressWarnings("unchecked")
    private void check(JsonNode value, Map<String, Object> schema, String path, List<String> violations) {
        if (schema == null) {
            return;
        }

        Object enumValues = schema.get("enum");
        if (enumValues instanceof List<?> allowed) {
            JsonNode allowedNode = objectMapper.valueToTree(allowed);
            boolean matched = false;
            for (JsonNode candidate : allowedNode) {
                if (candidate.equals(value)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                violations.add(path + ": " + value + " is not one of " + allowedNode);
                return;
            }
        }

        Object type = schema.get("type");
        if (type != null && !matchesType(value, type)) {
            violations.add(path + ": expected " + type + " but got " + typeOf(value));
            return;
        }

        if (value.isObject()) {
            Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> props
                    ? (Map<String, Object>) props
                    : Map.of();
            if (schema.get("required") instanceof List<?> required) {
                for (Object name : required) {
                    if (!value.has(String.valueOf(name))) {
                        violations.add(path + ": missing required property '" + name + "'");
                    }
                }
            }
            boolean closed = Boolean.FALSE.equals(schema.get("additionalProperties"));
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object propertySchema = properties.get(field.getKey());
                if (propertySchema instanceof Map<?, ?> nested) {
                    check(field.getValue(), (Map<String, Object>) nested, path + "." + field.getKey(), violations);
                } else if (closed) {
                    violations.add(path + ": unexpected property '" + field.getKey() + "'");
                }
            }
        } else if (value.isArray()) {
            checkSize(value.size(), schema, "minItems", "maxItems", "item(s)", path, violations);
            if (schema.get("items") instanceof Map<?, ?> items) {
                for (int i = 0; i < value.size(); i++) {
                    check(value.get(i), (Map<String, Object>) items, path + "[" + i + "]", violations);
                }
            }
        } else if (value.isTextual()) {
            checkSize(value.asText().codePointCount(0, value.asText().length()), schema, "minLength", "maxLength",
                    "character(s)", path, violations);
        } else if (value.isNumber()) {
            double number = value.asDouble();
            if (schema.get("minimum") instanceof Number minimum && number < minimum.doubleValue()) {
                violations.add(path + ": " + value + " is less than minimum " + minimum);
            }
            if (schema.get("maximum") instanceof Number maximum && number > maximum.doubleValue()) {
                violations.add(path + ": " + value + " is greater than maximum " + maximum);
            }
        }
    }

    private static void checkSize(int size, Map<String, Object> schema, String minKey, String maxKey, String unit,
            String path, List<String> violations) {
        if (schema.get(minKey) instanceof Number min && size < min.intValue()) {
            violations.add(path + ": has " + size + " " + unit + ", fewer than " + minKey + " " + min);
        }
        if (schema.get(maxKey) instanceof Number max && size > max.intValue()) {
            violations.add(path + ": has " + size + " " + unit + ", more than " + maxKey + " " + max);
        }
    }

    private static boolean matchesType(JsonNode value, Object type) {
        if (type instanceof List<?> alternatives) {
            for (Object alternative : alternatives) {
                if (matchesType(value, alternative)) {
                    return true;
                }
            }
            return false;
        }
        return switch (String.valueOf(type)) {
        case "object" -> value.isObject();
        case "array" -> value.isArray();
        case "string" -> value.isTextual();
        case "integer" -> value.isIntegralNumber()
                || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
        case "number" -> value.isNumber();
        case "boolean" -> value.isBoolean();
        case "null" -> value.isNull();
        default -> true;
        };
    }

    private static String typeOf(JsonNode value) {
        return switch (value.getNodeType()) {
        case OBJECT -> "object";
        case ARRAY -> "array";
        case STRING -> "string";
        case NUMBER -> value.isIntegralNumber() ? "integer" : "number";
        case BOOLEAN -> "boolean";
        case NULL -> "null";
        default -> value.getNodeType().name().toLowerCase(Locale.ROOT);
        };
    }

    private static String prefixOf(String text) {
        return text.length() > RAW_PREFIX_LENGTH ? text.substring(0, RAW_PREFIX_LENGTH) + "..." : text;
    }
}
