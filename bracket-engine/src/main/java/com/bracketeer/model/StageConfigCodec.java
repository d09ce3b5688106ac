package com.bracketeer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the free-form stage config map into the typed config of each format.
 * Keys in {@code config} win over the same key in {@code metadata}; unknown keys are ignored.
 */
public final class StageConfigCodec {

    public static final String FIELD_THIRD_PLACE_MATCH = "third_place_match";
    public static final String FIELD_GRAND_FINALS_RESET = "grand_finals_reset";
    public static final String FIELD_ROUNDS_COUNT = "rounds_count";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private StageConfigCodec() {
    }

    public static SingleEliminationConfig singleElimination(StageDescriptor stage, boolean defaultThirdPlaceMatch) {
        ObjectNode root = toJson(stage);
        return new SingleEliminationConfig(optionalBoolean(root, FIELD_THIRD_PLACE_MATCH, defaultThirdPlaceMatch));
    }

    public static DoubleEliminationConfig doubleElimination(StageDescriptor stage, boolean defaultGrandFinalsReset) {
        ObjectNode root = toJson(stage);
        return new DoubleEliminationConfig(optionalBoolean(root, FIELD_GRAND_FINALS_RESET, defaultGrandFinalsReset));
    }

    public static SwissConfig swiss(StageDescriptor stage, int minRounds, int maxRounds) {
        ObjectNode root = toJson(stage);
        int roundsCount = requireInteger(root, FIELD_ROUNDS_COUNT);
        if (roundsCount < minRounds || roundsCount > maxRounds) {
            throw new IllegalArgumentException(
                    "Stage config field '"
                            + FIELD_ROUNDS_COUNT
                            + "' must be between "
                            + minRounds
                            + " and "
                            + maxRounds
                            + " (got "
                            + roundsCount
                            + ")"
            );
        }
        return new SwissConfig(roundsCount);
    }

    static ObjectNode toJson(StageDescriptor stage) {
        Objects.requireNonNull(stage, "stage is required");
        Map<String, Object> merged = new LinkedHashMap<>(stage.metadata());
        stage.config().forEach((key, value) -> {
            if (value != null || !merged.containsKey(key)) {
                merged.put(key, value);
            }
        });
        if (merged.isEmpty()) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return OBJECT_MAPPER.valueToTree(merged);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Stage config cannot be represented as JSON", ex);
        }
    }

    private static boolean optionalBoolean(JsonNode root, String fieldName, boolean defaultValue) {
        JsonNode valueNode = root.get(fieldName);
        if (valueNode == null || valueNode.isNull()) {
            return defaultValue;
        }
        if (valueNode.isBoolean()) {
            return valueNode.booleanValue();
        }
        if (valueNode.isTextual()) {
            String text = valueNode.textValue().trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        throw new IllegalArgumentException("Stage config field '" + fieldName + "' must be a boolean");
    }

    private static int requireInteger(JsonNode root, String fieldName) {
        JsonNode valueNode = root.get(fieldName);
        if (valueNode == null || valueNode.isNull()) {
            throw new IllegalArgumentException("Stage config field '" + fieldName + "' is required");
        }
        if (valueNode.isIntegralNumber() && valueNode.canConvertToInt()) {
            return valueNode.intValue();
        }
        if (valueNode.isTextual()) {
            try {
                return Integer.parseInt(valueNode.textValue().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Stage config field '" + fieldName + "' must be an integer", ex);
            }
        }
        throw new IllegalArgumentException("Stage config field '" + fieldName + "' must be an integer");
    }
}
