package com.bracketeer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Renders generated matches in the flat shape the persistence layer consumes.
 */
public final class MatchRecordJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private MatchRecordJsonCodec() {
    }

    public static ArrayNode toJson(List<MatchRecord> matches) {
        if (matches == null) {
            throw new IllegalArgumentException("Match list is required");
        }
        ArrayNode root = JsonNodeFactory.instance.arrayNode();
        for (MatchRecord match : matches) {
            root.add(toJson(match));
        }
        return root;
    }

    public static ObjectNode toJson(MatchRecord match) {
        if (match == null) {
            throw new IllegalArgumentException("Match record is required");
        }

        ObjectNode node = JsonNodeFactory.instance.objectNode();
        putNullable(node, "id", match.id());
        putNullable(node, "tournament_id", match.tournamentId());
        putNullable(node, "stage_id", match.stageId());
        node.put("round_number", match.roundNumber());
        node.put("match_number", match.matchNumber());
        node.put("stage_type", match.stageType());
        putNullable(node, "team_a_id", match.teamAId());
        putNullable(node, "team_b_id", match.teamBId());
        node.put("team_a_name", match.teamAName());
        node.put("team_b_name", match.teamBName());
        node.put("state", match.state().wireValue());

        JsonNode metadata = OBJECT_MAPPER.valueToTree(match.metadata());
        node.set("metadata", metadata);
        return node;
    }

    private static void putNullable(ObjectNode node, String fieldName, Long value) {
        if (value == null) {
            node.putNull(fieldName);
        } else {
            node.put(fieldName, value);
        }
    }
}
