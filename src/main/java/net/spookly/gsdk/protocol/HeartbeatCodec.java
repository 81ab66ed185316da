package net.spookly.gsdk.protocol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;

/**
 * JSON codec for the session host heartbeat protocol.
 */
public final class HeartbeatCodec {
    static final String FIELD_CURRENT_GAME_STATE = "CurrentGameState";
    static final String FIELD_CURRENT_GAME_HEALTH = "CurrentGameHealth";
    static final String FIELD_CURRENT_PLAYERS = "CurrentPlayers";
    static final String FIELD_PLAYER_ID = "PlayerId";

    static final String FIELD_SESSION_CONFIG = "sessionConfig";
    static final String FIELD_INITIAL_PLAYERS = "initialPlayers";
    static final String FIELD_METADATA = "metadata";
    static final String FIELD_NEXT_MAINTENANCE = "nextScheduledMaintenanceUtc";
    static final String FIELD_OPERATION = "operation";

    public static final String HEALTHY = "Healthy";
    public static final String UNHEALTHY = "Unhealthy";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Serialize a heartbeat request. Field order is fixed so equal snapshots encode identically.
     */
    public String encode(@NonNull HeartbeatRequest request) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(FIELD_CURRENT_GAME_STATE, request.currentState().wireName());
        root.put(FIELD_CURRENT_GAME_HEALTH, request.healthy() ? HEALTHY : UNHEALTHY);
        ArrayNode players = root.putArray(FIELD_CURRENT_PLAYERS);
        for (ConnectedPlayer player : request.players()) {
            players.addObject().put(FIELD_PLAYER_ID, player.playerId());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode heartbeat request", e);
        }
    }

    /**
     * Decode a response body. The whole body is validated before anything is returned, so a failure never leaves a
     * partially applied response behind.
     */
    public HeartbeatResponse decode(String body) throws HeartbeatDecodingException {
        if (body == null || body.isBlank()) {
            throw new HeartbeatDecodingException("heartbeat response body is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new HeartbeatDecodingException("heartbeat response is not valid json: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new HeartbeatDecodingException("heartbeat response must be a json object");
        }

        Map<String, String> sessionConfig = null;
        List<String> initialPlayers = null;
        JsonNode sessionNode = present(root, FIELD_SESSION_CONFIG);
        if (sessionNode != null) {
            if (!sessionNode.isObject()) {
                throw new HeartbeatDecodingException(FIELD_SESSION_CONFIG + " must be an object");
            }
            sessionConfig = new LinkedHashMap<>();
            copyStringEntries(sessionNode, sessionConfig);
            initialPlayers = decodeInitialPlayers(present(sessionNode, FIELD_INITIAL_PLAYERS));
            JsonNode metadata = present(sessionNode, FIELD_METADATA);
            if (metadata != null) {
                if (!metadata.isObject()) {
                    throw new HeartbeatDecodingException(FIELD_METADATA + " must be an object");
                }
                copyStringEntries(metadata, sessionConfig);
            }
        }

        Instant nextMaintenance = null;
        JsonNode maintenanceNode = present(root, FIELD_NEXT_MAINTENANCE);
        if (maintenanceNode != null) {
            nextMaintenance = MaintenanceTimes.parse(requireText(maintenanceNode, FIELD_NEXT_MAINTENANCE));
        }

        String operation = null;
        JsonNode operationNode = present(root, FIELD_OPERATION);
        if (operationNode != null) {
            operation = requireText(operationNode, FIELD_OPERATION);
        }
        return new HeartbeatResponse(sessionConfig, initialPlayers, nextMaintenance, operation);
    }

    private static List<String> decodeInitialPlayers(JsonNode node) throws HeartbeatDecodingException {
        if (node == null) {
            return null;
        }
        if (!node.isArray()) {
            throw new HeartbeatDecodingException(FIELD_INITIAL_PLAYERS + " must be an array");
        }
        List<String> players = new ArrayList<>(node.size());
        for (JsonNode player : node) {
            players.add(requireText(player, FIELD_INITIAL_PLAYERS + " entry"));
        }
        return players;
    }

    // Non-string values (nested objects, numbers, arrays) are skipped.
    private static void copyStringEntries(JsonNode source, Map<String, String> target) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                target.put(field.getKey(), field.getValue().textValue());
            }
        }
    }

    private static JsonNode present(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node;
    }

    private static String requireText(JsonNode node, String field) throws HeartbeatDecodingException {
        if (!node.isTextual()) {
            throw new HeartbeatDecodingException(field + " must be a string");
        }
        return node.textValue();
    }
}
