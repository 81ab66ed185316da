package net.spookly.gsdk.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class HeartbeatCodecTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HeartbeatCodec codec = new HeartbeatCodec();

    @Test
    void encodesStateHealthAndPlayers() throws Exception {
        HeartbeatRequest request = new HeartbeatRequest(
                GameState.STANDING_BY,
                false,
                List.of(new ConnectedPlayer("player-1"), new ConnectedPlayer("player-2"))
        );

        JsonNode json = MAPPER.readTree(codec.encode(request));

        assertEquals("StandingBy", json.get("CurrentGameState").asText());
        assertEquals("Unhealthy", json.get("CurrentGameHealth").asText());
        assertEquals(2, json.get("CurrentPlayers").size());
        assertEquals("player-1", json.get("CurrentPlayers").get(0).get("PlayerId").asText());
        assertEquals("player-2", json.get("CurrentPlayers").get(1).get("PlayerId").asText());
    }

    @Test
    void encodesEmptyRosterAsEmptyArray() throws Exception {
        JsonNode json = MAPPER.readTree(codec.encode(new HeartbeatRequest(GameState.ACTIVE, true, List.of())));

        assertEquals("Active", json.get("CurrentGameState").asText());
        assertEquals("Healthy", json.get("CurrentGameHealth").asText());
        assertTrue(json.get("CurrentPlayers").isArray());
        assertEquals(0, json.get("CurrentPlayers").size());
    }

    @Test
    void encodingIsDeterministic() {
        HeartbeatRequest request = new HeartbeatRequest(GameState.ACTIVE, true, List.of(new ConnectedPlayer("a")));

        assertEquals(codec.encode(request), codec.encode(request));
    }

    @Test
    void decodesFullResponse() throws Exception {
        String body = "{"
                + "\"sessionConfig\":{"
                + "\"sessionId\":\"abc\","
                + "\"sessionCookie\":\"cookie\","
                + "\"maxPlayers\":16,"
                + "\"initialPlayers\":[\"p1\",\"p2\"],"
                + "\"metadata\":{\"map\":\"dust\",\"round\":3}"
                + "},"
                + "\"nextScheduledMaintenanceUtc\":\"2030-05-01T10:30:00Z\","
                + "\"operation\":\"Active\","
                + "\"somethingNew\":{\"nested\":true}"
                + "}";

        HeartbeatResponse response = codec.decode(body);

        assertEquals("abc", response.sessionConfig().get("sessionId"));
        assertEquals("cookie", response.sessionConfig().get("sessionCookie"));
        assertEquals("dust", response.sessionConfig().get("map"));
        assertFalse(response.sessionConfig().containsKey("maxPlayers"));
        assertFalse(response.sessionConfig().containsKey("round"));
        assertFalse(response.sessionConfig().containsKey("metadata"));
        assertEquals(List.of("p1", "p2"), response.initialPlayers());
        assertEquals(Instant.parse("2030-05-01T10:30:00Z"), response.nextScheduledMaintenance());
        assertEquals(Operation.ACTIVE, response.operation());
    }

    @Test
    void absentFieldsDecodeAsNoUpdate() throws Exception {
        HeartbeatResponse response = codec.decode("{}");

        assertNull(response.sessionConfig());
        assertNull(response.initialPlayers());
        assertNull(response.nextScheduledMaintenance());
        assertNull(response.operation());
    }

    @Test
    void unknownOperationDecodesAsUnknown() throws Exception {
        HeartbeatResponse response = codec.decode("{\"operation\":\"GetManifest\"}");

        assertEquals(Operation.UNKNOWN, response.operation());
        assertEquals("GetManifest", response.rawOperation());
    }

    @Test
    void unparsableMaintenanceFallsBackToFarPast() throws Exception {
        HeartbeatResponse response = codec.decode("{\"nextScheduledMaintenanceUtc\":\"next tuesday\"}");

        assertEquals(MaintenanceTimes.FAR_PAST, response.nextScheduledMaintenance());
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode("{\"operation\":"));
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode(""));
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode("[1,2,3]"));
    }

    @Test
    void rejectsSchemaMismatchesBeforeReturningAnything() {
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode("{\"sessionConfig\":\"oops\"}"));
        assertThrows(HeartbeatDecodingException.class,
                () -> codec.decode("{\"sessionConfig\":{\"a\":\"b\",\"initialPlayers\":[1,2]}}"));
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode("{\"operation\":5}"));
        assertThrows(HeartbeatDecodingException.class, () -> codec.decode("{\"nextScheduledMaintenanceUtc\":17}"));
    }
}
