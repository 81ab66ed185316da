package net.spookly.gsdk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import net.spookly.gsdk.api.GamePort;
import net.spookly.gsdk.api.GameServerConnectionInfo;
import org.junit.jupiter.api.Test;

class FileConfigurationSourceTest {
    @Test
    void readsJsonConfigWithMisspelledAddressKey() throws IOException {
        Path configPath = write("gsdkConfig.json", "{\n"
                + "  \"heartbeatEndpoint\": \"localhost:56001\",\n"
                + "  \"sessionHostId\": \"host-1\",\n"
                + "  \"logFolder\": \"/data/logs\",\n"
                + "  \"titleId\": \"A1B2\",\n"
                + "  \"gameCertificates\": {\"cert\": \"/certs/cert.pfx\"},\n"
                + "  \"buildMetadata\": {\"mode\": \"ranked\"},\n"
                + "  \"gamePorts\": {\"game\": \"7777\"},\n"
                + "  \"someFutureKey\": true,\n"
                + "  \"gameServerConnectionInfo\": {\n"
                + "    \"publicIpV4Adress\": \"20.1.2.3\",\n"
                + "    \"gamePortsConfiguration\": [\n"
                + "      {\"name\": \"game\", \"serverListeningPort\": 7777, \"clientConnectionPort\": 30000}\n"
                + "    ]\n"
                + "  }\n"
                + "}\n");

        FileConfigurationSource source = FileConfigurationSource.load(configPath);

        assertEquals("localhost:56001", source.heartbeatEndpoint());
        assertEquals("host-1", source.serverId());
        assertEquals("/data/logs", source.logFolder());
        assertEquals("A1B2", source.titleId());
        assertEquals(Map.of("cert", "/certs/cert.pfx"), source.gameCertificates());
        assertEquals(Map.of("mode", "ranked"), source.buildMetadata());
        assertEquals(Map.of("game", "7777"), source.gamePorts());
        GameServerConnectionInfo info = source.gameServerConnectionInfo();
        assertEquals("20.1.2.3", info.publicIpV4Address());
        assertEquals(1, info.gamePorts().size());
        assertEquals(new GamePort("game", 7777, 30000), info.gamePorts().get(0));
        assertEquals(configPath.toString(), source.describe());
    }

    @Test
    void readsYamlConfig() throws IOException {
        Path configPath = write("gsdk.yaml", String.join("\n",
                "heartbeatEndpoint: localhost:56001",
                "sessionHostId: host-2",
                "buildMetadata:",
                "  mode: casual",
                "  empty:",
                "gameServerConnectionInfo:",
                "  publicIpV4Address: 10.0.0.1",
                ""));

        FileConfigurationSource source = FileConfigurationSource.load(configPath);

        assertEquals("host-2", source.serverId());
        assertEquals(Map.of("mode", "casual"), source.buildMetadata());
        assertEquals("10.0.0.1", source.gameServerConnectionInfo().publicIpV4Address());
        assertTrue(source.gameServerConnectionInfo().gamePorts().isEmpty());
        assertTrue(source.gameCertificates().isEmpty());
    }

    @Test
    void missingFileFails() throws IOException {
        Path missing = Files.createTempDirectory("gsdk-config").resolve("missing.json");

        ConfigException exception = assertThrows(ConfigException.class, () -> FileConfigurationSource.load(missing));

        assertTrue(exception.getMessage().contains("not found"));
    }

    @Test
    void emptyFileFails() throws IOException {
        Path configPath = write("empty.json", "");

        assertThrows(ConfigException.class, () -> FileConfigurationSource.load(configPath));
    }

    @Test
    void wrongShapeFails() throws IOException {
        Path configPath = write("broken.json", "{\"gameCertificates\": [1, 2, 3]}");

        assertThrows(ConfigException.class, () -> FileConfigurationSource.load(configPath));
    }

    private static Path write(String name, String content) throws IOException {
        Path configPath = Files.createTempDirectory("gsdk-config").resolve(name);
        Files.writeString(configPath, content, StandardCharsets.UTF_8);
        return configPath;
    }
}
