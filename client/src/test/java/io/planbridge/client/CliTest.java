package io.planbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The CLI posts both states to /preview and prints the returned text.
 * A local stub server stands in for the bridge.
 */
class CliTest {

    private final ObjectMapper json = new ObjectMapper();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private HttpServer stub;
    private int status = 200;
    private String reply = "{\"replace\":false,\"detailedDiff\":{},\"preview\":\"Resources:\\n    no changes\\n\"}";

    @TempDir
    Path tmp;

    @BeforeEach
    void startStub() throws Exception {
        stub = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        stub.createContext("/preview", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        stub.createContext("/admin/health", exchange -> {
            byte[] bytes = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        stub.start();
    }

    @AfterEach
    void stopStub() {
        stub.stop(0);
    }

    private Cli cli() {
        return new Cli("http://localhost:" + stub.getAddress().getPort() + "/");
    }

    @Test
    void preview_posts_both_states_and_returns_text() throws Exception {
        Path olds = Files.writeString(tmp.resolve("olds.json"), "{\"tags\": [\"a\"]}");
        Path news = Files.writeString(tmp.resolve("news.json"), "{\"tags\": [\"b\"]}");

        String out = cli().preview("prov:index/test:Test", "res", olds, news, List.of("labels"));

        assertEquals("Resources:\n    no changes\n", out);
        JsonNode sent = json.readTree(lastBody.get());
        assertEquals("prov:index/test:Test", sent.get("type").asText());
        assertEquals("res", sent.get("name").asText());
        assertEquals("a", sent.get("olds").get("tags").get(0).asText());
        assertEquals("b", sent.get("news").get("tags").get(0).asText());
        assertEquals("labels", sent.get("ignoreChanges").get(0).asText());
    }

    @Test
    void missing_olds_is_sent_as_null() throws Exception {
        Path news = Files.writeString(tmp.resolve("news.json"), "{}");

        cli().preview("prov:index/test:Test", "res", null, news, List.of());

        assertTrue(json.readTree(lastBody.get()).get("olds").isNull());
    }

    @Test
    void server_error_is_reported() throws Exception {
        status = 400;
        reply = "{\"error\":\"unknown resource type x\"}";
        Path news = Files.writeString(tmp.resolve("news.json"), "{}");

        var ex = assertThrows(Cli.CliException.class, () -> cli().preview("x", "res", null, news, List.of()));
        assertEquals("preview failed (400): unknown resource type x", ex.getMessage());
    }

    @Test
    void invalid_input_file_is_reported() throws Exception {
        Path news = Files.writeString(tmp.resolve("news.json"), "{oops");

        var ex = assertThrows(Cli.CliException.class,
                () -> cli().preview("x", "res", null, news, List.of()));
        assertTrue(ex.getMessage().startsWith("invalid JSON in "));
    }

    @Test
    void health_returns_status() throws Exception {
        assertEquals("ok", cli().health());
    }

    @Test
    void parses_trailing_ignore_flags() {
        String[] args = {"preview", "t", "n", "o.json", "n.json", "--ignore", "tags", "--ignore", "rules[*].port"};

        assertEquals(List.of("tags", "rules[*].port"), Cli.parseIgnore(args, 5));
        assertThrows(Cli.CliException.class, () -> Cli.parseIgnore(new String[]{"--ignore"}, 0));
    }
}
