package io.planbridge.server;

import io.planbridge.core.render.Colorization;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CLI flags and their defaults.
 */
class ServerConfigTest {

    @Test
    void defaults_without_flags() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals(50051, cfg.grpcPort());
        assertEquals(8080, cfg.httpPort());
        assertNull(cfg.schemaPath());
        assertEquals(Colorization.NEVER, cfg.color());
    }

    @Test
    void long_and_short_flags() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "-g", "6000", "--http-port", "9090", "-s", "/tmp/schema.json", "--color", "always"
        });

        assertEquals(6000, cfg.grpcPort());
        assertEquals(9090, cfg.httpPort());
        assertEquals("/tmp/schema.json", cfg.schemaPath());
        assertEquals(Colorization.ALWAYS, cfg.color());
    }
}
