// file: server/src/main/java/io/planbridge/server/Main.java
package io.planbridge.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.planbridge.server.backend.InMemoryResourceBackend;
import io.planbridge.server.provider.GrpcResourceProviderService;
import io.planbridge.server.schema.SchemaRegistry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a bridge server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load resource schemas.
 *  - Wire the backend and BridgeService.
 *  - Start the gRPC ResourceProvider service and the HTTP server.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);

        SchemaRegistry schemas = cfg.schemaPath() == null
                ? SchemaRegistry.fromClasspath(ServerConfig.BUNDLED_SCHEMA)
                : SchemaRegistry.fromJsonFile(Path.of(cfg.schemaPath()));

        var backend = new InMemoryResourceBackend(schemas);
        var bridge = new BridgeService(schemas, backend, cfg.color());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), bridge);

        // ------ gRPC provider server ------
        Server grpcServer = ServerBuilder
                .forPort(cfg.grpcPort())
                .addService(new GrpcResourceProviderService(bridge))
                .build();

        web.start();
        grpcServer.start();

        System.out.printf(
                "PlanBridge listening on http://%s:%d (HTTP) and grpc://%s:%d (provider), %d resource types%n",
                "localhost", cfg.httpPort(),
                "localhost", cfg.grpcPort(),
                schemas.tokens().size()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                grpcServer.shutdown();
                web.stop();
            } catch (Exception e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }));
    }
}
