// file: server/src/main/java/io/planbridge/server/ServerConfig.java
package io.planbridge.server;

import io.planbridge.core.render.Colorization;

/**
 * Bridge server configuration parsed from CLI args.
 *
 * Supports:
 *  - grpcPort:   ResourceProvider gRPC port
 *  - httpPort:   HTTP port for health and previews
 *  - schemaPath: JSON schema document; null means the bundled classpath schema
 *  - color:      whether previews carry ANSI colors
 */
public record ServerConfig(
        int grpcPort,
        int httpPort,
        String schemaPath,
        Colorization color
) {

    /** Classpath location of the schema used when no --schema is given. */
    public static final String BUNDLED_SCHEMA = "/schema.json";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --grpc-port, -g   <port>
     *   --http-port, -p   <port>
     *   --schema,    -s   <path>
     *   --color           never | always
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int grpcPort = 50051;
        int httpPort = 8080;
        String schemaPath = null;
        Colorization color = Colorization.NEVER;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parsePort("grpc-port", args[++i]);
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parsePort("http-port", args[++i]);
                }

                case "--schema", "-s" -> {
                    ensureValue(args, i);
                    schemaPath = args[++i];
                }

                case "--color" -> {
                    ensureValue(args, i);
                    try {
                        color = Colorization.parse(args[++i]);
                    } catch (IllegalArgumentException e) {
                        System.err.println(e.getMessage());
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(grpcPort, httpPort, schemaPath, color);
    }

    private static int parsePort(String name, String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535) throw new NumberFormatException();
            return port;
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return -1;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: planbridge-server [options]

            Options:
              --grpc-port, -g   ResourceProvider gRPC port (default: 50051)
              --http-port, -p   HTTP port (default: 8080)
              --schema,    -s   Path to JSON schema document (default: bundled schema)
              --color           Preview colors: never | always (default: never)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
