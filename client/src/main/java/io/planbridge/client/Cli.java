// file: client/src/main/java/io/planbridge/client/Cli.java
package io.planbridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for previewing resource changes against a running bridge over HTTP.
 *
 * Usage:
 *   planbridge-cli [--base-url http://host:port] health
 *   planbridge-cli [--base-url http://host:port] preview <type> <name> <olds.json|-> <news.json> [--ignore <path>]...
 *
 * Examples:
 *   planbridge-cli preview prov:index/bucket:Bucket logs old.json new.json
 *   planbridge-cli preview prov:index/bucket:Bucket logs - new.json        (create)
 *   planbridge-cli preview prov:index/bucket:Bucket logs old.json new.json --ignore tags
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "health" -> {
                    if (rest.length != 1) {
                        usageAndExit("health takes no arguments");
                    }
                    System.out.println(cli.health());
                }
                case "preview" -> {
                    if (rest.length < 5) {
                        usageAndExit("preview requires <type> <name> <olds.json|-> <news.json>");
                    }
                    List<String> ignore = parseIgnore(rest, 5);
                    Path olds = "-".equals(rest[3]) ? null : Path.of(rest[3]);
                    System.out.print(cli.preview(rest[1], rest[2], olds, Path.of(rest[4]), ignore));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** Trailing {@code --ignore <path>} pairs starting at {@code from}. */
    static List<String> parseIgnore(String[] args, int from) {
        var out = new ArrayList<String>();
        for (int i = from; i < args.length; i++) {
            if (!"--ignore".equals(args[i]) || i + 1 >= args.length) {
                throw new CliException("unexpected argument: " + args[i]);
            }
            out.add(args[++i]);
        }
        return out;
    }

    String health() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/admin/health"))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("health failed (" + resp.statusCode() + "): " + resp.body());
        }
        return json.readTree(resp.body()).path("status").asText();
    }

    /**
     * POST the two states to /preview and return the rendered preview text.
     * A null {@code olds} previews a create.
     */
    String preview(String type, String name, Path olds, Path news, List<String> ignore)
            throws IOException, InterruptedException {
        ObjectNode body = previewBody(type, name, olds == null ? null : readJson(olds), readJson(news), ignore);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/preview"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("preview failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        return json.readTree(resp.body()).path("preview").asText();
    }

    ObjectNode previewBody(String type, String name, JsonNode olds, JsonNode news, List<String> ignore) {
        ObjectNode body = json.createObjectNode();
        body.put("type", type);
        body.put("name", name);
        body.set("olds", olds == null ? json.nullNode() : olds);
        body.set("news", news);
        var ignoreChanges = body.putArray("ignoreChanges");
        ignore.forEach(ignoreChanges::add);
        return body;
    }

    private JsonNode readJson(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new CliException("no such file: " + file);
        }
        try {
            return json.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new CliException("invalid JSON in " + file + ": " + e.getOriginalMessage());
        }
    }

    private String errorOf(String body) {
        try {
            JsonNode node = json.readTree(body);
            return node.hasNonNull("error") ? node.get("error").asText() : body;
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  planbridge-cli [--base-url http://host:port] health
                  planbridge-cli [--base-url http://host:port] preview <type> <name> <olds.json|-> <news.json> [--ignore <path>]...
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
