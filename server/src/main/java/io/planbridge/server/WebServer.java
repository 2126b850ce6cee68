// file: server/src/main/java/io/planbridge/server/WebServer.java
package io.planbridge.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.diff.DiffException;
import io.planbridge.core.diff.DiffOptions;
import io.planbridge.core.diff.ReplaceOverride;
import io.planbridge.core.render.DiffRenderer;
import io.planbridge.core.render.ResourceChange;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.codec.JsonValueCodec;
import io.planbridge.server.dto.PreviewRequest;
import io.planbridge.server.dto.PreviewResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over BridgeService, for humans and scripts that want a preview without
 * speaking gRPC.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert diff results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout:
 *   - GET  /admin/health   Basic health check
 *   - POST /preview        Detailed diff and preview text for one resource
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final BridgeService bridge;

    public WebServer(int port, BridgeService bridge) {
        this.bridge = bridge;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, null);
                    } else if ("/preview".equals(path)) {
                        if ("POST".equals(method)) {
                            handlePreview(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, null);
                        }
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // ---------- handlers ----------

    /** POST /preview */
    private void handlePreview(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, PreviewRequest.class);
                            status = 200;
                            send(exchange, status, preview(req));
                        }
                    } catch (IllegalArgumentException | DiffException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), totalMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, 0, ioEx);
                }
        );
    }

    private PreviewResponse preview(PreviewRequest req) {
        if (req.type == null || req.type.isBlank()) throw new IllegalArgumentException("type must not be empty");
        String name = req.name == null || req.name.isBlank() ? "resource" : req.name;

        ValueTree olds = JsonValueCodec.decode(req.olds);
        ValueTree news = JsonValueCodec.decode(req.news);
        var options = new DiffOptions(req.ignoreChanges, ReplaceOverride.NONE);

        BridgeService.Planned plan = bridge.diff(new Urn("http", "preview", req.type, name), olds, news, options);

        var dto = new PreviewResponse();
        dto.replace = plan.result().replace();
        dto.detailedDiff = new LinkedHashMap<>();
        DiffRenderer.toWire(plan.result()).forEach((p, kind) -> dto.detailedDiff.put(p, kind.name()));
        dto.preview = DiffRenderer.preview(
                List.of(ResourceChange.of(req.type, name, olds.isPresent(), plan.result())), bridge.color());
        return dto;
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
