package io.plaice.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.plaice.core.TileBounds;
import io.plaice.server.dto.StatusResponse;
import io.plaice.server.sync.CycleStats;
import io.plaice.server.sync.SyncState;
import io.plaice.server.sync.SyncStatus;
import io.plaice.server.sync.Synchronizer;
import io.plaice.server.sync.WorkerStats;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admin HTTP surface over a {@link Synchronizer}.
 *
 * Path layout:
 *   - GET  /admin/health   liveness, always {"status":"ok"}
 *   - GET  /status         run state, age, queue depth, last cycle, per-worker counters
 *   - POST /admin/stop     request a graceful stop; returns 202 right away,
 *                          repeated requests do not start another stop
 *
 * Anything else is 404; a known path with the wrong method is 405.
 */
public final class WebServer {

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final Synchronizer sync;
    private final AtomicBoolean stopDispatched = new AtomicBoolean(false);

    public WebServer(int port, Synchronizer sync) {
        this.sync = Objects.requireNonNull(sync, "sync");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    long start = System.nanoTime();
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    int status;
                    Throwable error = null;
                    try {
                        status = switch (path) {
                            case "/admin/health" -> "GET".equals(method)
                                    ? send(exchange, 200, Map.of("status", "ok"))
                                    : methodNotAllowed(exchange);
                            case "/status" -> "GET".equals(method)
                                    ? send(exchange, 200, toResponse(sync.status()))
                                    : methodNotAllowed(exchange);
                            case "/admin/stop" -> "POST".equals(method)
                                    ? handleStop(exchange)
                                    : methodNotAllowed(exchange);
                            default -> send(exchange, 404, Map.of("error", "not found"));
                        };
                    } catch (Exception e) {
                        error = e;
                        status = send(exchange, 500, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest(method, path, status, totalMs, error);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** POST /admin/stop: stop() joins every thread, so it runs off the I/O thread, at most once. */
    private int handleStop(HttpServerExchange ex) {
        SyncState before = sync.state();
        boolean dispatched = before != SyncState.STOPPED && stopDispatched.compareAndSet(false, true);
        if (dispatched) {
            Thread t = new Thread(sync::stop, "plaice-admin-stop");
            t.start();
        }
        return send(ex, 202, Map.of("stopping", true, "dispatched", dispatched, "previousState", before.name()));
    }

    private int methodNotAllowed(HttpServerExchange ex) {
        return send(ex, 405, Map.of("error", "method not allowed"));
    }

    static StatusResponse toResponse(SyncStatus s) {
        var dto = new StatusResponse();
        dto.state = s.state().name();
        dto.running = s.running();
        dto.width = s.width();
        dto.height = s.height();
        dto.age = s.age();
        dto.queued = s.queued();
        dto.cycles = s.cycles();
        dto.exportFailures = s.exportFailures();
        dto.failure = s.failure();

        CycleStats c = s.lastCycle();
        if (c != null) {
            var rec = new StatusResponse.CycleRecord();
            rec.age = c.age();
            rec.batchSize = c.batchSize();
            rec.cellsWritten = c.cellsWritten();
            rec.staleDropped = c.staleDropped();
            rec.frameId = c.frameId();
            dto.lastCycle = rec;
        }

        dto.workers = new ArrayList<>(s.workers().size());
        for (WorkerStats w : s.workers()) {
            var rec = new StatusResponse.WorkerRecord();
            TileBounds t = w.tile();
            rec.workerId = w.workerId();
            rec.tile = new int[]{t.x0(), t.x1(), t.y0(), t.y1()};
            rec.iterations = w.iterations();
            rec.proposalsOffered = w.proposalsOffered();
            rec.proposalsDropped = w.proposalsDropped();
            rec.emptyResults = w.emptyResults();
            rec.errors = w.errors();
            dto.workers.add(rec);
        }
        return dto;
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
