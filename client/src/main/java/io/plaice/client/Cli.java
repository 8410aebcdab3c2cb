package io.plaice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Simple CLI for the admin API of a running painting node.
 *
 * Usage:
 *   plaice-cli [--base-url http://host:port] health
 *   plaice-cli [--base-url http://host:port] status [--json]
 *   plaice-cli [--base-url http://host:port] stop
 *
 * Examples:
 *   plaice-cli status
 *   plaice-cli --base-url http://render-1:8080 stop
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(parsed.getKey());

            switch (cmd) {
                case "health" -> {
                    if (rest.length != 1) {
                        usageAndExit("health takes no arguments");
                    }
                    cli.health();
                }
                case "status" -> {
                    boolean raw = rest.length == 2 && "--json".equals(rest[1]);
                    if (rest.length > 2 || (rest.length == 2 && !raw)) {
                        usageAndExit("status accepts only --json");
                    }
                    cli.status(raw);
                }
                case "stop" -> {
                    if (rest.length != 1) {
                        usageAndExit("stop takes no arguments");
                    }
                    cli.stop();
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

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(args[1], rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void health() throws IOException, InterruptedException {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/admin/health")).GET());
        if (resp.statusCode() != 200) {
            throw new CliException("health check failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println("OK");
    }

    private void status(boolean raw) throws IOException, InterruptedException {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/status")).GET());
        if (resp.statusCode() != 200) {
            throw new CliException("status failed (" + resp.statusCode() + "): " + resp.body());
        }
        if (raw) {
            System.out.println(resp.body());
        } else {
            System.out.print(formatStatus(json.readTree(resp.body())));
        }
    }

    private void stop() throws IOException, InterruptedException {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/admin/stop"))
                .POST(HttpRequest.BodyPublishers.noBody()));
        if (resp.statusCode() != 202) {
            throw new CliException("stop failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println("stopping (was " + json.readTree(resp.body()).path("previousState").asText("?") + ")");
    }

    /** Human-readable rendering of a GET /status body. */
    static String formatStatus(JsonNode s) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("state=%s canvas=%dx%d age=%d queued=%d cycles=%d exportFailures=%d%n",
                s.path("state").asText(),
                s.path("width").asInt(),
                s.path("height").asInt(),
                s.path("age").asLong(),
                s.path("queued").asInt(),
                s.path("cycles").asLong(),
                s.path("exportFailures").asLong()));

        JsonNode last = s.path("lastCycle");
        if (last.isObject()) {
            sb.append(String.format("last cycle: age=%d batch=%d cells=%d stale=%d frame=%s%n",
                    last.path("age").asLong(),
                    last.path("batchSize").asInt(),
                    last.path("cellsWritten").asInt(),
                    last.path("staleDropped").asInt(),
                    last.path("frameId").asText("-")));
        }
        if (s.hasNonNull("failure")) {
            sb.append("failure: ").append(s.get("failure").asText()).append(System.lineSeparator());
        }
        for (JsonNode w : s.path("workers")) {
            JsonNode t = w.path("tile");
            sb.append(String.format("  worker %3d tile=[%d,%d)x[%d,%d) iter=%d offered=%d dropped=%d empty=%d errors=%d%n",
                    w.path("workerId").asInt(),
                    t.path(0).asInt(), t.path(1).asInt(), t.path(2).asInt(), t.path(3).asInt(),
                    w.path("iterations").asLong(),
                    w.path("proposalsOffered").asLong(),
                    w.path("proposalsDropped").asLong(),
                    w.path("emptyResults").asLong(),
                    w.path("errors").asLong()));
        }
        return sb.toString();
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        try {
            return http.send(builder.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
        } catch (java.net.ConnectException e) {
            throw new CliException("cannot reach " + baseUrl + ": " + e.getMessage());
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  plaice-cli [--base-url http://host:port] health
                  plaice-cli [--base-url http://host:port] status [--json]
                  plaice-cli [--base-url http://host:port] stop
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
