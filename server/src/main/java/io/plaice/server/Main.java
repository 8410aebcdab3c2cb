package io.plaice.server;

import io.plaice.core.CanvasView;
import io.plaice.server.agent.ProposalSources;
import io.plaice.server.sync.Synchronizer;
import io.plaice.storage.Canvas;
import io.plaice.storage.FileFrameStore;
import io.plaice.storage.FrameStore;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.logging.LogManager;

/**
 * Entry point for one painting run.
 *
 * Responsibilities:
 *  - Load logging setup and parse configuration from CLI (and optional JSON).
 *  - Build the canvas, fresh or resumed from the latest exported frame.
 *  - Wire proposal sources, frame store and the Synchronizer.
 *  - Start the admin HTTP server when a port is configured.
 *  - Wait for the run to end (age limit, POST /admin/stop, or Ctrl-C) and stop cleanly.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();

        RunConfig cfg;
        try {
            cfg = RunConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Run with --help for usage.");
            System.exit(2);
            return;
        }

        var frames = new FileFrameStore(cfg.framesPath());
        Canvas canvas = cfg.resume() ? resumeCanvas(cfg, frames) : new Canvas(cfg.width(), cfg.height());

        var sync = new Synchronizer(
                canvas,
                cfg.workers(),
                ProposalSources.forConfig(cfg),
                cfg.toSyncOptions(),
                frames
        );

        WebServer web = null;
        if (cfg.httpPort() > 0) {
            web = new WebServer(cfg.httpPort(), sync);
            web.start();
            System.out.printf("Admin API listening on http://%s:%d%n", "localhost", cfg.httpPort());
        }

        Runtime.getRuntime().addShutdownHook(new Thread(sync::stop, "plaice-shutdown"));

        sync.startRun();
        System.out.printf(
                "Painting %dx%d canvas with %d workers (proposer=%s, age limit=%s), frames -> %s%n",
                canvas.width(), canvas.height(), cfg.workers(), cfg.proposer().name().toLowerCase(),
                cfg.ageLimit() == 0 ? "none" : Long.toString(cfg.ageLimit()),
                frames.dir().toAbsolutePath()
        );

        while (!sync.awaitCompletion(Duration.ofSeconds(1))) {
            // keep waiting; stop arrives via age limit, admin API or shutdown hook
        }
        sync.stop();

        if (web != null) {
            web.stop();
        }

        Throwable failure = sync.failure();
        if (failure != null) {
            System.err.printf("Run failed at age %d: %s%n", canvas.age(), failure);
            System.exit(1);
        }
        System.out.printf("Run finished at age %d%n", canvas.age());
    }

    private static Canvas resumeCanvas(RunConfig cfg, FrameStore frames) {
        FrameStore.LoadedFrame latest = frames.loadLatest();
        if (latest == null) {
            System.out.println("No frame to resume from, starting from a black canvas");
            return new Canvas(cfg.width(), cfg.height());
        }
        CanvasView frame = latest.frame();
        if (frame.width() != cfg.width() || frame.height() != cfg.height()) {
            throw new IllegalArgumentException(String.format(
                    "frame %s is %dx%d but the configured canvas is %dx%d",
                    latest.id(), frame.width(), frame.height(), cfg.width(), cfg.height()));
        }
        System.out.printf("Resuming from %s at age %d%n", latest.id(), latest.age());
        return Canvas.restore(frame, latest.age());
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
