package io.plaice.server;

import io.plaice.server.agent.ProposerKind;
import io.plaice.server.sync.SyncOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RunConfigTest {

    @Test
    void defaults_match_documented_values() {
        RunConfig c = RunConfig.fromArgs(new String[0]);

        assertEquals(224, c.width());
        assertEquals(224, c.height());
        assertEquals(16, c.workers());
        assertEquals(0.4, c.overlapRatio());
        assertEquals(2000, c.queueWaitMillis());
        assertEquals(0.01, c.confidenceFloor());
        assertEquals(-1, c.maxStaleness());
        assertEquals(1, c.exportEvery());
        assertEquals(500, c.backoffMillis());
        assertNull(c.seed());
        assertEquals(0, c.httpPort());
        assertEquals(ProposerKind.NEIGHBORHOOD, c.proposer());
        assertFalse(c.resume());
        assertEquals(c, RunConfig.defaults());
    }

    @Test
    void flags_override_defaults() {
        RunConfig c = RunConfig.fromArgs(new String[]{
                "-W", "64", "--height", "32", "-n", "9", "--overlap", "0.25",
                "--age-limit", "100", "--seed", "123", "-p", "18181",
                "--frames", "/tmp/frames", "--max-staleness", "3", "--resume"
        });

        assertEquals(64, c.width());
        assertEquals(32, c.height());
        assertEquals(9, c.workers());
        assertEquals(0.25, c.overlapRatio());
        assertEquals(100, c.ageLimit());
        assertEquals(123L, c.seed());
        assertEquals(18181, c.httpPort());
        assertEquals(Path.of("/tmp/frames"), c.framesPath());
        assertEquals(3, c.maxStaleness());
        assertTrue(c.resume());
    }

    @Test
    void json_file_is_loaded_and_flags_win(@TempDir Path dir) throws Exception {
        Path json = dir.resolve("run.json");
        Files.writeString(json, """
                {
                  "width": 40,
                  "height": 30,
                  "workers": 4,
                  "proposer": "target",
                  "targetImage": "ref.png",
                  "topX": 5
                }
                """);

        RunConfig c = RunConfig.fromArgs(new String[]{"--workers", "6", "--config", json.toString()});

        assertEquals(40, c.width());
        assertEquals(30, c.height());
        assertEquals(6, c.workers());
        assertEquals(ProposerKind.TARGET, c.proposer());
        assertEquals("ref.png", c.targetImage());
        assertEquals(5, c.topX());
        assertEquals(RunConfig.fromJsonFile(json).width(), 40);
    }

    @Test
    void unknown_json_property_fails(@TempDir Path dir) throws Exception {
        Path json = dir.resolve("bad.json");
        Files.writeString(json, "{ \"widht\": 10 }");

        assertThrows(UncheckedIOException.class, () -> RunConfig.fromJsonFile(json));
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--workers", "0"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--width", "-1"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--overlap", "NaN"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--confidence-floor", "0"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--export-every", "0"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--http-port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--workers", "many"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--seed"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> RunConfig.fromArgs(new String[]{"--proposer", "oracle"}));
    }

    @Test
    void target_proposer_needs_an_image() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> RunConfig.fromArgs(new String[]{"--proposer", "target"}));
        assertTrue(e.getMessage().contains("--target-image"));
    }

    @Test
    void sync_options_carry_the_tuning_knobs() {
        RunConfig c = RunConfig.fromArgs(new String[]{
                "--queue-wait-ms", "250", "--age-limit", "7", "--max-staleness", "2",
                "--idle-ms", "3", "--throttle-ms", "4", "--backoff-ms", "5",
                "--export-every", "10", "--confidence-floor", "0.2", "--seed", "99"
        });

        SyncOptions o = c.toSyncOptions();
        assertEquals(Duration.ofMillis(250), o.aggregator().queueWait());
        assertEquals(7, o.aggregator().ageLimit());
        assertEquals(2, o.aggregator().maxStaleness());
        assertEquals(Duration.ofMillis(3), o.timing().idle());
        assertEquals(Duration.ofMillis(4), o.timing().throttle());
        assertEquals(Duration.ofMillis(5), o.timing().backoff());
        assertEquals(10, o.exportEvery());
        assertEquals(0.2, o.confidenceFloor());
        assertEquals(0.4, o.overlapRatio());
        assertEquals(99L, o.seed());
    }
}
