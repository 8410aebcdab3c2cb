package io.plaice.server.dto;

/**
 * Mutable mirror of {@link io.plaice.server.RunConfig} used for JSON binding
 * and as the accumulator while parsing CLI flags. Field initializers are the defaults.
 */
public class JsonRunConfig {
    public int width = 224;
    public int height = 224;
    public int workers = 16;
    public double overlapRatio = 0.4;
    public long queueWaitMillis = 2000;
    public long ageLimit = 500;
    public double confidenceFloor = 0.01;
    public long maxStaleness = -1;
    public String framesDir = "./frames";
    public int exportEvery = 1;
    public long throttleMillis = 10;
    public long idleMillis = 10;
    public long backoffMillis = 500;
    public Long seed;
    public int httpPort = 0;
    public String proposer = "neighborhood";
    public String targetImage;
    public int topX = 10;
    public boolean resume;
}
