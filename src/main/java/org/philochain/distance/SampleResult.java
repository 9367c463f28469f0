package org.philochain.distance;

import lombok.Value;

/**
 * Outcome of drawing a random article at a fixed distance from the target.
 */
@Value
public class SampleResult {
    /**
     * Sampling outcome tag.
     */
    public enum Status {
        SAMPLED,
        EMPTY_BUCKET
    }

    Status status;
    /** Requested distance. */
    int distance;
    /** Sampled title; {@code null} for an empty bucket. */
    String node;
    /** Number of articles at the requested distance. */
    int bucketSize;

    static SampleResult sampled(int distance, String node, int bucketSize) {
        return new SampleResult(Status.SAMPLED, distance, node, bucketSize);
    }

    static SampleResult emptyBucket(int distance) {
        return new SampleResult(Status.EMPTY_BUCKET, distance, null, 0);
    }

    public boolean isSampled() {
        return status == Status.SAMPLED;
    }
}
