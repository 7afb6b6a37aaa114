package io.engram.core.consolidation;

public record SleepCycleOptions(String agentName, int limit, int batchSize, boolean dryRun) {
    public static final int DEFAULT_LIMIT = 200;
    public static final int DEFAULT_BATCH_SIZE = 20;

    public SleepCycleOptions {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        agentName = agentName == null || agentName.isBlank() ? null : agentName.trim();
    }

    public static SleepCycleOptions defaults() {
        return new SleepCycleOptions(null, DEFAULT_LIMIT, DEFAULT_BATCH_SIZE, false);
    }

    public SleepCycleOptions withDryRun(boolean value) {
        return new SleepCycleOptions(agentName, limit, batchSize, value);
    }
}
