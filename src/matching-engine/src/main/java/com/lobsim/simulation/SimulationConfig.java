package com.lobsim.simulation;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration parsed from environment variables.
 * Malformed numbers fall back to their defaults.
 */
public class SimulationConfig {

    private final long tickIntervalMillis;
    private final double initialPrice;
    private final long randomSeed;
    private final long runDurationSeconds;
    private final int statsIntervalSeconds;
    private final int summaryDepth;
    private final int metricsPort;
    private final int ringBufferSize;
    private final Path seedFile;
    private final boolean detailedLogging;

    SimulationConfig(long tickIntervalMillis, double initialPrice, long randomSeed,
                     long runDurationSeconds, int statsIntervalSeconds, int summaryDepth,
                     int metricsPort, int ringBufferSize, Path seedFile, boolean detailedLogging) {
        this.tickIntervalMillis = tickIntervalMillis;
        this.initialPrice = initialPrice;
        this.randomSeed = randomSeed;
        this.runDurationSeconds = runDurationSeconds;
        this.statsIntervalSeconds = statsIntervalSeconds;
        this.summaryDepth = summaryDepth;
        this.metricsPort = metricsPort;
        this.ringBufferSize = ringBufferSize;
        this.seedFile = seedFile;
        this.detailedLogging = detailedLogging;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static SimulationConfig fromEnv() {
        return from(System.getenv());
    }

    public static SimulationConfig from(Map<String, String> env) {
        long tickIntervalMillis = getLong(env, "TICK_INTERVAL_MS", 1000);
        double initialPrice = getDouble(env, "INITIAL_PRICE", 100.0);
        long randomSeed = getLong(env, "RANDOM_SEED", 0);
        long runDurationSeconds = getLong(env, "RUN_DURATION_SECONDS", 0);
        int statsIntervalSeconds = getInt(env, "STATS_INTERVAL_SECONDS", 10);
        int summaryDepth = getInt(env, "SUMMARY_DEPTH", 5);
        int metricsPort = getInt(env, "METRICS_PORT", 0);
        int ringBufferSize = getInt(env, "RING_BUFFER_SIZE", 1024);
        String seedFile = get(env, "SEED_FILE", null);
        boolean detailedLogging = Boolean.parseBoolean(get(env, "ENABLE_DETAILED_LOGGING", "false"));

        if (tickIntervalMillis <= 0) {
            tickIntervalMillis = 1000;
        }
        if (!Double.isFinite(initialPrice) || initialPrice <= 0) {
            initialPrice = 100.0;
        }
        if (Integer.bitCount(ringBufferSize) != 1) {
            ringBufferSize = 1024;  // Disruptor requires a power of two
        }
        if (statsIntervalSeconds <= 0) {
            statsIntervalSeconds = 10;
        }

        return new SimulationConfig(tickIntervalMillis, initialPrice, randomSeed,
                runDurationSeconds, statsIntervalSeconds, summaryDepth, metricsPort,
                ringBufferSize, seedFile != null ? Paths.get(seedFile) : null, detailedLogging);
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static long getLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, String> env, String key, double defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public long getTickIntervalMillis() {
        return tickIntervalMillis;
    }

    public double getInitialPrice() {
        return initialPrice;
    }

    /**
     * Seed for the participants' RNG. Zero means seed from the clock.
     */
    public long getRandomSeed() {
        return randomSeed;
    }

    public long getRunDurationSeconds() {
        return runDurationSeconds;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    public int getSummaryDepth() {
        return summaryDepth;
    }

    /**
     * Port for the Prometheus scrape endpoint. Zero disables the exporter.
     */
    public int getMetricsPort() {
        return metricsPort;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public Optional<Path> getSeedFile() {
        return Optional.ofNullable(seedFile);
    }

    public boolean isDetailedLogging() {
        return detailedLogging;
    }

    @Override
    public String toString() {
        return "SimulationConfig{" +
                "tickIntervalMillis=" + tickIntervalMillis +
                ", initialPrice=" + initialPrice +
                ", randomSeed=" + randomSeed +
                ", runDurationSeconds=" + runDurationSeconds +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                ", summaryDepth=" + summaryDepth +
                ", metricsPort=" + metricsPort +
                ", ringBufferSize=" + ringBufferSize +
                ", seedFile=" + seedFile +
                ", detailedLogging=" + detailedLogging +
                '}';
    }
}
