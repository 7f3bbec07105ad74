package com.lobsim.simulation;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        SimulationConfig config = SimulationConfig.from(Map.of());

        assertEquals(1000, config.getTickIntervalMillis());
        assertEquals(100.0, config.getInitialPrice());
        assertEquals(0, config.getRandomSeed());
        assertEquals(0, config.getRunDurationSeconds());
        assertEquals(10, config.getStatsIntervalSeconds());
        assertEquals(5, config.getSummaryDepth());
        assertEquals(0, config.getMetricsPort());
        assertEquals(1024, config.getRingBufferSize());
        assertTrue(config.getSeedFile().isEmpty());
        assertFalse(config.isDetailedLogging());
    }

    @Test
    void readsOverrides() {
        SimulationConfig config = SimulationConfig.from(Map.of(
                "TICK_INTERVAL_MS", "250",
                "INITIAL_PRICE", "42.5",
                "RANDOM_SEED", "1234",
                "RUN_DURATION_SECONDS", " 60 ",
                "SUMMARY_DEPTH", "3",
                "METRICS_PORT", "9464",
                "RING_BUFFER_SIZE", "4096",
                "SEED_FILE", "/tmp/seed.json",
                "ENABLE_DETAILED_LOGGING", "true"));

        assertEquals(250, config.getTickIntervalMillis());
        assertEquals(42.5, config.getInitialPrice());
        assertEquals(1234, config.getRandomSeed());
        assertEquals(60, config.getRunDurationSeconds());
        assertEquals(3, config.getSummaryDepth());
        assertEquals(9464, config.getMetricsPort());
        assertEquals(4096, config.getRingBufferSize());
        assertEquals(Paths.get("/tmp/seed.json"), config.getSeedFile().get());
        assertTrue(config.isDetailedLogging());
    }

    @Test
    void malformedOrOutOfRangeValuesFallBack() {
        SimulationConfig config = SimulationConfig.from(Map.of(
                "TICK_INTERVAL_MS", "-5",
                "INITIAL_PRICE", "abc",
                "STATS_INTERVAL_SECONDS", "0",
                "RING_BUFFER_SIZE", "1000",
                "METRICS_PORT", "http",
                "SEED_FILE", ""));

        assertEquals(1000, config.getTickIntervalMillis());
        assertEquals(100.0, config.getInitialPrice());
        assertEquals(10, config.getStatsIntervalSeconds());
        assertEquals(1024, config.getRingBufferSize());
        assertEquals(0, config.getMetricsPort());
        assertTrue(config.getSeedFile().isEmpty());
    }

    @Test
    void nonPositiveInitialPriceFallsBack() {
        assertEquals(100.0, SimulationConfig.from(Map.of("INITIAL_PRICE", "0")).getInitialPrice());
        assertEquals(100.0, SimulationConfig.from(Map.of("INITIAL_PRICE", "NaN")).getInitialPrice());
    }
}
