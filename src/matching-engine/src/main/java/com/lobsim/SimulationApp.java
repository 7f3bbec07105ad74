package com.lobsim;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.lobsim.domain.OrderRequest;
import com.lobsim.logging.MatchingStats;
import com.lobsim.logging.PeriodicStatsLogger;
import com.lobsim.matching.MatchingEngine;
import com.lobsim.metrics.MetricsRegistry;
import com.lobsim.participants.DefaultParticipants;
import com.lobsim.participants.MarketParticipant;
import com.lobsim.simulation.EngineCommand;
import com.lobsim.simulation.EngineCommandFactory;
import com.lobsim.simulation.EngineCommandHandler;
import com.lobsim.simulation.EngineCommandTranslator;
import com.lobsim.simulation.FillRouter;
import com.lobsim.simulation.RecordingVenue;
import com.lobsim.simulation.SeedOrderLoader;
import com.lobsim.simulation.SimulationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Main entry point for the order book simulation.
 *
 * Startup sequence:
 * 1. Parse SimulationConfig from environment variables
 * 2. Initialize MetricsRegistry (+ Prometheus HTTP server when a port is set)
 * 3. Build the MatchingEngine and the participant roster
 * 4. Wire fills to participants and wrap the engine in a RecordingVenue
 * 5. Create the LMAX Disruptor with a single EngineCommandHandler and start it
 * 6. Publish seed orders, if a seed file is configured
 * 7. Schedule a TICK command every tick interval
 * 8. Start the periodic stats logger
 * 9. Register JVM shutdown hook, then run until stopped or the run duration elapses
 */
public class SimulationApp {

    private static final Logger logger = LoggerFactory.getLogger(SimulationApp.class);

    public static void main(String[] args) throws InterruptedException {
        logger.info("Starting order book simulation...");

        // 1. Parse configuration from environment variables
        SimulationConfig config = SimulationConfig.fromEnv();
        logger.info("Configuration: {}", config);

        // 2. Initialize MetricsRegistry and optionally the Prometheus HTTP server
        MetricsRegistry metrics = new MetricsRegistry();
        if (config.getMetricsPort() > 0) {
            try {
                metrics.startHttpServer(config.getMetricsPort());
                logger.info("Prometheus metrics HTTP server started on port {}",
                        config.getMetricsPort());
            } catch (IOException e) {
                logger.error("Failed to start Prometheus HTTP server on port {}: {}",
                        config.getMetricsPort(), e.getMessage());
                System.exit(1);
            }
        }

        // 3. Engine and participants
        Clock clock = Clock.systemUTC();
        Random random = config.getRandomSeed() != 0
                ? new Random(config.getRandomSeed())
                : new Random();
        MatchingEngine engine = new MatchingEngine(config.getInitialPrice(), clock);
        List<MarketParticipant> participants = DefaultParticipants.create(random, clock);

        // 4. Fill notification and instrumentation
        engine.addFillListener(new FillRouter(participants));
        MatchingStats stats = new MatchingStats();
        RecordingVenue venue = new RecordingVenue(engine, stats, metrics, config.isDetailedLogging());

        // 5. Create and start the Disruptor
        EngineCommandHandler handler = new EngineCommandHandler(
                engine, venue, participants, stats, metrics, config.getSummaryDepth());
        Disruptor<EngineCommand> disruptor = new Disruptor<>(
                new EngineCommandFactory(),
                config.getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.handleEventsWith(handler);
        disruptor.start();
        RingBuffer<EngineCommand> ringBuffer = disruptor.getRingBuffer();
        logger.info("Disruptor started. Ring buffer size: {}", config.getRingBufferSize());

        // 6. Seed orders
        if (config.getSeedFile().isPresent()) {
            Path seedFile = config.getSeedFile().get();
            try {
                List<OrderRequest> seedOrders = SeedOrderLoader.load(seedFile);
                for (OrderRequest request : seedOrders) {
                    EngineCommandTranslator.publishSubmit(ringBuffer, request);
                }
                logger.info("Seeded {} orders from {}", seedOrders.size(), seedFile);
            } catch (IOException | IllegalArgumentException e) {
                logger.error("Failed to load seed orders from {}: {}", seedFile, e.getMessage());
                System.exit(1);
            }
        }

        // 7. Tick scheduler
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "simulation-ticker");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(() -> EngineCommandTranslator.publishTick(ringBuffer),
                config.getTickIntervalMillis(), config.getTickIntervalMillis(), TimeUnit.MILLISECONDS);

        // 8. Periodic stats logger
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                stats, handler::getSnapshot, config.getStatsIntervalSeconds());
        statsLogger.start();

        // 9. Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down simulation...");
            ticker.shutdownNow();
            try {
                disruptor.shutdown();
                logger.info("Disruptor shut down.");
            } catch (Exception e) {
                logger.warn("Error shutting down Disruptor: {}", e.getMessage());
            }

            statsLogger.logShutdownSummary();
            statsLogger.stop();

            metrics.close();
            logger.info("Simulation shut down complete.");
        }));

        logger.info("Simulation running",
                keyValue("event", "SIMULATION_STARTED"),
                keyValue("participants", participants.size()),
                keyValue("tickIntervalMs", config.getTickIntervalMillis()),
                keyValue("initialPrice", config.getInitialPrice()));

        CountDownLatch forever = new CountDownLatch(1);
        if (config.getRunDurationSeconds() > 0) {
            forever.await(config.getRunDurationSeconds(), TimeUnit.SECONDS);
            logger.info("Run duration of {}s elapsed", config.getRunDurationSeconds());
            System.exit(0);
        } else {
            forever.await();
        }
    }
}
