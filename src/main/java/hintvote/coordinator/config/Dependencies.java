package hintvote.coordinator.config;

import hintvote.coordinator.api.v1.HealthController;
import hintvote.coordinator.api.v1.SessionController;
import hintvote.coordinator.api.v1.SessionHintController;
import hintvote.coordinator.api.v1.ThreadController;
import hintvote.coordinator.effector.Effector;
import hintvote.coordinator.effector.LoggingEffector;
import hintvote.coordinator.registry.SessionRegistry;
import hintvote.coordinator.scheduler.DeadlineScheduler;
import hintvote.coordinator.server.RouterHandler;
import hintvote.coordinator.service.HintSessionService;
import hintvote.coordinator.service.SessionOrchestrator;
import hintvote.coordinator.telemetry.LoggingTelemetrySink;
import hintvote.coordinator.telemetry.TelemetrySink;
import hintvote.coordinator.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start expiry workers
 * HintSessionService sessions = deps.sessionService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final MonotonicClock clock;
    private final Effector effector;
    private final TelemetrySink telemetry;
    private final SessionRegistry registry;
    private final DeadlineScheduler scheduler;
    private final SessionOrchestrator orchestrator;
    private final HintSessionService sessionService;

    // Controllers
    private final HealthController healthController;
    private final SessionController sessionController;
    private final SessionHintController sessionHintController;
    private final ThreadController threadController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, Effector effector, TelemetrySink telemetry, MonotonicClock clock) {
        this.config = config;
        this.clock = clock;
        this.effector = effector;
        this.telemetry = telemetry;

        log.info("Initializing dependencies with config: {}", config);

        // Core
        this.registry = new SessionRegistry();
        this.scheduler = new DeadlineScheduler(config.schedulerThreads(), "hintvote-expiry", clock);
        this.orchestrator = new SessionOrchestrator(registry, scheduler, effector, telemetry, clock, config);

        // Services
        this.sessionService = new HintSessionService(orchestrator, config.controlProfile(), telemetry);

        // Controllers (public API)
        this.healthController = new HealthController(sessionService, registry, scheduler);
        this.sessionController = new SessionController(sessionService);
        this.sessionHintController = new SessionHintController(sessionService);
        this.threadController = new ThreadController(orchestrator);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the logging effector.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new LoggingEffector(), new LoggingTelemetrySink(), MonotonicClock.SYSTEM);
    }

    /**
     * Create dependencies with a caller-supplied effector, e.g. a platform binding or a test double.
     */
    public static Dependencies create(CoordinatorConfig config, Effector effector) {
        return new Dependencies(config, effector, new LoggingTelemetrySink(), MonotonicClock.SYSTEM);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public Effector effector() {
        return effector;
    }

    public TelemetrySink telemetry() {
        return telemetry;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public DeadlineScheduler scheduler() {
        return scheduler;
    }

    public SessionOrchestrator orchestrator() {
        return orchestrator;
    }

    public HintSessionService sessionService() {
        return sessionService;
    }

    // Controller getters
    public HealthController healthController() {
        return healthController;
    }

    public SessionController sessionController() {
        return sessionController;
    }

    public SessionHintController sessionHintController() {
        return sessionHintController;
    }

    public ThreadController threadController() {
        return threadController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(sessionHintController)
                    .registerController(sessionController)
                    .registerController(threadController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Start the vote-expiry workers. Should be called before serving requests.
     */
    public void startScheduler() {
        if (!scheduler.isRunning()) {
            scheduler.start();
        }
    }

    /**
     * Stop the vote-expiry workers.
     */
    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Release every session's constraint while the effector is still reachable
        try {
            sessionService.closeAll();
        } catch (Exception e) {
            log.warn("Error closing sessions: {}", e.getMessage());
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator: {}", e.getMessage());
        }

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
