package hintvote;

import hintvote.coordinator.config.CoordinatorConfig;
import hintvote.coordinator.config.Dependencies;
import hintvote.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Starts the expiry workers before the HTTP server so votes cast by the
 * first requests can time out.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        deps.startScheduler();

        CoordinatorNettyServer server = new CoordinatorNettyServer(config, deps.routerHandler());
        if (!server.start()) {
            log.error("Coordinator server did not start, exiting");
            deps.close();
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping server...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "hintvote-shutdown"));

        shutdown.await();
    }
}
