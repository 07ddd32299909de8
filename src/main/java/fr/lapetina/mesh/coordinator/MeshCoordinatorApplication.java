package fr.lapetina.mesh.coordinator;

import fr.lapetina.mesh.coordinator.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the mesh coordinator.
 */
public class MeshCoordinatorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshCoordinatorApplication.class);

    private final CoordinatorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public MeshCoordinatorApplication(String configPath) throws Exception {
        log.info("Starting mesh coordinator...");

        this.factory = CoordinatorFactory.create(configPath).start();
        this.httpServer = new HttpServer(factory);

        log.info("Mesh coordinator initialized: nodeId={}", factory.getConfig().getIdentity().getNodeId());
    }

    public void start() {
        httpServer.start();
        log.info("Mesh coordinator started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public CoordinatorFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down mesh coordinator...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Mesh coordinator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            MeshCoordinatorApplication app = new MeshCoordinatorApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start mesh coordinator", e);
            System.exit(1);
        }
    }
}
