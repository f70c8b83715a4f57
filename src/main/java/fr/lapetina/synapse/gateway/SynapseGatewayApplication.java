package fr.lapetina.synapse.gateway;

import fr.lapetina.synapse.gateway.api.GatewayHttpServer;
import fr.lapetina.synapse.gateway.infrastructure.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for Synapse Gateway.
 */
public class SynapseGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SynapseGatewayApplication.class);

    private final GatewayFactory factory;
    private final GatewayHttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public SynapseGatewayApplication(GatewayFactory factory) throws Exception {
        this.factory = factory;
        this.httpServer = new GatewayHttpServer(factory);
    }

    public SynapseGatewayApplication(String configPath) throws Exception {
        this(GatewayFactory.create(configPath).start());
        log.info("Synapse Gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Synapse Gateway started: port={}", httpServer.getPort());
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Synapse Gateway...");

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

        log.info("Synapse Gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = ConfigLoader.resolveConfigPath(args, System.getenv());

        try {
            SynapseGatewayApplication app = new SynapseGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Synapse Gateway", e);
            System.exit(1);
        }
    }
}
