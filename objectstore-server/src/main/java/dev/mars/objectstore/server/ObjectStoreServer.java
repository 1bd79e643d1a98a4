/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.objectstore.server;

import ch.qos.logback.classic.Level;
import dev.mars.objectstore.server.http.AccessLogHandler;
import dev.mars.objectstore.server.http.ExceptionHandler;
import dev.mars.objectstore.server.http.ObjectHandler;
import dev.mars.objectstore.storage.ObjectStore;
import dev.mars.objectstore.storage.ObjectStores;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * HTTP front end of the object store.
 * <p>
 * Objects are served below {@value #CONTEXT_PATH}:
 * <pre>
 * PUT    /objects/{bucketId}/{objectId}   (Content-Type: text/plain)
 * GET    /objects/{bucketId}/{objectId}
 * DELETE /objects/{bucketId}/{objectId}
 * </pre>
 * The handler chain is {@code AccessLogHandler -> ExceptionHandler -> ContextHandler -> ObjectHandler}.
 */
public final class ObjectStoreServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectStoreServer.class);

    /** Request log, routed separately from the server's own messages. */
    private static final Logger ACCESS_LOG = LoggerFactory.getLogger("dev.mars.objectstore.access");

    public static final String CONTEXT_PATH = "/objects";

    private final ServerConfig config;
    private final ObjectStore store;
    private final Server server;
    private final ServerConnector connector;

    public ObjectStoreServer(ServerConfig config, ObjectStore store) {
        this.config = config;
        this.store = store;
        this.server = new Server();
        this.connector = new ServerConnector(server);
        connector.setHost(config.listenAddress().host());
        connector.setPort(config.listenAddress().port());
        server.addConnector(connector);
        server.setHandler(createHandler(store, config.maxObjectSizeBytes(), ACCESS_LOG));
    }

    /**
     * Builds the request handler chain for a store.
     *
     * @param store         backend serving the requests
     * @param maxObjectSize largest accepted object in bytes
     * @param accessLog     logger receiving one line per request
     */
    public static Handler createHandler(ObjectStore store, long maxObjectSize, Logger accessLog) {
        ContextHandler objects = new ContextHandler(new ObjectHandler(store, maxObjectSize), CONTEXT_PATH);
        return new AccessLogHandler(accessLog, new ExceptionHandler(objects));
    }

    public void start() throws Exception {
        server.start();
        LOG.info("Webserver listening at {}:{} (max object size {} MB)",
                config.listenAddress().host(), connector.getLocalPort(), config.maxObjectSizeMb());
    }

    /** Port actually bound, which differs from the configured one when that was 0. */
    public int localPort() {
        return connector.getLocalPort();
    }

    public void join() throws InterruptedException {
        server.join();
    }

    /**
     * Stops accepting requests, then closes the store.
     */
    @Override
    public void close() {
        try {
            server.stop();
            LOG.info("Webserver stopped");
        } catch (Exception e) {
            LOG.error("Error stopping webserver: {}", e.getMessage(), e);
        } finally {
            store.close();
        }
    }

    // ========================================================================
    // Entry point
    // ========================================================================

    public static void main(String[] args) throws Exception {
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerConfig.USAGE);
            System.exit(2);
            return;
        }

        if (config.verbose()) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
        LOG.debug("Configuration: {}", config);

        if (config.storage().persist()) {
            try {
                Files.createDirectories(config.storage().dataDir());
            } catch (IOException e) {
                LOG.error("Cannot create data directory {}: {}", config.storage().dataDir(), e.getMessage(), e);
                System.exit(1);
                return;
            }
        }

        ObjectStore store = ObjectStores.open(config.storage());
        ObjectStoreServer server = new ObjectStoreServer(config, store);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "objectstore-shutdown"));
        server.start();
        server.join();
    }
}
