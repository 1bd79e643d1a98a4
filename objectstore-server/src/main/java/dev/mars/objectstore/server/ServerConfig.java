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

import dev.mars.objectstore.config.PropertyResolver;
import dev.mars.objectstore.storage.ObjectStoreConfig;

import java.nio.file.Path;

/**
 * Configuration for the HTTP server process.
 * <p>
 * Values are resolved like {@link ObjectStoreConfig}: builder (command line)
 * values first, then system properties, environment variables, the properties
 * file and finally the defaults. {@code --config <file>} replaces the default
 * {@code objectstore.properties} lookup for both the server and the storage
 * settings.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>CLI</th><th>Default</th></tr>
 *   <tr><td>listenAddress</td><td>objectstore.listenAddress</td><td>OBJSTORE_LISTEN_ADDRESS</td>
 *       <td>-l, --listen-address</td><td>0.0.0.0:8080</td></tr>
 *   <tr><td>maxObjectSizeMb</td><td>objectstore.maxObjectSizeMb</td><td>OBJSTORE_MAX_OBJECT_SIZE_MB</td>
 *       <td></td><td>10</td></tr>
 *   <tr><td>verbose</td><td>objectstore.verbose</td><td>OBJSTORE_VERBOSE</td><td>-v, --verbose</td><td>false</td></tr>
 *   <tr><td>persist</td><td colspan="3">see {@link ObjectStoreConfig}</td><td>-p, --persist</td></tr>
 *   <tr><td>dataDir</td><td colspan="3">see {@link ObjectStoreConfig}</td><td>--data-path</td></tr>
 * </table>
 */
public final class ServerConfig {

    private static final String PROP_LISTEN_ADDRESS = "objectstore.listenAddress";
    private static final String PROP_MAX_OBJECT_SIZE_MB = "objectstore.maxObjectSizeMb";
    private static final String PROP_VERBOSE = "objectstore.verbose";

    private static final String ENV_LISTEN_ADDRESS = "OBJSTORE_LISTEN_ADDRESS";
    private static final String ENV_MAX_OBJECT_SIZE_MB = "OBJSTORE_MAX_OBJECT_SIZE_MB";
    private static final String ENV_VERBOSE = "OBJSTORE_VERBOSE";

    static final String DEFAULT_HOST = "0.0.0.0";
    static final int DEFAULT_PORT = 8080;
    private static final int DEFAULT_MAX_OBJECT_SIZE_MB = 10;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: objectstore-server [options]",
            "  -c, --config <file>            properties file to read instead of objectstore.properties",
            "  -l, --listen-address <addr>    <port>, <host>:<port>, :<port> or <host>: (default 0.0.0.0:8080)",
            "  -p, --persist                  store objects on disk instead of in memory",
            "      --data-path <dir>          directory holding the bucket files (default ~/.objectstore/data)",
            "  -v, --verbose                  log at DEBUG level");

    private final ListenAddress listenAddress;
    private final int maxObjectSizeMb;
    private final boolean verbose;
    private final ObjectStoreConfig storage;

    private ServerConfig(ListenAddress listenAddress, int maxObjectSizeMb, boolean verbose,
                         ObjectStoreConfig storage) {
        this.listenAddress = listenAddress;
        this.maxObjectSizeMb = maxObjectSizeMb;
        this.verbose = verbose;
        this.storage = storage;
    }

    public ListenAddress listenAddress() {
        return listenAddress;
    }

    public int maxObjectSizeMb() {
        return maxObjectSizeMb;
    }

    public long maxObjectSizeBytes() {
        return (long) maxObjectSizeMb * 1024 * 1024;
    }

    public boolean verbose() {
        return verbose;
    }

    /** Storage settings for {@link dev.mars.objectstore.storage.ObjectStores#open}. */
    public ObjectStoreConfig storage() {
        return storage;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "listenAddress=" + listenAddress +
                ", maxObjectSizeMb=" + maxObjectSizeMb +
                ", verbose=" + verbose +
                ", storage=" + storage +
                '}';
    }

    // ========================================================================
    // Command line
    // ========================================================================

    /**
     * Builds a configuration from command line arguments. Options accept their
     * value either as the next argument or after {@code =}.
     *
     * @throws IllegalArgumentException on an unknown option, a missing value or an invalid address
     */
    public static ServerConfig fromArgs(String... args) {
        String configFile = null;
        String listenAddress = null;
        String dataPath = null;
        boolean persist = false;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inlineValue = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            switch (arg) {
                case "-v", "--verbose" -> verbose = true;
                case "-p", "--persist" -> persist = true;
                case "-c", "--config" -> {
                    configFile = inlineValue != null ? inlineValue : valueOf(args, ++i, arg);
                }
                case "-l", "--listen-address" -> {
                    listenAddress = inlineValue != null ? inlineValue : valueOf(args, ++i, arg);
                }
                case "--data-path" -> {
                    dataPath = inlineValue != null ? inlineValue : valueOf(args, ++i, arg);
                }
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        PropertyResolver resolver = configFile != null
                ? PropertyResolver.load(Path.of(configFile))
                : PropertyResolver.load();

        ObjectStoreConfig.Builder storage = ObjectStoreConfig.builder(resolver);
        if (persist) {
            storage.persist(true);
        }
        if (dataPath != null) {
            storage.dataDir(dataPath);
        }

        Builder builder = builder(resolver).storage(storage.build());
        if (listenAddress != null) {
            builder.listenAddress(listenAddress);
        }
        if (verbose) {
            builder.verbose(true);
        }
        return builder.build();
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Missing value for option " + option);
        }
        return args[index];
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static Builder builder() {
        return new Builder(PropertyResolver.load());
    }

    public static Builder builder(PropertyResolver resolver) {
        return new Builder(resolver);
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static final class Builder {

        private final PropertyResolver resolver;
        private String listenAddress;
        private Integer maxObjectSizeMb;
        private Boolean verbose;
        private ObjectStoreConfig storage;

        private Builder(PropertyResolver resolver) {
            this.resolver = resolver;
        }

        public Builder listenAddress(String listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder maxObjectSizeMb(int maxObjectSizeMb) {
            this.maxObjectSizeMb = maxObjectSizeMb;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder storage(ObjectStoreConfig storage) {
            this.storage = storage;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the listen address is invalid or the size limit is not positive
         */
        public ServerConfig build() {
            String address = listenAddress != null ? listenAddress
                    : resolver.resolveString(PROP_LISTEN_ADDRESS, ENV_LISTEN_ADDRESS,
                    DEFAULT_HOST + ":" + DEFAULT_PORT);
            int maxSize = maxObjectSizeMb != null ? maxObjectSizeMb
                    : resolver.resolveInt(PROP_MAX_OBJECT_SIZE_MB, ENV_MAX_OBJECT_SIZE_MB, DEFAULT_MAX_OBJECT_SIZE_MB);
            boolean verb = verbose != null ? verbose
                    : resolver.resolveBoolean(PROP_VERBOSE, ENV_VERBOSE, false);
            ObjectStoreConfig storageConfig = storage != null ? storage
                    : ObjectStoreConfig.builder(resolver).build();

            if (maxSize < 1) {
                throw new IllegalArgumentException("maxObjectSizeMb must be positive, got " + maxSize);
            }
            return new ServerConfig(ListenAddress.parse(address), maxSize, verb, storageConfig);
        }
    }

    // ========================================================================
    // Listen address
    // ========================================================================

    /**
     * Host and port the server binds to.
     *
     * @param host interface address, {@code 0.0.0.0} for all interfaces
     * @param port TCP port, {@code 0} for an ephemeral port
     */
    public record ListenAddress(String host, int port) {

        /**
         * Parses {@code <port>}, {@code <host>:<port>}, {@code :<port>} or
         * {@code <host>:}. A missing or {@code *} host means all interfaces and a
         * missing port means 8080.
         */
        public static ListenAddress parse(String value) {
            String trimmed = value == null ? "" : value.trim();
            String host;
            String port;
            int colon = trimmed.lastIndexOf(':');
            if (colon >= 0) {
                host = trimmed.substring(0, colon);
                port = trimmed.substring(colon + 1);
            } else if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                host = "";
                port = trimmed;
            } else {
                host = trimmed;
                port = "";
            }

            if (host.isEmpty() || host.equals("*")) {
                host = DEFAULT_HOST;
            }
            return new ListenAddress(host, port.isEmpty() ? DEFAULT_PORT : parsePort(port, value));
        }

        private static int parsePort(String port, String value) {
            int parsed;
            try {
                parsed = Integer.parseInt(port);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid listen address '" + value + "': bad port", e);
            }
            if (parsed < 0 || parsed > 65535) {
                throw new IllegalArgumentException("Invalid listen address '" + value + "': port out of range");
            }
            return parsed;
        }

        @Override
        public String toString() {
            return host + ":" + port;
        }
    }
}
