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
package dev.mars.objectstore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Resolves configuration values from the layered sources shared by every
 * configuration class in the project.
 * <p>
 * Priority (highest first):
 * <ol>
 *   <li>System properties (e.g., {@code -Dobjectstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code OBJSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code objectstore.properties} on classpath or in working directory,
 *       or an explicitly named file)</li>
 *   <li>Default values</li>
 * </ol>
 * Programmatic values set on a builder win over all of these; builders only
 * consult the resolver for values left unset.
 */
public final class PropertyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyResolver.class);

    /** Default properties file name. */
    public static final String PROPERTIES_FILE = "objectstore.properties";

    private final Properties fileProperties;

    private PropertyResolver(Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    /**
     * Creates a resolver backed by {@code objectstore.properties} from the
     * classpath, falling back to the working directory.
     */
    public static PropertyResolver load() {
        return new PropertyResolver(loadDefaultPropertiesFile());
    }

    /**
     * Creates a resolver backed by the given properties file.
     * A missing file is treated as empty.
     *
     * @param file the properties file to read
     */
    public static PropertyResolver load(Path file) {
        Properties props = new Properties();
        if (file != null && Files.isRegularFile(file)) {
            try (InputStream is = Files.newInputStream(file)) {
                props.load(is);
                LOG.debug("Loaded configuration file: {}", file);
            } catch (IOException e) {
                LOG.warn("Could not read configuration file {}: {}", file, e.getMessage());
            }
        } else {
            LOG.debug("No configuration file found at {}", file);
        }
        return new PropertyResolver(props);
    }

    /** Creates a resolver backed by the given properties, used in tests. */
    public static PropertyResolver of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new PropertyResolver(copy);
    }

    public String resolveString(String sysProp, String envVar, String defaultValue) {
        // 1. System property
        String value = System.getProperty(sysProp);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        // 2. Environment variable
        value = System.getenv(envVar);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        // 3. Properties file
        value = fileProperties.getProperty(sysProp);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        // 4. Default
        return defaultValue;
    }

    public Path resolvePath(String sysProp, String envVar, Path defaultValue) {
        String value = resolveString(sysProp, envVar, null);
        return value != null ? Path.of(value) : defaultValue;
    }

    public boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
        String value = resolveString(sysProp, envVar, null);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    /**
     * Resolves an integer; a malformed value at any layer is skipped
     * so that the next layer (and ultimately the default) applies.
     */
    public int resolveInt(String sysProp, String envVar, int defaultValue) {
        Integer parsed = parseInt(System.getProperty(sysProp));
        if (parsed != null) {
            return parsed;
        }
        parsed = parseInt(System.getenv(envVar));
        if (parsed != null) {
            return parsed;
        }
        parsed = parseInt(fileProperties.getProperty(sysProp));
        if (parsed != null) {
            return parsed;
        }
        return defaultValue;
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed integer configuration value '{}'", value);
            return null;
        }
    }

    private static Properties loadDefaultPropertiesFile() {
        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = PropertyResolver.class.getClassLoader()
                .getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
                return props;
            }
        } catch (IOException e) {
            LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
        }

        // Try working directory
        Path localFile = Path.of(PROPERTIES_FILE);
        if (Files.exists(localFile)) {
            try (InputStream is = Files.newInputStream(localFile)) {
                props.load(is);
            } catch (IOException e) {
                LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
            }
        }

        return props;
    }
}
