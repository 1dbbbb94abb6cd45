// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.blockscope.core.error.ConfigException;

/**
 * Loads and validates {@link BlockscopeConfig} from YAML.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_CONFIG = "BLOCKSCOPE_CONFIG";
    public static final String DEFAULT_FILE = "config.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private ConfigLoader() {
    }

    /**
     * Picks the config file: first command-line argument, then {@value #ENV_CONFIG},
     * then {@value #DEFAULT_FILE} in the working directory.
     */
    public static Path resolvePath(final String[] args, final Map<String, String> env) {
        if (args != null && args.length > 0 && !args[0].isBlank()) {
            return Path.of(args[0]);
        }
        final String fromEnv = env.get(ENV_CONFIG);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv);
        }
        return Path.of(DEFAULT_FILE);
    }

    public static BlockscopeConfig load(final Path path) throws ConfigException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path.toAbsolutePath());
        }
        log.info("Loading configuration from {}", path.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Unable to read config file " + path, e);
        }
    }

    public static BlockscopeConfig parse(final String yaml) throws ConfigException {
        try (Reader reader = new StringReader(yaml)) {
            return read(reader, "<inline>");
        } catch (IOException e) {
            throw new ConfigException("Unable to read configuration", e);
        }
    }

    private static BlockscopeConfig read(final Reader reader, final String source) throws IOException {
        final BlockscopeConfig config;
        try {
            config = YAML.readValue(reader, BlockscopeConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Configuration " + source + " is empty");
        }
        return validate(config);
    }

    static BlockscopeConfig validate(final BlockscopeConfig config) throws ConfigException {
        final BlockscopeConfig.Rpc rpc = config.rpc();
        if (rpc == null) {
            throw new ConfigException("Missing required section: rpc");
        }
        require(rpc.url(), "rpc.url");
        httpUrl(rpc.url(), "rpc.url");
        require(rpc.user(), "rpc.user");
        require(rpc.pass(), "rpc.pass");
        positive(rpc.connectTimeoutMillis(), "rpc.connectTimeoutMillis");
        positive(rpc.readTimeoutMillis(), "rpc.readTimeoutMillis");

        final BlockscopeConfig.Server server = config.server();
        if (server == null) {
            throw new ConfigException("Missing required section: server");
        }
        require(server.host(), "server.host");
        if (server.port() == null) {
            throw new ConfigException("Missing required key: server.port");
        }
        if (server.port() < 1 || server.port() > 65535) {
            throw new ConfigException("server.port must be in 1..65535, got " + server.port());
        }

        if (config.parallelism() < 1) {
            throw new ConfigException("aggregator.parallelism must be at least 1, got " + config.parallelism());
        }
        return config;
    }

    private static void require(final String value, final String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Missing required key: " + key);
        }
    }

    private static void httpUrl(final String value, final String key) {
        final URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(key + " is not a valid URL: " + e.getMessage(), e);
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigException(key + " must be an http or https URL");
        }
        if (uri.getHost() == null) {
            throw new ConfigException(key + " has no host");
        }
    }

    private static void positive(final Long value, final String key) {
        if (value != null && value <= 0) {
            throw new ConfigException(key + " must be positive, got " + value);
        }
    }
}
