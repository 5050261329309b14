package com.selfmx.main;

import com.selfmx.config.server.ServerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Master configuration initializer and container.
 *
 * <p>ServerConfig holds every gateway setting: listener, database, AWS, Cloudflare,
 * verification timing, rate limits, retention and admin login.
 *
 * @see ServerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Server configuration file name.
     */
    public static final String SERVER_FILE = "server.json5";

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets server config.
     *
     * @return ServerConfig.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Init server config from a configuration directory.
     *
     * @param dir Configuration directory.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String dir) throws IOException {
        String path = Paths.get(dir, SERVER_FILE).toString();
        server = new ServerConfig(path);
        log.info("Loaded server configuration: {}", path);
    }

    /**
     * Replaces server config, used by tests and embedded setups.
     *
     * @param config ServerConfig instance.
     */
    public static void setServer(ServerConfig config) {
        server = config;
    }
}
