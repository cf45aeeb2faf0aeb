package fr.lapetina.dispatch.infrastructure.config;

import fr.lapetina.dispatch.domain.model.Deployment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link DispatchConfig} from YAML and follows changes to the file.
 *
 * <p>The path is looked up on the file system first, then on the classpath.
 * Every document is checked section by section before it is published, so a
 * listener only ever sees a configuration the runtime can build. Sections
 * left empty in the document fall back to their defaults.</p>
 *
 * <p>Only a file-system configuration is watched. A reload that fails keeps
 * the configuration currently in effect.</p>
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final AtomicReference<DispatchConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile FileStamp loadedStamp;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
    }

    /**
     * Reads, checks and publishes the configuration.
     *
     * @throws ConfigurationException if the document is missing, malformed or invalid
     */
    public DispatchConfig load() {
        DispatchConfig config = read();
        DispatchConfig previous = currentConfig.getAndSet(config);
        log.info("Configuration loaded: deployments={}, strategy={}, rateLimit={}, pool={}",
                config.getDeployments().size(), config.getRouter().getStrategy(),
                config.getRateLimit().isEnabled(), config.getPool().isEnabled());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config change listener failed: listener={}", listener, e);
            }
        }
        return config;
    }

    /**
     * Loads again, keeping the current configuration if the new one is rejected.
     */
    public DispatchConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration rejected, keeping current: path={}", configPath, e);
            return currentConfig.get();
        }
    }

    /**
     * Parses and checks a YAML document without publishing it.
     *
     * @throws ConfigurationException if the document is malformed or invalid
     */
    public static DispatchConfig parse(String document) {
        return parse(new StringReader(document), "inline document");
    }

    public DispatchConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Reloads whenever the configuration file is rewritten. No-op for a
     * classpath configuration.
     */
    public void startWatching() {
        if (!Files.isRegularFile(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }
        Path directory = configPath.toAbsolutePath().getParent();
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Failed to start config watcher: directory={}", directory, e);
            return;
        }

        watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        watchExecutor.scheduleWithFixedDelay(this::pollChanges, 1, 1, TimeUnit.SECONDS);
        log.info("Configuration hot-reload enabled for: {}", configPath);
    }

    private void pollChanges() {
        WatchKey key = watchService.poll();
        if (key == null) {
            return;
        }
        boolean touched = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (configPath.getFileName().equals(event.context())) {
                touched = true;
            }
        }
        key.reset();

        if (!touched) {
            return;
        }
        try {
            // Editors often emit several events for one save
            if (FileStamp.of(configPath).isNewerThan(loadedStamp)) {
                log.info("Configuration file changed, reloading: {}", configPath);
                reload();
            }
        } catch (ConfigurationException e) {
            log.warn("Configuration file unreadable, keeping current: {}", e.getMessage());
        }
    }

    private DispatchConfig read() {
        if (Files.isRegularFile(configPath)) {
            FileStamp stamp = FileStamp.of(configPath);
            DispatchConfig config = readFile();
            loadedStamp = stamp;
            return config;
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new ConfigurationException("Configuration file not found on disk or classpath: " + configPath);
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            log.info("Loading configuration from classpath: {}", resource);
            return parse(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    private DispatchConfig readFile() {
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            log.info("Loading configuration from file: {}", configPath);
            return parse(reader, configPath.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + configPath, e);
        }
    }

    private static DispatchConfig parse(Reader reader, String source) {
        DispatchConfig config;
        try {
            config = new Yaml(new Constructor(DispatchConfig.class, new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            // Empty document
            config = new DispatchConfig();
        }
        fillEmptySections(config);
        validate(config, source);
        return config;
    }

    private static void fillEmptySections(DispatchConfig config) {
        if (config.getRouter() == null) {
            config.setRouter(new DispatchConfig.RouterSection());
        }
        if (config.getRetry() == null) {
            config.setRetry(new DispatchConfig.RetryConfig());
        }
        if (config.getDeployments() == null) {
            config.setDeployments(new ArrayList<>());
        }
        if (config.getRateLimit() == null) {
            config.setRateLimit(new DispatchConfig.RateLimitConfig());
        }
        if (config.getPool() == null) {
            config.setPool(new DispatchConfig.PoolSection());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new DispatchConfig.MetricsConfig());
        }
    }

    /**
     * Maps each section the way the runtime will, turning the first rejected
     * value into a {@link ConfigurationException} naming its section.
     */
    private static void validate(DispatchConfig config, String source) {
        check(source, "router", () -> ConfigMapper.toRouterConfig(config.getRouter()));
        check(source, "retry", () -> ConfigMapper.toBackoff(config.getRetry()));
        if (config.getRateLimit().isEnabled()) {
            check(source, "rateLimit", () -> ConfigMapper.toRateLimitPolicy(config.getRateLimit()));
        }
        if (config.getPool().isEnabled()) {
            check(source, "pool", () -> ConfigMapper.toPoolConfig(config.getPool()));
        }
        check(source, "deployments", () -> {
            Set<String> ids = new HashSet<>();
            for (Deployment deployment : ConfigMapper.toDeployments(config.getDeployments())) {
                if (!ids.add(deployment.getId())) {
                    throw new IllegalArgumentException("Duplicate deployment id: " + deployment.getId());
                }
            }
        });
    }

    private static void check(String source, String section, Runnable mapping) {
        try {
            mapping.run();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException(
                    "Invalid " + section + " section in " + source + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Modification time and size of the file as last loaded.
     */
    private record FileStamp(long modifiedMillis, long size) {

        static FileStamp of(Path path) {
            try {
                return new FileStamp(Files.getLastModifiedTime(path).toMillis(), Files.size(path));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read file attributes: " + path, e);
            }
        }

        boolean isNewerThan(FileStamp loaded) {
            return loaded == null || modifiedMillis > loaded.modifiedMillis || size != loaded.size;
        }
    }

    /**
     * Raised when configuration cannot be read or does not describe a valid runtime.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
