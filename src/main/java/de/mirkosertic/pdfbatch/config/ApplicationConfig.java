package de.mirkosertic.pdfbatch.config;

import de.mirkosertic.pdfbatch.naming.FilenameResolver;
import de.mirkosertic.pdfbatch.naming.NamingRule;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Central configuration for the batch converter.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.pdfbatch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_WORKER_COUNT = "PDFBATCH_WORKER_COUNT";
    static final String ENV_SOFFICE_PATH = "PDFBATCH_SOFFICE_PATH";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".pdfbatch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String LOG_DIR = "log";

    // Converter settings
    private int workerCount = 4;
    private NamingRule namingRule = NamingRule.REMOVE_SQUARE_BRACKETS;
    private String targetFormat = "pdf";
    private int maxPathLength = FilenameResolver.DEFAULT_MAX_PATH_LENGTH;
    private long progressIntervalMs = 30000;

    // Engine settings
    private @Nullable String sofficePath;
    private long engineTimeoutMs = 600000;

    // Input settings
    private List<String> includePatterns = List.of("*.doc", "*.docx", "*.odt", "*.rtf");

    private boolean notificationsEnabled = true;

    // Profile settings
    private boolean backgroundMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides(System::getenv);

        // Step 4: Determine profile/mode
        config.determineProfile();

        config.validate();

        logger.info("Configuration loaded: workers={}, namingRule={}, targetFormat={}, backgroundMode={}",
                config.workerCount, config.namingRule, config.targetFormat, config.backgroundMode);

        return config;
    }

    /**
     * Built-in defaults only, ignoring configuration files and the environment.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    /**
     * Defaults overlaid with the given YAML document.
     */
    public static ApplicationConfig fromYaml(final InputStream yamlStream) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlStream);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        config.validate();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("pdfbatch");
        if (root == null) {
            return;
        }

        final Map<String, Object> converterConfig = (Map<String, Object>) root.get("converter");
        if (converterConfig != null) {
            applyConverterConfig(converterConfig);
        }

        final Map<String, Object> engineConfig = (Map<String, Object>) root.get("engine");
        if (engineConfig != null) {
            if (engineConfig.containsKey("soffice-path")) {
                final Object path = engineConfig.get("soffice-path");
                final String resolved = path == null ? null : resolveVariables(path.toString()).trim();
                this.sofficePath = resolved == null || resolved.isEmpty() ? null : resolved;
            }
            if (engineConfig.containsKey("timeout-ms")) {
                this.engineTimeoutMs = ((Number) engineConfig.get("timeout-ms")).longValue();
            }
        }

        final Map<String, Object> inputConfig = (Map<String, Object>) root.get("input");
        if (inputConfig != null && inputConfig.containsKey("include-patterns")) {
            final Object patterns = inputConfig.get("include-patterns");
            if (patterns instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) patterns);
            }
        }

        final Map<String, Object> notificationConfig = (Map<String, Object>) root.get("notifications");
        if (notificationConfig != null && notificationConfig.containsKey("enabled")) {
            this.notificationsEnabled = (Boolean) notificationConfig.get("enabled");
        }
    }

    private void applyConverterConfig(final Map<String, Object> converterConfig) {
        if (converterConfig.containsKey("worker-count")) {
            this.workerCount = ((Number) converterConfig.get("worker-count")).intValue();
        }
        if (converterConfig.containsKey("naming-rule")) {
            this.namingRule = NamingRule.fromConfig(String.valueOf(converterConfig.get("naming-rule")));
        }
        if (converterConfig.containsKey("target-format")) {
            this.targetFormat = String.valueOf(converterConfig.get("target-format")).trim();
        }
        if (converterConfig.containsKey("max-path-length")) {
            this.maxPathLength = ((Number) converterConfig.get("max-path-length")).intValue();
        }
        if (converterConfig.containsKey("progress-interval-ms")) {
            this.progressIntervalMs = ((Number) converterConfig.get("progress-interval-ms")).longValue();
        }
    }

    void applyEnvironmentOverrides(final UnaryOperator<String> environment) {
        final String envWorkers = environment.apply(ENV_WORKER_COUNT);
        if (envWorkers != null && !envWorkers.trim().isEmpty()) {
            try {
                this.workerCount = Integer.parseInt(envWorkers.trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(ENV_WORKER_COUNT + " is not a number: " + envWorkers, e);
            }
            logger.info("Worker count from environment: {}", this.workerCount);
        }

        final String envSoffice = environment.apply(ENV_SOFFICE_PATH);
        if (envSoffice != null && !envSoffice.trim().isEmpty()) {
            this.sofficePath = envSoffice.trim();
            logger.info("LibreOffice executable from environment: {}", this.sofficePath);
        }

        // System property for the executable
        final String propSoffice = System.getProperty("pdfbatch.soffice.path");
        if (propSoffice != null && !propSoffice.isEmpty()) {
            this.sofficePath = propSoffice;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.backgroundMode = "background".equalsIgnoreCase(profile);
    }

    void validate() {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        if (engineTimeoutMs <= 0) {
            throw new IllegalArgumentException("Engine timeout must be positive: " + engineTimeoutMs);
        }
        if (maxPathLength < 1) {
            throw new IllegalArgumentException("Maximum path length must be positive: " + maxPathLength);
        }
        if (targetFormat.isEmpty()) {
            throw new IllegalArgumentException("Target format must not be empty");
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public static Path getLogDirectory() {
        return getConfigDirectory().resolve(LOG_DIR);
    }

    // Getters
    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(final int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public NamingRule getNamingRule() {
        return namingRule;
    }

    public void setNamingRule(final NamingRule namingRule) {
        this.namingRule = namingRule;
    }

    public String getTargetFormat() {
        return targetFormat;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    public void setMaxPathLength(final int maxPathLength) {
        this.maxPathLength = maxPathLength;
    }

    public long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    public void setProgressIntervalMs(final long progressIntervalMs) {
        this.progressIntervalMs = progressIntervalMs;
    }

    public @Nullable Path getSofficePath() {
        return sofficePath == null ? null : Paths.get(sofficePath);
    }

    public long getEngineTimeoutMs() {
        return engineTimeoutMs;
    }

    public void setEngineTimeoutMs(final long engineTimeoutMs) {
        if (engineTimeoutMs <= 0) {
            throw new IllegalArgumentException("Engine timeout must be positive: " + engineTimeoutMs);
        }
        this.engineTimeoutMs = engineTimeoutMs;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public void setNotificationsEnabled(final boolean notificationsEnabled) {
        this.notificationsEnabled = notificationsEnabled;
    }

    public boolean isBackgroundMode() {
        return backgroundMode;
    }
}
