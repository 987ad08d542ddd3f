package de.mirkosertic.pdfbatch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches the converter to file logging when it runs without a console, for example when a
 * desktop launcher starts it with {@code -Dprofile=background}.
 * <p>
 * logback-file.xml reads the directory and base name of its rolling log from the context
 * properties {@value #LOG_DIR_PROPERTY} and {@value #LOG_NAME_PROPERTY}, set here before the
 * file is loaded. Console runs keep the logback.xml that Logback picks up on its own.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    static final String LOG_NAME_PROPERTY = "LOG_NAME";
    static final String LOG_NAME = "pdf-batch-converter";
    static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything logs.
     *
     * @param backgroundMode true if the converter runs without a console
     * @param logDirectory   directory of the rolling log, usually {@link ApplicationConfig#getLogDirectory()}
     * @return the active log file, or {@code null} when logging goes to the console
     */
    public static @Nullable Path configure(final boolean backgroundMode, final Path logDirectory) {
        if (!backgroundMode) {
            return null;
        }
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
            return null;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        // reset() drops context properties, so they go in afterwards
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());
        context.putProperty(LOG_NAME_PROPERTY, LOG_NAME);
        return load(context, FILE_CONFIG) ? logDirectory.resolve(LOG_NAME + ".log") : null;
    }

    /**
     * Replace the active configuration with the given classpath resource.
     */
    static boolean reload(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        return load(context, configFile);
    }

    private static boolean load(final LoggerContext context, final String configFile) {
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logging configuration " + configFile + ": " + e.getMessage());
            return false;
        }
    }
}
