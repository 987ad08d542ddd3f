package de.mirkosertic.pdfbatch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingConfigurator Tests")
class LoggingConfiguratorTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreTestLogging() {
        LoggingConfigurator.reload("logback-test.xml");
    }

    @Test
    @DisplayName("Should write a rolling log named after the converter in background mode")
    void shouldLogToFileInBackgroundMode() throws Exception {
        // Given
        final Path logDirectory = tempDir.resolve("log");

        // When
        final Path logFile = LoggingConfigurator.configure(true, logDirectory);
        LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("background run started");

        // Then
        assertThat(logFile)
                .as("Log file should live in the requested directory")
                .isEqualTo(logDirectory.resolve("pdf-batch-converter.log"));
        assertThat(Files.readString(logFile)).contains("background run started");
    }

    @Test
    @DisplayName("Should leave console logging untouched outside background mode")
    void shouldKeepConsoleLogging() {
        final Path logDirectory = tempDir.resolve("log");

        assertThat(LoggingConfigurator.configure(false, logDirectory)).isNull();
        assertThat(logDirectory).doesNotExist();
    }

    @Test
    @DisplayName("Should place the log directory under the converter's configuration directory")
    void shouldDeriveLogDirectoryFromConfig() {
        assertThat(ApplicationConfig.getLogDirectory())
                .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("log"));
    }
}
