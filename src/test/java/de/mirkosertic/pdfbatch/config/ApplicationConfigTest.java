package de.mirkosertic.pdfbatch.config;

import de.mirkosertic.pdfbatch.naming.NamingRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @Test
    @DisplayName("Should provide built-in defaults")
    void shouldProvideDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getWorkerCount()).isEqualTo(4);
        assertThat(config.getNamingRule()).isEqualTo(NamingRule.REMOVE_SQUARE_BRACKETS);
        assertThat(config.getTargetFormat()).isEqualTo("pdf");
        assertThat(config.getMaxPathLength()).isEqualTo(255);
        assertThat(config.getEngineTimeoutMs()).isEqualTo(600000);
        assertThat(config.getSofficePath()).isNull();
        assertThat(config.getIncludePatterns()).containsExactly("*.doc", "*.docx", "*.odt", "*.rtf");
        assertThat(config.isNotificationsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should read the pdfbatch section of a YAML document")
    void shouldReadYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                pdfbatch:
                  converter:
                    worker-count: 2
                    naming-rule: Original Name
                    max-path-length: 200
                    progress-interval-ms: 0
                  engine:
                    soffice-path: /opt/lo/program/soffice
                    timeout-ms: 1000
                  input:
                    include-patterns: ["*.docx"]
                  notifications:
                    enabled: false
                """));

        assertThat(config.getWorkerCount()).isEqualTo(2);
        assertThat(config.getNamingRule()).isEqualTo(NamingRule.ORIGINAL_NAME);
        assertThat(config.getMaxPathLength()).isEqualTo(200);
        assertThat(config.getProgressIntervalMs()).isZero();
        assertThat(config.getSofficePath()).isEqualTo(Path.of("/opt/lo/program/soffice"));
        assertThat(config.getEngineTimeoutMs()).isEqualTo(1000);
        assertThat(config.getIncludePatterns()).containsExactly("*.docx");
        assertThat(config.isNotificationsEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should treat an empty executable path as auto-detect")
    void shouldTreatEmptySofficePathAsUnset() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                pdfbatch:
                  engine:
                    soffice-path: "${PDFBATCH_TEST_UNSET_VARIABLE:}"
                """));

        assertThat(config.getSofficePath()).isNull();
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ApplicationConfig.fromYaml(yaml("""
                pdfbatch:
                  converter:
                    worker-count: 0
                """))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ApplicationConfig.fromYaml(yaml("""
                pdfbatch:
                  engine:
                    timeout-ms: -5
                """))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ApplicationConfig.defaults().setWorkerCount(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should let environment variables override file settings")
    void shouldApplyEnvironmentOverrides() {
        final ApplicationConfig config = ApplicationConfig.defaults();
        final Map<String, String> environment = Map.of(
                ApplicationConfig.ENV_WORKER_COUNT, " 8 ",
                ApplicationConfig.ENV_SOFFICE_PATH, "/usr/bin/soffice");

        config.applyEnvironmentOverrides(environment::get);

        assertThat(config.getWorkerCount()).isEqualTo(8);
        assertThat(config.getSofficePath()).isEqualTo(Path.of("/usr/bin/soffice"));
    }

    @Test
    @DisplayName("Should reject a non-numeric worker count from the environment")
    void shouldRejectInvalidEnvironmentWorkerCount() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThatThrownBy(() -> config.applyEnvironmentOverrides(
                Map.of(ApplicationConfig.ENV_WORKER_COUNT, "many")::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ApplicationConfig.ENV_WORKER_COUNT);
    }

    @Test
    @DisplayName("Should load the bundled defaults from the classpath")
    void shouldLoadFromClasspath() {
        final ApplicationConfig config = ApplicationConfig.load();

        assertThat(config.getTargetFormat()).isEqualTo("pdf");
        assertThat(config.getWorkerCount()).isPositive();
    }

    private static InputStream yaml(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
