package org.flightplot.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.flightplot.export.QualityProfileResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}: system properties override the file, the file
 * overrides {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    private final List<String> messages = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("flightplot.export.max-workers");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile merges the file over the built-in defaults")
    void loadFromFileMergesDefaults() throws Exception {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");
        assertThat(config.getInt("flightplot.export.max-workers")).isEqualTo(2);
        assertThat(config.getInt("flightplot.export.tiers.standard.width")).isEqualTo(480);
        assertThat(config.getInt("flightplot.export.tiers.standard.stride-threshold")).isEqualTo(10);
        assertThat(config.getString("flightplot.cli.progress-interval")).isEqualTo("500ms");
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void systemPropertyOverridesFile() throws Exception {
        System.setProperty("test.value", "system-value");
        System.setProperty("flightplot.export.max-workers", "3");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(config.getInt("flightplot.export.max-workers")).isEqualTo(3);
    }

    @Test
    void defaultsContainTheTierTable() throws Exception {
        Config config = ConfigLoader.loadDefaults();

        assertThat(config.getInt("flightplot.export.max-workers")).isEqualTo(8);
        assertThat(config.getString("flightplot.cli.default-tier")).isEqualTo("standard");
        assertThat(QualityProfileResolver.fromApplicationConfig(config).tierNames())
            .containsExactly("fastest", "fast-preview", "standard", "high");
    }

    @Test
    void fileCanAddTiers() throws Exception {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));
        QualityProfileResolver resolver = QualityProfileResolver.fromApplicationConfig(config);

        assertThat(resolver.tierNames()).endsWith("tiny");
        assertThat(resolver.resolve("tiny", 20).stride()).isEqualTo(4);
    }

    @Test
    void explicitFileIsUsed() throws Exception {
        Config config = ConfigLoader.resolve(testResource("test-config.conf"), (level, message) -> messages.add(message));

        assertThat(config.getString("flightplot.cli.default-tier")).isEqualTo("tiny");
        assertThat(messages).singleElement().asString().contains("--config");
    }

    @Test
    void missingExplicitFileFails() {
        assertThatThrownBy(() -> ConfigLoader.resolve(new File("does/not/exist.conf"), (level, message) -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("exist.conf");
    }

    @Test
    void systemConfigFileIsUsed() throws Exception {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertThat(config.getInt("flightplot.export.max-workers")).isEqualTo(2);
        assertThat(messages).singleElement().asString().contains("-Dconfig.file");
    }

    @Test
    void missingSystemConfigFileFails() {
        System.setProperty("config.file", "does/not/exist.conf");

        assertThatThrownBy(() -> ConfigLoader.resolve(null, (level, message) -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private File testResource(String name) throws URISyntaxException {
        URL url = getClass().getClassLoader().getResource(name);
        assertThat(url).as("test resource %s", name).isNotNull();
        return new File(url.toURI());
    }
}
