package org.asymptote.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the layering of configuration files over the classpath defaults.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void testFileOverridesReference() throws IOException {
        // Arrange
        Path file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.writeString(file, "asymptote.analysis.solver.substitution-steps = 4\n");

        // Act
        Config config = ConfigLoader.load(file.toFile());

        // Assert
        assertThat(config.getInt("asymptote.analysis.solver.substitution-steps")).isEqualTo(4);
        assertThat(config.getInt("asymptote.analysis.recursion-tree.max-depth")).isEqualTo(6);
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @Tag("unit")
    void testSubstitutionsAreResolved() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "depth = 9\nasymptote.analysis.recursion-tree.max-depth = ${depth}\n");

        Config config = ConfigLoader.load(file.toFile());

        assertThat(AnalyzerOptions.fromConfig(config).maxDepth()).isEqualTo(9);
    }

    @Test
    @Tag("unit")
    void testMissingFileFails() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing)).isInstanceOf(ConfigException.class);
    }

    @Test
    @Tag("unit")
    void testMalformedFileFails() throws IOException {
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "asymptote { analysis = \n");

        assertThatThrownBy(() -> ConfigLoader.load(file.toFile())).isInstanceOf(ConfigException.Parse.class);
    }

    @Test
    @Tag("unit")
    void testDefaultsComeFromClasspath() {
        assertThat(ConfigLoader.defaults().getBoolean("asymptote.analysis.grammar-correction.enabled")).isTrue();
    }
}
