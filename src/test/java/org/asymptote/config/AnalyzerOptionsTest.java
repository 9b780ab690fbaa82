package org.asymptote.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyzerOptions}.
 */
public class AnalyzerOptionsTest {

    @Test
    @Tag("unit")
    void testReferenceConfigMatchesDefaults() {
        AnalyzerOptions options = AnalyzerOptions.fromConfig(ConfigLoader.defaults());

        assertThat(options).isEqualTo(AnalyzerOptions.defaults());
    }

    @Test
    @Tag("unit")
    void testOverridesFallBackToReference() {
        // Arrange
        Config config = ConfigFactory.parseString("""
                asymptote.analysis {
                  recursion-tree.max-depth = 3
                  grammar-correction.enabled = false
                }
                """).withFallback(ConfigLoader.defaults());

        // Act
        AnalyzerOptions options = AnalyzerOptions.fromConfig(config);

        // Assert
        assertThat(options.maxDepth()).isEqualTo(3);
        assertThat(options.maxNodes()).isEqualTo(1024);
        assertThat(options.grammarCorrectionEnabled()).isFalse();
    }

    @Test
    @Tag("unit")
    void testWrongTypeIsReported() {
        Config config = ConfigFactory.parseString("asymptote.analysis.recursion-tree.max-depth = deep")
                .withFallback(ConfigLoader.defaults());

        assertThatThrownBy(() -> AnalyzerOptions.fromConfig(config)).isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    @Tag("unit")
    void testOutOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> new AnalyzerOptions(-1, 1024, 64, 10, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-depth");
        assertThatThrownBy(() -> new AnalyzerOptions(6, 0, 64, 10, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnalyzerOptions(6, 1024, 1, 10, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AnalyzerOptions(6, 1024, 64, 0, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testWithMaxDepthKeepsOtherValues() {
        AnalyzerOptions options = AnalyzerOptions.defaults().withMaxDepth(2);

        assertThat(options).isEqualTo(new AnalyzerOptions(2, 1024, 64, 10, true));
    }
}
