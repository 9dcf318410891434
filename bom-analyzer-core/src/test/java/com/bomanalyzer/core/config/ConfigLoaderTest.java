package com.bomanalyzer.core.config;

import com.bomanalyzer.core.ingest.BomColumns;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("bom-analyzer.yaml");
        Files.writeString(configFile, """
            input:
              delimiter: ";"
              columns:
                productId: "Parent"
                unitCost: "Cost"

            report:
              format: markdown
              concise: false
              decimals: 2

            output:
              renderer: filesystem
              directory: "./out"
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.input().separator()).isEqualTo(';');
        BomColumns columns = config.input().columns().toBomColumns();
        assertThat(columns.productId()).isEqualTo("Parent");
        assertThat(columns.unitCost()).isEqualTo("Cost");
        assertThat(columns.componentId()).isEqualTo("No.");
        assertThat(config.report().format()).isEqualTo("markdown");
        assertThat(config.report().concise()).isFalse();
        assertThat(config.report().decimals()).isEqualTo(2);
        assertThat(config.output().renderer()).isEqualTo("filesystem");
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("bom-analyzer.yaml");
        Files.writeString(configFile, """
            report:
              concise: false
            unknownSection:
              key: value
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.report().concise()).isFalse();
        assertThat(config.report().format()).isEqualTo("text");
        assertThat(config.report().decimals()).isEqualTo(4);
        assertThat(config.input().separator()).isEqualTo(',');
        assertThat(config.input().columns().toBomColumns()).isEqualTo(BomColumns.defaults());
        assertThat(config.output().renderer()).isEqualTo("console");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        AnalyzerConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bom-analyzer.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bom-analyzer.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_multiCharacterDelimiter_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bom-analyzer.yaml");
        Files.writeString(configFile, """
            input:
              delimiter: "||"
            """);

        assertThat(ConfigLoader.load(configFile).input().delimiter()).isEqualTo(",");
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void inputConfig_multiCharacterDelimiter_throwsException() {
        assertThatThrownBy(() -> new AnalyzerConfig.InputConfig("ab", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
