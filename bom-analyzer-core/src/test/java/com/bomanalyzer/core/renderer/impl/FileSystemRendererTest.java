package com.bomanalyzer.core.renderer.impl;

import com.bomanalyzer.core.renderer.RenderContext;
import com.bomanalyzer.core.renderer.ReportBundle;
import com.bomanalyzer.core.report.GeneratedReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();
    private final StringWriter console = new StringWriter();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesOneFilePerReport() throws IOException {
        // Given
        Path outputDir = tempDir.resolve("nested/report");
        ReportBundle bundle = new ReportBundle(List.of(
            new GeneratedReport("warnings", "w\n", "txt"),
            new GeneratedReport("depths", "d\n", "txt")));

        // When
        renderer.render(bundle, context(outputDir));

        // Then
        assertThat(Files.readString(outputDir.resolve("warnings.txt"))).isEqualTo("w\n");
        assertThat(Files.readString(outputDir.resolve("depths.txt"))).isEqualTo("d\n");
        assertThat(console.toString())
            .contains("Wrote " + outputDir.resolve("warnings.txt"))
            .contains("Wrote " + outputDir.resolve("depths.txt"));
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("depths.md"), "stale");

        renderer.render(new ReportBundle(List.of(new GeneratedReport("depths", "fresh", "md"))), context(tempDir));

        assertThat(Files.readString(tempDir.resolve("depths.md"))).isEqualTo("fresh");
    }

    @Test
    void render_outputPathIsAFile_throwsException() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        assertThatThrownBy(() -> renderer.render(
            new ReportBundle(List.of(new GeneratedReport("depths", "d", "txt"))), context(blocker)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("blocker");
    }

    private RenderContext context(Path outputDir) {
        return new RenderContext(outputDir, new PrintWriter(console), Map.of());
    }
}
