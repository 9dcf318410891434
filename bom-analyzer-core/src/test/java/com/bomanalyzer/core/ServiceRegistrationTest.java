package com.bomanalyzer.core;

import com.bomanalyzer.core.renderer.OutputRenderer;
import com.bomanalyzer.core.report.ReportGenerator;
import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the META-INF/services registrations for generators and renderers.
 *
 * <p>A typo in a registration file only shows up at runtime, when the CLI cannot find the
 * requested format or renderer.
 */
class ServiceRegistrationTest {

    @Test
    void serviceLoader_discoversReportGenerators() {
        assertThat(ServiceLoader.load(ReportGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(ReportGenerator::getId)
            .toList())
            .containsExactly("text", "markdown");
    }

    @Test
    void serviceLoader_discoversOutputRenderers() {
        assertThat(ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(OutputRenderer::getId)
            .toList())
            .containsExactly("console", "filesystem");
    }
}
