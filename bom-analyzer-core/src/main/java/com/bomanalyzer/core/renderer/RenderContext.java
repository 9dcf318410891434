package com.bomanalyzer.core.renderer;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory target directory for file-based renderers
 * @param console stream used by console-based renderers
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path outputDirectory,
    PrintWriter console,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        Objects.requireNonNull(console, "console must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public boolean isEnabled(String key) {
        return Boolean.parseBoolean(settings.get(key));
    }
}
