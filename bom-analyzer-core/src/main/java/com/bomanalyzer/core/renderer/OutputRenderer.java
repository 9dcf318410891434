package com.bomanalyzer.core.renderer;

/**
 * Writes generated reports to a destination.
 *
 * <p>Renderers are discovered through {@link java.util.ServiceLoader}. Register implementations in
 * {@code META-INF/services/com.bomanalyzer.core.renderer.OutputRenderer}.
 *
 * @see ReportBundle
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the identifier used to select this renderer in configuration and on the command
     * line. Lowercase, e.g. "console" or "filesystem".
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns a one-line description for the {@code list renderers} command.
     *
     * @return description
     */
    String getDescription();

    /**
     * Renders every report in the bundle, in bundle order.
     *
     * @param bundle reports to render
     * @param context rendering context
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(ReportBundle bundle, RenderContext context);
}
