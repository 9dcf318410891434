package com.bomanalyzer.core.renderer.impl;

import com.bomanalyzer.core.renderer.OutputRenderer;
import com.bomanalyzer.core.renderer.RenderContext;
import com.bomanalyzer.core.renderer.ReportBundle;
import com.bomanalyzer.core.report.GeneratedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Renderer that prints reports to the context console, one after the other.
 *
 * <p>Reports are printed verbatim so that piping the output yields exactly the generated text.
 * A blank line separates consecutive reports.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - wrap report headers in ANSI colours ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print the file name above each report ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    static final String COLORS = "console.colors";
    static final String SHOW_HEADERS = "console.showHeaders";

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Prints reports to standard output";
    }

    @Override
    public void render(ReportBundle bundle, RenderContext context) {
        boolean useColors = context.isEnabled(COLORS);
        boolean showHeaders = context.isEnabled(SHOW_HEADERS);
        PrintWriter out = context.console();

        logger.debug("Rendering {} reports to console (colors: {}, headers: {})",
            bundle.reports().size(), useColors, showHeaders);

        for (int i = 0; i < bundle.reports().size(); i++) {
            GeneratedReport report = bundle.reports().get(i);
            if (i > 0) {
                out.println();
            }
            if (showHeaders) {
                printHeader(out, report, useColors);
            }
            out.print(report.content());
        }
        out.flush();
    }

    private void printHeader(PrintWriter out, GeneratedReport report, boolean useColors) {
        String color = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(color + report.fileName() + reset);
    }
}
