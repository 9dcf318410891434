package com.bomanalyzer.cli;

import com.bomanalyzer.core.renderer.OutputRenderer;
import com.bomanalyzer.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available report generators or renderers.
 *
 * <p>Discovers implementations via {@link ServiceLoader}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bom-analyzer list generators
 * bom-analyzer list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available report generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: generators or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: generators or renderers");
                yield 1;
            }
        };
    }

    private int listGenerators() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Report Generators:");
        out.println();

        boolean found = false;
        for (ReportGenerator generator : ServiceLoader.load(ReportGenerator.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.printf("    Report Types: %s%n", generator.getSupportedReportTypes());
            out.println();
        }

        if (!found) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", renderer.getDescription(), renderer.getId());
            out.println();
        }

        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
