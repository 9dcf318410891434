package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only diagnostic sink for a single analysis pass.
 *
 * <p>Every pass creates a fresh log, so diagnostics never leak from one pass into the next.
 * Repeated findings are kept as separate entries.
 */
final class DiagnosticLog {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticLog.class);

    private final String passName;
    private final List<Diagnostic> entries = new ArrayList<>();

    DiagnosticLog(String passName) {
        this.passName = Objects.requireNonNull(passName, "passName must not be null");
    }

    void append(Diagnostic diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic must not be null");
        log.debug("[{}] {}", passName, diagnostic.message());
        entries.add(diagnostic);
    }

    int size() {
        return entries.size();
    }

    List<Diagnostic> snapshot() {
        return List.copyOf(entries);
    }
}
