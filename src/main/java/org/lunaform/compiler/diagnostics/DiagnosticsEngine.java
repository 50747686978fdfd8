package org.lunaform.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one front-end run, so the lexer and the parser can keep
 * going after a problem and report everything at once.
 */
public class DiagnosticsEngine {

    private final String sourceName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates an engine for an anonymous in-memory source.
     */
    public DiagnosticsEngine() {
        this("<memory>");
    }

    /**
     * @param sourceName The logical name of the source, used in every reported diagnostic.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Reports an error.
     * @param message The error message.
     * @param line The line of the error.
     */
    public void reportError(String message, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, sourceName, line));
    }

    /**
     * Reports a warning.
     * @param message The warning message.
     * @param line The line of the warning.
     */
    public void reportWarning(String message, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, sourceName, line));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return the first reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.ERROR).findFirst();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return all diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
