package org.mu0.assembler.diagnostics;

import org.mu0.assembler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one assembly run.
 * <p>
 * This decouples reporting from the assembler's control flow: errors still abort assembly
 * by exception, but callers can inspect everything reported up to that point.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * @param message The error message.
     * @param sourceInfo The offending line, may be {@code null}.
     */
    public void reportError(String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceInfo));
    }

    /**
     * @param message The warning message.
     * @param sourceInfo The line concerned, may be {@code null}.
     */
    public void reportWarning(String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceInfo));
    }

    /**
     * @return {@code true} if at least one error has been reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The reported warnings, in reporting order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return All reported diagnostics, unmodifiable.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Forgets everything reported so far.
     */
    public void clear() {
        diagnostics.clear();
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
