package org.mu0.assembler.diagnostics;

import org.mu0.assembler.api.SourceInfo;

/**
 * A single message raised while assembling.
 *
 * @param type The severity.
 * @param message The message.
 * @param sourceInfo The line the message refers to, or {@code null} for whole-program messages.
 */
public record Diagnostic(Type type, String message, SourceInfo sourceInfo) {

    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        /** Assembly was aborted. */
        ERROR,
        /** Assembly succeeded but the source is probably not what the author meant. */
        WARNING
    }

    @Override
    public String toString() {
        if (sourceInfo == null) {
            return String.format("[%s] %s", type, message);
        }
        return String.format("[%s] %s:%d: %s", type, sourceInfo.fileName(), sourceInfo.lineNumber(), message);
    }
}
