package org.mu0.assembler.frontend.lexer;

import org.mu0.assembler.api.SourceInfo;

/**
 * One raw line of source, as handed to the {@link LineClassifier}.
 *
 * @param fileName The logical name of the source.
 * @param lineNumber The 1-based line number.
 * @param text The raw text without line terminator.
 */
public record SourceLine(String fileName, int lineNumber, String text) {

    /**
     * @return The location of this line for diagnostics and instruction metadata.
     */
    public SourceInfo toSourceInfo() {
        return new SourceInfo(fileName, lineNumber, text);
    }
}
