package org.mu0.assembler.api;

import java.util.Optional;

/**
 * Identifies the source line an instruction or diagnostic came from.
 *
 * @param fileName The logical name of the source (a path, or {@code <memory>}).
 * @param lineNumber The 1-based line number.
 * @param lineText The raw text of the line, without its line terminator.
 */
public record SourceInfo(String fileName, int lineNumber, String lineText) {

    /**
     * @return The comment text after the leading run of {@code ;}, trimmed, or empty if the line has none.
     */
    public Optional<String> comment() {
        int start = lineText.indexOf(';');
        if (start < 0) {
            return Optional.empty();
        }
        String text = lineText.substring(start).replaceFirst("^;+", "").trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    @Override
    public String toString() {
        return String.format("%s:%d: %s", fileName, lineNumber, lineText.strip());
    }
}
