package org.mu0.assembler.api;

import org.mu0.assembler.diagnostics.Diagnostic;
import org.mu0.runtime.isa.Program;
import org.mu0.runtime.model.MemorySnapshot;

import java.util.List;

/**
 * The complete, immutable output of a successful assembly.
 *
 * @param programName The logical name of the source, used in diagnostics.
 * @param sourceLines The source text, one entry per line.
 * @param program The resolved instruction list.
 * @param initialMemory The memory image produced by the data directives.
 * @param warnings Non-fatal diagnostics raised while assembling.
 */
public record ProgramArtifact(
        String programName,
        List<String> sourceLines,
        Program program,
        MemorySnapshot initialMemory,
        List<Diagnostic> warnings
) {
    public ProgramArtifact {
        sourceLines = List.copyOf(sourceLines);
        warnings = List.copyOf(warnings);
    }
}
