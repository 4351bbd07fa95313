package org.mu0.assembler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Defines the public interface of the MU0 assembler.
 */
public interface IAssembler {

    /**
     * Assembles source code.
     *
     * @param sourceLines The lines of the source, without line terminators.
     * @param programName A name for the program, used in diagnostics.
     * @return The assembled program and its initial memory image.
     * @throws AssemblyException if any line is malformed or out of range.
     */
    ProgramArtifact assemble(List<String> sourceLines, String programName) throws AssemblyException;

    /**
     * Assembles source held in memory.
     *
     * @param sourceText The complete source text.
     * @return The assembled program and its initial memory image.
     * @throws AssemblyException if any line is malformed or out of range.
     */
    default ProgramArtifact load(String sourceText) throws AssemblyException {
        return assemble(Arrays.asList(sourceText.split("\\r?\\n", -1)), "<memory>");
    }

    /**
     * Assembles a source file read as UTF-8.
     *
     * @param sourcePath The path of the source file.
     * @return The assembled program and its initial memory image.
     * @throws AssemblyException if the file cannot be read, or any line is malformed or out of range.
     */
    default ProgramArtifact assemble(Path sourcePath) throws AssemblyException {
        List<String> lines;
        try {
            lines = Files.readAllLines(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssemblyException(AssemblerErrorCode.IO_ERROR_READING_FILE, sourcePath.toString(), e);
        }
        return assemble(lines, sourcePath.toString());
    }
}
