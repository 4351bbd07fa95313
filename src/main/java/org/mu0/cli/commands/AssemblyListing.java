package org.mu0.cli.commands;

import org.mu0.assembler.api.ProgramArtifact;
import org.mu0.assembler.diagnostics.Diagnostic;
import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.model.MemoryAddress;
import org.mu0.runtime.model.MemorySnapshot;
import org.mu0.runtime.model.Word;
import org.mu0.runtime.services.Disassembler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON-friendly view of an assembled program, as printed by {@code mu0 assemble}.
 *
 * @param programName The source name.
 * @param instructions The program, in index order.
 * @param memory The initialized cells, address pattern to value pattern.
 * @param warnings Assembler warnings.
 */
public record AssemblyListing(
        String programName,
        List<Entry> instructions,
        Map<String, String> memory,
        List<String> warnings
) {

    /**
     * One listed instruction.
     *
     * @param index The instruction index.
     * @param line The source line number, or 0 if unknown.
     * @param instruction The disassembled instruction.
     */
    public record Entry(int index, int line, String instruction) {}

    /**
     * @param artifact The assembler output.
     * @return The listing.
     */
    public static AssemblyListing of(ProgramArtifact artifact) {
        List<Entry> entries = new ArrayList<>();
        List<Instruction> program = artifact.program().instructions();
        for (int i = 0; i < program.size(); i++) {
            Instruction instruction = program.get(i);
            int line = instruction.sourceInfo() != null ? instruction.sourceInfo().lineNumber() : 0;
            entries.add(new Entry(i, line, Disassembler.disassemble(instruction)));
        }

        MemorySnapshot image = artifact.initialMemory();
        Map<String, String> memory = new LinkedHashMap<>();
        for (MemoryAddress address : image.writtenAddresses()) {
            memory.put(Word.formatHex(address.value()), Word.toHex(image.read(address)));
        }

        List<String> warnings = artifact.warnings().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.toList());

        return new AssemblyListing(artifact.programName(), entries, memory, warnings);
    }
}
