package org.mu0.assembler;

import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.IAssembler;
import org.mu0.assembler.api.ProgramArtifact;
import org.mu0.assembler.diagnostics.DiagnosticsEngine;
import org.mu0.assembler.frontend.lexer.ClassifiedLine;
import org.mu0.assembler.frontend.lexer.LineClassifier;
import org.mu0.assembler.frontend.lexer.SourceLine;
import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.isa.Opcode;
import org.mu0.runtime.isa.Program;
import org.mu0.runtime.model.Memory;
import org.mu0.runtime.model.MemorySnapshot;
import org.mu0.runtime.model.Word;
import org.mu0.runtime.services.Disassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The MU0 assembler. It classifies the source line by line, numbers instruction lines from 0
 * (blank, comment and data lines take no instruction slot), applies data directives to a
 * fresh memory image and freezes the result into a {@link ProgramArtifact}.
 * <p>
 * The first invalid line aborts assembly; no partial program is ever returned.
 * Instances can be reused but are not thread-safe.
 */
public class Assembler implements IAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

    private final LineClassifier classifier = new LineClassifier();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @Override
    public ProgramArtifact assemble(List<String> sourceLines, String programName) throws AssemblyException {
        diagnostics.clear();
        List<Instruction> instructions = new ArrayList<>();
        Memory memory = new Memory();

        int lineNumber = 0;
        for (String text : sourceLines) {
            lineNumber++;
            SourceLine line = new SourceLine(programName, lineNumber, text);
            ClassifiedLine classified;
            try {
                classified = classifier.classify(line);
            } catch (AssemblyException e) {
                diagnostics.reportError(e.getMessage(), e.getSourceInfo());
                LOG.debug("Assembly of {} aborted: {}", programName, e.getMessage());
                throw e;
            }

            if (classified instanceof ClassifiedLine.Data data) {
                if (memory.isWritten(data.address())) {
                    diagnostics.reportWarning(String.format("%s overwrites the earlier value %s of cell %s",
                            LineClassifier.DATA_DIRECTIVE, Word.toHex(memory.read(data.address())), data.address()),
                            line.toSourceInfo());
                }
                memory.write(data.address(), data.value());
                LOG.debug("{}:{} data {} = {}", programName, lineNumber, data.address(), data.value());
            } else if (classified instanceof ClassifiedLine.InstructionLine instructionLine) {
                LOG.debug("{}:{} instruction {}: {}", programName, lineNumber, instructions.size(),
                        Disassembler.disassemble(instructionLine.instruction()));
                instructions.add(instructionLine.instruction());
            }
        }

        if (instructions.stream().noneMatch(i -> i.opcode() == Opcode.STOP)) {
            diagnostics.reportWarning("program contains no STOP instruction", null);
        }
        diagnostics.getWarnings().forEach(w -> LOG.warn("{}", w));

        Program program = new Program(instructions);
        MemorySnapshot image = memory.snapshot();
        LOG.info("Assembled {}: {} instructions, {} initialized cells",
                programName, program.size(), image.writtenAddresses().size());
        return new ProgramArtifact(programName, sourceLines, program, image, diagnostics.getWarnings());
    }

    /**
     * @return The diagnostics of the most recent assembly, including the error that aborted it.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
