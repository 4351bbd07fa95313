package org.mu0.assembler.frontend.lexer;

import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.model.MemoryAddress;

/**
 * The result of classifying one source line. Exactly one is produced per line.
 */
public sealed interface ClassifiedLine permits ClassifiedLine.Blank, ClassifiedLine.Comment,
        ClassifiedLine.Data, ClassifiedLine.InstructionLine {

    /**
     * @return The line this classification was made from.
     */
    SourceLine source();

    /**
     * An empty or whitespace-only line.
     * @param source The line.
     */
    record Blank(SourceLine source) implements ClassifiedLine {}

    /**
     * A line holding nothing but a comment.
     * @param source The line.
     */
    record Comment(SourceLine source) implements ClassifiedLine {}

    /**
     * An {@code INI} directive preloading one memory cell.
     * @param source The line.
     * @param address The cell to initialize.
     * @param value The signed value to store.
     */
    record Data(SourceLine source, MemoryAddress address, int value) implements ClassifiedLine {}

    /**
     * A machine instruction.
     * @param source The line.
     * @param instruction The decoded instruction.
     */
    record InstructionLine(SourceLine source, Instruction instruction) implements ClassifiedLine {}
}
