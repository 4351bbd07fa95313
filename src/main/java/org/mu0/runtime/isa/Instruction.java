package org.mu0.runtime.isa;

import org.mu0.assembler.api.SourceInfo;
import org.mu0.runtime.Config;
import org.mu0.runtime.model.InstructionIndex;
import org.mu0.runtime.model.MemoryAddress;

import java.util.Objects;

/**
 * One decoded instruction: an opcode, its raw 12-bit operand and the line it was assembled from.
 * <p>
 * The operand is stored untyped and exposed through {@link #address()} or {@link #target()}
 * depending on the opcode's {@link Opcode.OperandKind}, so a jump target can never be read
 * as a memory address or the other way round.
 *
 * @param opcode The opcode.
 * @param operand The raw operand in [0, 0xFFF]; always 0 for STOP.
 * @param sourceInfo Where the instruction was written, or {@code null} for synthesized code.
 */
public record Instruction(Opcode opcode, int operand, SourceInfo sourceInfo) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        if (operand < 0 || operand > Config.MAX_ADDRESS) {
            throw new IllegalArgumentException("Operand out of 12-bit range: " + operand);
        }
        if (!opcode.hasOperand() && operand != 0) {
            throw new IllegalArgumentException(opcode + " takes no operand");
        }
    }

    /**
     * Creates an instruction that takes an operand.
     *
     * @param opcode The opcode.
     * @param operand The raw operand.
     * @param sourceInfo The originating line, may be {@code null}.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode, int operand, SourceInfo sourceInfo) {
        return new Instruction(opcode, operand, sourceInfo);
    }

    /**
     * Creates a STOP instruction.
     *
     * @param sourceInfo The originating line, may be {@code null}.
     * @return The instruction.
     */
    public static Instruction stop(SourceInfo sourceInfo) {
        return new Instruction(Opcode.STOP, 0, sourceInfo);
    }

    /**
     * @return The memory cell a LOAD, STORE, ADD or SUB refers to.
     * @throws IllegalStateException if the opcode does not address memory.
     */
    public MemoryAddress address() {
        requireKind(Opcode.OperandKind.MEMORY_ADDRESS);
        return MemoryAddress.of(operand);
    }

    /**
     * @return The instruction a JUMP, JGE or JNE transfers control to.
     * @throws IllegalStateException if the opcode is not a jump.
     */
    public InstructionIndex target() {
        requireKind(Opcode.OperandKind.INSTRUCTION_INDEX);
        return InstructionIndex.of(operand);
    }

    private void requireKind(Opcode.OperandKind kind) {
        if (opcode.operandKind() != kind) {
            throw new IllegalStateException(opcode + " has no operand of kind " + kind);
        }
    }
}
