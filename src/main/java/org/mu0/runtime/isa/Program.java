package org.mu0.runtime.isa;

import org.mu0.runtime.model.InstructionIndex;

import java.util.List;
import java.util.Optional;

/**
 * The assembled instruction list, indexed by {@link InstructionIndex}. Immutable.
 * <p>
 * This is the only place instructions live; they are never written into data memory.
 */
public final class Program {

    private final List<Instruction> instructions;

    /**
     * @param instructions The instructions in source order.
     */
    public Program(List<Instruction> instructions) {
        this.instructions = List.copyOf(instructions);
    }

    /**
     * @return The number of instructions.
     */
    public int size() {
        return instructions.size();
    }

    /**
     * @param index An instruction index.
     * @return {@code true} if the index lies inside the program.
     */
    public boolean contains(InstructionIndex index) {
        return index.value() < instructions.size();
    }

    /**
     * @param index An instruction index.
     * @return The instruction, or empty if the index lies outside the program.
     */
    public Optional<Instruction> fetch(InstructionIndex index) {
        return contains(index) ? Optional.of(instructions.get(index.value())) : Optional.empty();
    }

    /**
     * @return The instructions in index order.
     */
    public List<Instruction> instructions() {
        return instructions;
    }

    @Override
    public String toString() {
        return "Program{" + instructions.size() + " instructions}";
    }
}
