package org.mu0.runtime.model;

/**
 * A zero-based position in the assembled program, counting instruction lines only.
 * The program counter and every jump target are instruction indices, never memory addresses.
 * <p>
 * An index may point past the end of the program; fetching from it halts the machine.
 *
 * @param value The index, never negative.
 */
public record InstructionIndex(int value) {

    /** The index the program counter starts at. */
    public static final InstructionIndex START = new InstructionIndex(0);

    public InstructionIndex {
        if (value < 0) {
            throw new IllegalArgumentException("Instruction index must not be negative: " + value);
        }
    }

    /**
     * @param value The index.
     * @return A new index.
     */
    public static InstructionIndex of(int value) {
        return new InstructionIndex(value);
    }

    /**
     * @return The index of the following instruction.
     */
    public InstructionIndex next() {
        return new InstructionIndex(Math.addExact(value, 1));
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
