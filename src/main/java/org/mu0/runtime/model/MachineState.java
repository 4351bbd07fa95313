package org.mu0.runtime.model;

/**
 * Read-only snapshot of the machine after a step.
 *
 * @param pc The program counter, an index into the program.
 * @param acc The accumulator value.
 * @param status The lifecycle state.
 * @param haltReason Why the machine halted, or {@code null} while it has not.
 * @param memory A copy of the full memory.
 * @param steps The number of steps performed since loading or the last reset.
 */
public record MachineState(
        InstructionIndex pc,
        int acc,
        MachineStatus status,
        HaltReason haltReason,
        MemorySnapshot memory,
        long steps
) {
    public MachineState {
        if ((status == MachineStatus.HALTED) != (haltReason != null)) {
            throw new IllegalArgumentException("A halt reason is required exactly when the machine is halted");
        }
    }

    /**
     * @return {@code true} if the machine is in its terminal state.
     */
    public boolean halted() {
        return status == MachineStatus.HALTED;
    }
}
