package org.mu0.runtime;

import org.mu0.runtime.model.HaltReason;
import org.mu0.runtime.model.InstructionIndex;

/**
 * Thrown when a step is requested from a machine that has already halted.
 */
public class MachineHaltedException extends IllegalStateException {

    private final HaltReason haltReason;

    /**
     * @param haltReason Why the machine halted.
     * @param pc The program counter at the time of halting.
     */
    public MachineHaltedException(HaltReason haltReason, InstructionIndex pc) {
        super(String.format("Machine already halted (%s) at instruction %d", haltReason, pc.value()));
        this.haltReason = haltReason;
    }

    /**
     * @return Why the machine halted.
     */
    public HaltReason getHaltReason() {
        return haltReason;
    }
}
