package org.mu0.runtime.model;

/**
 * Why a machine entered {@link MachineStatus#HALTED}.
 */
public enum HaltReason {
    /** A STOP instruction was executed. */
    STOP,
    /**
     * The program counter pointed outside the program when the next instruction was fetched,
     * either after a jump to an out-of-range index or after running off the last instruction.
     */
    INVALID_PROGRAM_COUNTER
}
