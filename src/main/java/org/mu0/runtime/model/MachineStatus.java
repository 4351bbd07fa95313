package org.mu0.runtime.model;

/**
 * Lifecycle of a machine between loading a program and halting.
 */
public enum MachineStatus {
    /** Program loaded, no instruction executed yet. */
    READY,
    /** At least one instruction executed and the machine has not halted. */
    RUNNING,
    /** Terminal state; see {@link HaltReason}. */
    HALTED
}
