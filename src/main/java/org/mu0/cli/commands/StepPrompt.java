package org.mu0.cli.commands;

/**
 * Pauses between steps when a program is executed step by step.
 */
@FunctionalInterface
public interface StepPrompt {

    /**
     * Blocks until the user asks for the next instruction.
     *
     * @return {@code true} to continue, {@code false} if the user aborted.
     */
    boolean awaitNext();
}
