package org.mu0.runtime.services;

import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.model.Word;

/**
 * Renders decoded instructions back to their canonical source form, e.g. {@code LOAD 0x100}.
 */
public final class Disassembler {

    private Disassembler() {}

    /**
     * @param instruction The instruction to render.
     * @return The mnemonic, followed by the operand as a three-digit hex literal if it has one.
     */
    public static String disassemble(Instruction instruction) {
        if (!instruction.opcode().hasOperand()) {
            return instruction.opcode().mnemonic();
        }
        return instruction.opcode().mnemonic() + " " + Word.formatHex(instruction.operand());
    }
}
