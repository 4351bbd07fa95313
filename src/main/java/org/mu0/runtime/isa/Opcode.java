package org.mu0.runtime.isa;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed MU0 instruction set.
 */
public enum Opcode {
    LOAD(OperandKind.MEMORY_ADDRESS),
    STORE(OperandKind.MEMORY_ADDRESS),
    ADD(OperandKind.MEMORY_ADDRESS),
    SUB(OperandKind.MEMORY_ADDRESS),
    JUMP(OperandKind.INSTRUCTION_INDEX),
    JGE(OperandKind.INSTRUCTION_INDEX),
    JNE(OperandKind.INSTRUCTION_INDEX),
    STOP(OperandKind.NONE);

    /**
     * What an opcode's operand refers to.
     */
    public enum OperandKind {
        /** A cell in data memory. */
        MEMORY_ADDRESS,
        /** A position in the instruction list. */
        INSTRUCTION_INDEX,
        /** The opcode takes no operand. */
        NONE
    }

    private static final Map<String, Opcode> BY_MNEMONIC = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Opcode::mnemonic, Function.identity()));

    private final OperandKind operandKind;

    Opcode(OperandKind operandKind) {
        this.operandKind = operandKind;
    }

    /**
     * @return The kind of operand this opcode takes.
     */
    public OperandKind operandKind() {
        return operandKind;
    }

    /**
     * @return {@code true} unless the opcode takes no operand.
     */
    public boolean hasOperand() {
        return operandKind != OperandKind.NONE;
    }

    /**
     * @return The source-text mnemonic.
     */
    public String mnemonic() {
        return name();
    }

    /**
     * Looks up an opcode by its exact, upper-case mnemonic.
     *
     * @param mnemonic The mnemonic as written in source.
     * @return The opcode, or empty if the mnemonic is unknown.
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        return Optional.ofNullable(BY_MNEMONIC.get(mnemonic));
    }
}
