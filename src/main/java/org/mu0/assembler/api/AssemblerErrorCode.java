package org.mu0.assembler.api;

/**
 * Defines unique, testable error codes for everything that can make assembly fail.
 * This decouples test logic from the wording of error messages.
 */
public enum AssemblerErrorCode {
    /** A line matches neither an instruction nor a data directive, or has the wrong number of operands. */
    SYNTAX_ERROR("Unrecognized instruction"),
    /** A literal lacks the {@code 0x} prefix or contains a non-hex digit. */
    MALFORMED_LITERAL("Malformed hexadecimal literal"),
    /** An address or instruction operand needs more than three hex digits, or is negative. */
    ADDRESS_OUT_OF_RANGE("Address out of range"),
    /** A data value does not fit in 12 bits. */
    VALUE_OUT_OF_RANGE("Value out of range"),
    /** The source file could not be read. */
    IO_ERROR_READING_FILE("Cannot read source file");

    private final String description;

    AssemblerErrorCode(String description) {
        this.description = description;
    }

    /**
     * @return A short human-readable description of the error class.
     */
    public String description() {
        return description;
    }
}
