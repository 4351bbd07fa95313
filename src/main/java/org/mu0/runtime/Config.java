package org.mu0.runtime;

/**
 * Fixed architectural parameters of the MU0 machine.
 * This final class contains static constants only and is not meant to be instantiated.
 */
public final class Config {

    private Config() {}

    /**
     * Width in bits of a memory cell, of the accumulator and of every instruction operand.
     */
    public static final int WORD_BITS = 12;

    /**
     * Number of distinct bit patterns a word can hold (2^12).
     */
    public static final int WORD_MODULUS = 1 << WORD_BITS;

    /**
     * Bit mask selecting the low {@link #WORD_BITS} bits.
     */
    public static final int WORD_MASK = WORD_MODULUS - 1;

    /**
     * Smallest signed value a word can hold.
     */
    public static final int MIN_VALUE = -(WORD_MODULUS / 2);

    /**
     * Largest signed value a word can hold.
     */
    public static final int MAX_VALUE = WORD_MODULUS / 2 - 1;

    /**
     * Number of addressable memory cells.
     */
    public static final int MEMORY_SIZE = WORD_MODULUS;

    /**
     * Highest legal memory address and highest legal operand value.
     */
    public static final int MAX_ADDRESS = MEMORY_SIZE - 1;

    /**
     * Number of hexadecimal digits needed to print any address or word.
     */
    public static final int HEX_DIGITS = 3;
}
