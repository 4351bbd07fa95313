package org.mu0.runtime.model;

import org.mu0.runtime.Config;

/**
 * Arithmetic on 12-bit two's-complement words.
 * <p>
 * A word is stored as a Java {@code int} holding its signed value in
 * [{@link Config#MIN_VALUE}, {@link Config#MAX_VALUE}]. The helpers here convert between
 * that signed value and the unsigned 12-bit pattern the source text and the memory dump use.
 */
public final class Word {

    private Word() {}

    /**
     * Reduces an arbitrary result modulo 2^12 and reinterprets it as signed.
     *
     * @param value The unreduced result.
     * @return The wrapped signed value.
     */
    public static int wrap(long value) {
        return fromBitPattern((int) Math.floorMod(value, (long) Config.WORD_MODULUS));
    }

    /**
     * Reinterprets an unsigned 12-bit pattern as a signed value (0x800..0xFFF become -2048..-1).
     *
     * @param pattern A value in [0, 0xFFF].
     * @return The signed value.
     * @throws IllegalArgumentException if the pattern does not fit in 12 bits.
     */
    public static int fromBitPattern(int pattern) {
        if (pattern < 0 || pattern > Config.WORD_MASK) {
            throw new IllegalArgumentException("Not a 12-bit pattern: " + pattern);
        }
        return pattern > Config.MAX_VALUE ? pattern - Config.WORD_MODULUS : pattern;
    }

    /**
     * Returns the unsigned 12-bit pattern of a signed value.
     *
     * @param value A value in [-2048, 2047].
     * @return The bit pattern in [0, 0xFFF].
     * @throws IllegalArgumentException if the value is not a valid word.
     */
    public static int toBitPattern(int value) {
        requireValid(value);
        return value & Config.WORD_MASK;
    }

    /**
     * @param value Any int.
     * @return {@code true} if the value lies in the signed word range.
     */
    public static boolean isValid(int value) {
        return value >= Config.MIN_VALUE && value <= Config.MAX_VALUE;
    }

    /**
     * Formats a signed word as its bit pattern, e.g. {@code -93} as {@code 0xfa3}.
     *
     * @param value A value in [-2048, 2047].
     * @return The {@code 0x}-prefixed, zero-padded, lower-case pattern.
     */
    public static String toHex(int value) {
        return formatHex(toBitPattern(value));
    }

    /**
     * Formats an unsigned number as a {@code 0x}-prefixed hex string with at least three digits.
     *
     * @param unsigned A non-negative number.
     * @return The formatted string.
     */
    public static String formatHex(int unsigned) {
        return String.format("0x%0" + Config.HEX_DIGITS + "x", unsigned);
    }

    static int requireValid(int value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(
                    String.format("Value %d is outside the 12-bit range [%d, %d]", value, Config.MIN_VALUE, Config.MAX_VALUE));
        }
        return value;
    }
}
