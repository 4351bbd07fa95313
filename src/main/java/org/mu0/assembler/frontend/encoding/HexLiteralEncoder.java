package org.mu0.assembler.frontend.encoding;

import org.mu0.assembler.api.AssemblerErrorCode;
import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.SourceInfo;
import org.mu0.runtime.Config;
import org.mu0.runtime.model.Word;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes and validates the {@code 0x}-prefixed hexadecimal literals of MU0 source.
 * <p>
 * Literals are decoded in arbitrary precision, so an over-long literal is reported as out of
 * range rather than overflowing. Leading zeros are not significant: {@code 0x0001} is address 1.
 */
public final class HexLiteralEncoder {

    private static final Pattern HEX_LITERAL = Pattern.compile("0x([0-9A-Fa-f]+)");
    private static final BigInteger MAX_PATTERN = BigInteger.valueOf(Config.WORD_MASK);

    private HexLiteralEncoder() {}

    /**
     * Decodes a literal in address context: a memory address or an instruction operand.
     *
     * @param token The literal as written.
     * @param sourceInfo The line, for error reporting.
     * @return The address in [0, 0xFFF].
     * @throws AssemblyException with {@link AssemblerErrorCode#MALFORMED_LITERAL} or
     *         {@link AssemblerErrorCode#ADDRESS_OUT_OF_RANGE}.
     */
    public static int decodeAddress(String token, SourceInfo sourceInfo) throws AssemblyException {
        BigInteger magnitude = parse(token, sourceInfo);
        if (magnitude.signum() < 0 || magnitude.compareTo(MAX_PATTERN) > 0) {
            throw new AssemblyException(AssemblerErrorCode.ADDRESS_OUT_OF_RANGE,
                    "'" + token + "' does not fit in " + Config.HEX_DIGITS + " hex digits", sourceInfo);
        }
        return magnitude.intValueExact();
    }

    /**
     * Decodes a literal in value context: the literal is a 12-bit pattern, read as two's complement.
     *
     * @param token The literal as written.
     * @param sourceInfo The line, for error reporting.
     * @return The signed value in [-2048, 2047].
     * @throws AssemblyException with {@link AssemblerErrorCode#MALFORMED_LITERAL} or
     *         {@link AssemblerErrorCode#VALUE_OUT_OF_RANGE}.
     */
    public static int decodeValue(String token, SourceInfo sourceInfo) throws AssemblyException {
        BigInteger pattern = parse(token, sourceInfo);
        if (pattern.signum() < 0 || pattern.compareTo(MAX_PATTERN) > 0) {
            throw new AssemblyException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "'" + token + "' does not fit in " + Config.WORD_BITS + " bits", sourceInfo);
        }
        return Word.fromBitPattern(pattern.intValueExact());
    }

    /**
     * Encodes a signed value as the literal that {@link #decodeValue} reads back to it.
     *
     * @param value A value in [-2048, 2047].
     * @return The literal, e.g. {@code 0xfa3} for -93.
     */
    public static String encodeValue(int value) {
        return Word.toHex(value);
    }

    private static BigInteger parse(String token, SourceInfo sourceInfo) throws AssemblyException {
        Matcher matcher = HEX_LITERAL.matcher(token);
        if (!matcher.matches()) {
            throw new AssemblyException(AssemblerErrorCode.MALFORMED_LITERAL,
                    "'" + token + "' is not of the form 0xHHH", sourceInfo);
        }
        return new BigInteger(matcher.group(1), 16);
    }
}
