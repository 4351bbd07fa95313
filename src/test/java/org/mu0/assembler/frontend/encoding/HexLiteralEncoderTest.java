package org.mu0.assembler.frontend.encoding;

import org.mu0.assembler.api.AssemblerErrorCode;
import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HexLiteralEncoder}: literal syntax, the address range and the
 * two's-complement value range.
 */
@Tag("unit")
class HexLiteralEncoderTest {

    private static final SourceInfo LINE = new SourceInfo("test.asm", 7, "INI 0x100 0x1");

    @Test
    void acceptsEveryThreeDigitAddress() throws AssemblyException {
        for (int address = 0; address <= 0xFFF; address++) {
            assertThat(HexLiteralEncoder.decodeAddress(String.format("0x%x", address), LINE)).isEqualTo(address);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"0x1000", "0xFFFF", "0x12345", "0xffffffffffffffffffffffff"})
    void rejectsAddressesNeedingAFourthDigit(String literal) {
        assertThatThrownBy(() -> HexLiteralEncoder.decodeAddress(literal, LINE))
                .isInstanceOf(AssemblyException.class)
                .extracting(e -> ((AssemblyException) e).getErrorCode())
                .isEqualTo(AssemblerErrorCode.ADDRESS_OUT_OF_RANGE);
    }

    @Test
    void leadingZerosAreNotSignificant() throws AssemblyException {
        assertThat(HexLiteralEncoder.decodeAddress("0x0001", LINE)).isEqualTo(1);
        assertThat(HexLiteralEncoder.decodeAddress("0x00000fff", LINE)).isEqualTo(0xFFF);
    }

    @Test
    void hexDigitsAreCaseInsensitive() throws AssemblyException {
        assertThat(HexLiteralEncoder.decodeAddress("0xAbC", LINE)).isEqualTo(0xABC);
    }

    @ParameterizedTest
    @ValueSource(strings = {"100", "0X100", "0x", "0xG1", "-0x5", "x100", "0x1.0", ""})
    void rejectsMalformedLiterals(String literal) {
        assertThatThrownBy(() -> HexLiteralEncoder.decodeValue(literal, LINE))
                .isInstanceOf(AssemblyException.class)
                .extracting(e -> ((AssemblyException) e).getErrorCode())
                .isEqualTo(AssemblerErrorCode.MALFORMED_LITERAL);
    }

    @Test
    void valuesAboveTheSignBitAreNegative() throws AssemblyException {
        assertThat(HexLiteralEncoder.decodeValue("0x7ff", LINE)).isEqualTo(2047);
        assertThat(HexLiteralEncoder.decodeValue("0x800", LINE)).isEqualTo(-2048);
        assertThat(HexLiteralEncoder.decodeValue("0xfff", LINE)).isEqualTo(-1);
        assertThat(HexLiteralEncoder.decodeValue("0xfa3", LINE)).isEqualTo(-93);
    }

    @Test
    void everyValueSurvivesEncodingAndDecoding() throws AssemblyException {
        for (int value = -2048; value <= 2047; value++) {
            String literal = HexLiteralEncoder.encodeValue(value);
            assertThat(HexLiteralEncoder.decodeValue(literal, LINE)).as(literal).isEqualTo(value);
        }
    }

    @Test
    void valuePatternsWiderThanTwelveBitsAreRejected() {
        assertThatThrownBy(() -> HexLiteralEncoder.decodeValue("0x1000", LINE))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("test.asm:7")
                .extracting(e -> ((AssemblyException) e).getErrorCode())
                .isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE);
    }

    @Test
    void encodingAValueOutsideTheWordRangeFails() {
        assertThatThrownBy(() -> HexLiteralEncoder.encodeValue(2048)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HexLiteralEncoder.encodeValue(-2049)).isInstanceOf(IllegalArgumentException.class);
    }
}
