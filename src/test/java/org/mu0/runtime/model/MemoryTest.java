package org.mu0.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MemoryTest {

    @Test
    void startsZeroedWithNothingWritten() {
        Memory memory = new Memory();

        assertThat(memory.snapshot().toArray()).hasSize(4096).containsOnly(0);
        assertThat(memory.snapshot().writtenAddresses()).isEmpty();
    }

    @Test
    void tracksWrittenCellsInAddressOrder() {
        Memory memory = new Memory();
        memory.write(MemoryAddress.of(0x300), 5);
        memory.write(MemoryAddress.of(0x010), 0);

        assertThat(memory.snapshot().writtenAddresses())
                .containsExactly(MemoryAddress.of(0x010), MemoryAddress.of(0x300));
        assertThat(memory.isWritten(MemoryAddress.of(0x011))).isFalse();
    }

    @Test
    void rejectsValuesOutsideTheWordRange() {
        Memory memory = new Memory();

        assertThatThrownBy(() -> memory.write(MemoryAddress.of(0), 2048)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void restoreReplacesValuesAndWrittenMarks() {
        Memory memory = new Memory();
        memory.write(MemoryAddress.of(1), 7);
        MemorySnapshot image = memory.snapshot();
        memory.write(MemoryAddress.of(2), 8);

        memory.restore(image);

        assertThat(memory.read(MemoryAddress.of(1))).isEqualTo(7);
        assertThat(memory.read(MemoryAddress.of(2))).isZero();
        assertThat(memory.isWritten(MemoryAddress.of(2))).isFalse();
        assertThat(memory.snapshot()).isEqualTo(image);
    }
}
