package org.mu0.runtime.model;

import org.mu0.runtime.Config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * An immutable copy of the memory contents at one point in time.
 * Holding a snapshot never interferes with later execution.
 */
public final class MemorySnapshot {

    private final int[] cells;
    private final BitSet written;

    MemorySnapshot(int[] cells, BitSet written) {
        this.cells = cells.clone();
        this.written = (BitSet) written.clone();
    }

    /**
     * @return A snapshot of a freshly created, all-zero memory.
     */
    public static MemorySnapshot empty() {
        return new Memory().snapshot();
    }

    /**
     * @param address The cell to read.
     * @return The signed value of the cell.
     */
    public int read(MemoryAddress address) {
        return cells[address.value()];
    }

    /**
     * @param address The cell to read.
     * @return The signed value of the cell.
     * @throws IllegalArgumentException if the address is out of range.
     */
    public int read(int address) {
        return read(MemoryAddress.of(address));
    }

    /**
     * @param address The cell to check.
     * @return {@code true} if the cell had been written when the snapshot was taken.
     */
    public boolean isWritten(MemoryAddress address) {
        return written.get(address.value());
    }

    /**
     * @return The written cells in ascending address order.
     */
    public List<MemoryAddress> writtenAddresses() {
        List<MemoryAddress> result = new ArrayList<>(written.cardinality());
        for (int i = written.nextSetBit(0); i >= 0; i = written.nextSetBit(i + 1)) {
            result.add(MemoryAddress.of(i));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return A copy of all {@value Config#MEMORY_SIZE} cell values.
     */
    public int[] toArray() {
        return cells.clone();
    }

    void copyInto(int[] targetCells, BitSet targetWritten) {
        System.arraycopy(cells, 0, targetCells, 0, cells.length);
        targetWritten.clear();
        targetWritten.or(written);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemorySnapshot that)) return false;
        return Arrays.equals(cells, that.cells) && written.equals(that.written);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(cells) + written.hashCode();
    }

    @Override
    public String toString() {
        return "MemorySnapshot{written=" + written.cardinality() + " cells}";
    }
}
