package org.mu0.runtime.model;

import org.mu0.runtime.Config;

import java.util.BitSet;

/**
 * The machine's flat data memory: {@value Config#MEMORY_SIZE} signed 12-bit cells, zero-initialized.
 * <p>
 * Besides the cell values the memory remembers which cells have been written (by a data
 * directive or a STORE), so that dumps can show the cells a program actually uses.
 * Not thread-safe.
 */
public class Memory {

    private final int[] cells = new int[Config.MEMORY_SIZE];
    private final BitSet written = new BitSet(Config.MEMORY_SIZE);

    /**
     * Creates an empty memory.
     */
    public Memory() {
    }

    /**
     * Creates a memory holding the contents of a snapshot.
     *
     * @param image The snapshot to copy.
     */
    public Memory(MemorySnapshot image) {
        restore(image);
    }

    /**
     * @param address The cell to read.
     * @return The signed value of the cell.
     */
    public int read(MemoryAddress address) {
        return cells[address.value()];
    }

    /**
     * Stores a value and marks the cell as written.
     *
     * @param address The cell to write.
     * @param value The signed value, in [-2048, 2047].
     * @throws IllegalArgumentException if the value is not a valid word.
     */
    public void write(MemoryAddress address, int value) {
        cells[address.value()] = Word.requireValid(value);
        written.set(address.value());
    }

    /**
     * @param address The cell to check.
     * @return {@code true} if the cell has been written since creation or the last restore.
     */
    public boolean isWritten(MemoryAddress address) {
        return written.get(address.value());
    }

    /**
     * Replaces the entire contents with those of a snapshot.
     *
     * @param image The snapshot to copy.
     */
    public void restore(MemorySnapshot image) {
        image.copyInto(cells, written);
    }

    /**
     * @return A detached copy of the current contents.
     */
    public MemorySnapshot snapshot() {
        return new MemorySnapshot(cells, written);
    }
}
