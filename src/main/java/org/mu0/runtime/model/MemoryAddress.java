package org.mu0.runtime.model;

import org.mu0.runtime.Config;

/**
 * A cell address in the machine's memory, in [0, 4095].
 * <p>
 * Deliberately a different type from {@link InstructionIndex}: the two index spaces overlap
 * numerically but never mean the same thing.
 *
 * @param value The address.
 */
public record MemoryAddress(int value) implements Comparable<MemoryAddress> {

    public MemoryAddress {
        if (value < 0 || value > Config.MAX_ADDRESS) {
            throw new IllegalArgumentException("Memory address out of range: " + value);
        }
    }

    /**
     * @param value The address.
     * @return A new address.
     */
    public static MemoryAddress of(int value) {
        return new MemoryAddress(value);
    }

    @Override
    public int compareTo(MemoryAddress other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "@" + Word.formatHex(value);
    }
}
