package org.mu0.runtime.services;

import org.mu0.runtime.model.MemoryAddress;
import org.mu0.runtime.model.MemorySnapshot;
import org.mu0.runtime.model.Word;

import java.util.stream.Collectors;

/**
 * Formats memory contents for display.
 * <p>
 * One line per written cell, ascending by address: {@code   @0x100: 0xfa3 (dec: -93)}.
 * The hex column is the cell's 12-bit two's-complement pattern, the decimal column its signed value.
 */
public final class MemoryDump {

    private MemoryDump() {}

    /**
     * @param memory The snapshot to format.
     * @return The dump, lines separated by {@code \n}; empty if no cell has been written.
     */
    public static String format(MemorySnapshot memory) {
        return memory.writtenAddresses().stream()
                .map(address -> formatCell(address, memory.read(address)))
                .collect(Collectors.joining("\n"));
    }

    /**
     * @param address The cell address.
     * @param value The signed cell value.
     * @return A single dump line.
     */
    public static String formatCell(MemoryAddress address, int value) {
        return String.format("  @%s: %s (dec: %d)", Word.formatHex(address.value()), Word.toHex(value), value);
    }
}
