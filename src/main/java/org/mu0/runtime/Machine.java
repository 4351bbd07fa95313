package org.mu0.runtime;

import org.mu0.assembler.api.ProgramArtifact;
import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.isa.Program;
import org.mu0.runtime.model.HaltReason;
import org.mu0.runtime.model.InstructionIndex;
import org.mu0.runtime.model.MachineState;
import org.mu0.runtime.model.MachineStatus;
import org.mu0.runtime.model.Memory;
import org.mu0.runtime.model.MemorySnapshot;
import org.mu0.runtime.model.Word;
import org.mu0.runtime.services.Disassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The fetch-decode-execute engine.
 * <p>
 * A machine owns its memory, program counter and accumulator for one execution of one program.
 * It moves from {@link MachineStatus#READY} through {@link MachineStatus#RUNNING} to
 * {@link MachineStatus#HALTED}. {@link #run()} has no step limit; callers that need bounded
 * execution drive {@link #step()} themselves. Not thread-safe.
 */
public class Machine {

    private static final Logger LOG = LoggerFactory.getLogger(Machine.class);

    private final Program program;
    private final MemorySnapshot initialImage;
    private final Memory memory;

    private InstructionIndex pc = InstructionIndex.START;
    private int acc;
    private MachineStatus status = MachineStatus.READY;
    private HaltReason haltReason;
    private long steps;

    /**
     * Creates a machine for an assembled program.
     *
     * @param artifact The assembler output.
     */
    public Machine(ProgramArtifact artifact) {
        this(artifact.program(), artifact.initialMemory());
    }

    /**
     * Creates a machine with an explicit program and initial memory.
     *
     * @param program The instruction list.
     * @param initialImage The memory contents before the first step.
     */
    public Machine(Program program, MemorySnapshot initialImage) {
        this.program = program;
        this.initialImage = initialImage;
        this.memory = new Memory(initialImage);
    }

    /**
     * Performs exactly one transition.
     *
     * @return The state after the transition.
     * @throws MachineHaltedException if the machine has already halted.
     */
    public MachineState step() {
        advance();
        return state();
    }

    /**
     * Steps until the machine halts. Does not return for a program that never reaches STOP
     * and never leaves the instruction range.
     *
     * @return The final state.
     * @throws MachineHaltedException if the machine has already halted.
     */
    public MachineState run() {
        do {
            advance();
        } while (status != MachineStatus.HALTED);
        return state();
    }

    /**
     * @return A detached snapshot of the current state.
     */
    public MachineState state() {
        return new MachineState(pc, acc, status, haltReason, memory.snapshot(), steps);
    }

    /**
     * Restores the initial memory image and clears the registers, so the program can be run again.
     */
    public void reset() {
        memory.restore(initialImage);
        pc = InstructionIndex.START;
        acc = 0;
        status = MachineStatus.READY;
        haltReason = null;
        steps = 0;
        LOG.debug("Machine reset");
    }

    /**
     * @return {@code true} once the machine has reached its terminal state.
     */
    public boolean isHalted() {
        return status == MachineStatus.HALTED;
    }

    /**
     * @return The program this machine executes.
     */
    public Program getProgram() {
        return program;
    }

    private void advance() {
        if (status == MachineStatus.HALTED) {
            throw new MachineHaltedException(haltReason, pc);
        }
        steps++;

        Optional<Instruction> fetched = program.fetch(pc);
        if (fetched.isEmpty()) {
            halt(HaltReason.INVALID_PROGRAM_COUNTER);
            return;
        }

        Instruction instruction = fetched.get();
        InstructionIndex current = pc;
        pc = execute(instruction);
        if (status != MachineStatus.HALTED) {
            status = MachineStatus.RUNNING;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} {} -> pc={} acc={}", current, Disassembler.disassemble(instruction), pc.value(), acc);
        }
    }

    private InstructionIndex execute(Instruction instruction) {
        return switch (instruction.opcode()) {
            case LOAD -> {
                acc = memory.read(instruction.address());
                yield pc.next();
            }
            case STORE -> {
                memory.write(instruction.address(), acc);
                yield pc.next();
            }
            case ADD -> {
                acc = Word.wrap((long) acc + memory.read(instruction.address()));
                yield pc.next();
            }
            case SUB -> {
                acc = Word.wrap((long) acc - memory.read(instruction.address()));
                yield pc.next();
            }
            case JUMP -> instruction.target();
            case JGE -> acc >= 0 ? instruction.target() : pc.next();
            case JNE -> acc != 0 ? instruction.target() : pc.next();
            case STOP -> {
                halt(HaltReason.STOP);
                yield pc;
            }
        };
    }

    private void halt(HaltReason reason) {
        status = MachineStatus.HALTED;
        haltReason = reason;
        LOG.info("Machine halted ({}) at instruction {} after {} steps", reason, pc.value(), steps);
    }
}
