package org.mu0.cli.commands;

import com.typesafe.config.Config;
import org.mu0.assembler.Assembler;
import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.ProgramArtifact;
import org.mu0.assembler.api.SourceInfo;
import org.mu0.cli.CommandLineInterface;
import org.mu0.runtime.Machine;
import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.model.HaltReason;
import org.mu0.runtime.model.InstructionIndex;
import org.mu0.runtime.model.MachineState;
import org.mu0.runtime.model.Word;
import org.mu0.runtime.services.Disassembler;
import org.mu0.runtime.services.MemoryDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Assembles a source file and executes it, either to completion or one instruction at a time.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Assembles and runs a MU0 program."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    /** Exit code when the source does not assemble. */
    public static final int EXIT_ASSEMBLY_ERROR = 2;
    /** Exit code when the step limit was reached before the machine halted. */
    public static final int EXIT_STEP_LIMIT = 3;
    /** Exit code when the user aborted step mode. */
    public static final int EXIT_ABORTED = 130;

    @Parameters(index = "0", description = "The MU0 source file.")
    private File file;

    @Option(names = {"-s", "--step"}, description = "Execute one instruction at a time, showing the machine state after each.")
    private boolean stepMode;

    @Option(names = "--max-steps", description = "Stop after this many steps if the program has not halted (0 = no limit). Default: mu0.run.max-steps")
    private Long maxSteps;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final StepPrompt stepPrompt;

    public RunCommand() {
        this(null);
    }

    /**
     * @param stepPrompt Pauses between steps in step mode; {@code null} to use the system terminal.
     */
    public RunCommand(StepPrompt stepPrompt) {
        this.stepPrompt = stepPrompt;
    }

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final long limit = maxSteps != null ? maxSteps : config.getLong("mu0.run.max-steps");
        final boolean dumpMemory = config.getBoolean("mu0.run.dump-memory");
        final PrintWriter out = spec.commandLine().getOut();

        out.println("### Parsing source file ...");
        final ProgramArtifact artifact;
        try {
            artifact = new Assembler().assemble(file.toPath());
        } catch (AssemblyException e) {
            LOG.debug("Assembly failed", e);
            final PrintWriter err = spec.commandLine().getErr();
            final SourceInfo where = e.getSourceInfo();
            if (where != null) {
                err.println("Line " + where.lineNumber() + ": " + e.getErrorCode().description().toLowerCase());
                err.println("   " + where.lineText());
            } else {
                err.println(e.getMessage());
            }
            return EXIT_ASSEMBLY_ERROR;
        }
        artifact.warnings().forEach(w -> out.println("Warning: " + w.message()));

        final Machine machine = new Machine(artifact);
        if (dumpMemory) {
            out.println();
            out.println("### Memory dump before program execution:");
            out.println(MemoryDump.format(machine.state().memory()));
        }

        out.println();
        out.println("### Running the program ...");
        out.flush();

        final MachineState last;
        if (!stepMode && limit <= 0) {
            last = machine.run();
        } else {
            final StepPrompt prompt;
            if (!stepMode) {
                prompt = () -> true;
            } else {
                prompt = stepPrompt != null ? stepPrompt : new TerminalStepPrompt();
            }
            try {
                final Optional<MachineState> finished = runStepwise(machine, limit, prompt, dumpMemory, out);
                if (finished.isEmpty()) {
                    return machine.state().steps() >= limit && limit > 0 ? EXIT_STEP_LIMIT : EXIT_ABORTED;
                }
                last = finished.get();
            } finally {
                if (prompt instanceof AutoCloseable closeable) {
                    closeable.close();
                }
            }
        }

        reportHalt(machine, last, out);
        if (dumpMemory) {
            out.println();
            out.println("### Memory dump after program end:");
            out.println(MemoryDump.format(last.memory()));
        }
        out.flush();
        return 0;
    }

    /**
     * Steps the machine until it halts, the limit is reached or the user aborts.
     *
     * @return The final state, or empty if execution ended without halting.
     */
    private Optional<MachineState> runStepwise(Machine machine, long limit, StepPrompt prompt, boolean dumpMemory, PrintWriter out) {
        MachineState state = machine.state();
        while (!state.halted()) {
            if (limit > 0 && state.steps() >= limit) {
                out.println();
                out.println("### Step limit of " + limit + " reached without halting.");
                out.flush();
                LOG.warn("Program {} did not halt within {} steps", file, limit);
                return Optional.empty();
            }

            final InstructionIndex executed = state.pc();
            state = machine.step();

            if (stepMode && !state.halted()) {
                printStep(machine, executed, state, dumpMemory, out);
                if (!prompt.awaitNext()) {
                    out.println();
                    out.println("### Execution interrupted.");
                    out.flush();
                    return Optional.empty();
                }
            }
        }
        return Optional.of(state);
    }

    private void printStep(Machine machine, InstructionIndex executed, MachineState state, boolean dumpMemory, PrintWriter out) {
        final Instruction instruction = machine.getProgram().fetch(executed).orElseThrow();
        final SourceInfo source = instruction.sourceInfo();
        out.println();
        out.printf("Executed line %d, instr. %s: %s%n",
                source != null ? source.lineNumber() : 0, Word.formatHex(executed.value()), Disassembler.disassemble(instruction));
        out.println("Comment: " + (source != null ? source.comment().orElse("None") : "None"));
        out.printf("  Current PC value:  %s%n", Word.formatHex(state.pc().value()));
        out.printf("  Current ACC value: %s (dec: %d)%n", Word.toHex(state.acc()), state.acc());
        if (dumpMemory) {
            out.println("Memory dump after instruction execution:");
            out.println(MemoryDump.format(state.memory()));
        }
        out.flush();
    }

    private void reportHalt(Machine machine, MachineState state, PrintWriter out) {
        out.println();
        if (state.haltReason() == HaltReason.STOP) {
            final SourceInfo source = machine.getProgram().fetch(state.pc()).map(Instruction::sourceInfo).orElse(null);
            out.println("### Reached STOP instruction" + (source != null ? " at line " + source.lineNumber() : "") + ".");
        } else if (state.pc().value() == machine.getProgram().size()) {
            out.println("### Reached end of instructions.");
        } else {
            out.printf("### Invalid program counter %s: the program has %d instructions.%n",
                    Word.formatHex(state.pc().value()), machine.getProgram().size());
        }
        LOG.info("Program {} halted ({}) after {} steps", file, state.haltReason(), state.steps());
    }
}
