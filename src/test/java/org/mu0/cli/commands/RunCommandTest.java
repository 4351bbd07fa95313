package org.mu0.cli.commands;

import org.mu0.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives {@code mu0 run} and {@code mu0 assemble} through picocli against real source files.
 */
@Tag("integration")
class RunCommandTest {

    private static final String PROGRAM = String.join("\n",
            "INI 0x10 0x3",
            "LOAD 0x10 ; take it",
            "ADD 0x10",
            "STOP",
            "");

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final AtomicInteger prompts = new AtomicInteger();
    private boolean continueStepping = true;

    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        StepPrompt prompt = () -> {
            prompts.incrementAndGet();
            return continueStepping;
        };
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(prompt);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        cmd = CommandLineInterface.createCommandLine(factory);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path write(String source) throws Exception {
        Path file = dir.resolve("program.asm");
        Files.writeString(file, source);
        return file;
    }

    private static Path resource(String name) throws Exception {
        return Path.of(RunCommandTest.class.getResource("/programs/" + name).toURI());
    }

    @Test
    void runsToCompletionAndDumpsMemory() throws Exception {
        int exitCode = cmd.execute("run", write(PROGRAM).toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("### Parsing source file ...")
                .contains("### Memory dump before program execution:")
                .contains("  @0x010: 0x003 (dec: 3)")
                .contains("### Reached STOP instruction at line 4.")
                .contains("### Memory dump after program end:");
        assertThat(prompts.get()).isZero();
    }

    @Test
    void stepModeTracesEveryInstructionAndPauses() throws Exception {
        int exitCode = cmd.execute("run", "--step", write(PROGRAM).toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Executed line 2, instr. 0x000: LOAD 0x010")
                .contains("Comment: take it")
                .contains("  Current PC value:  0x001")
                .contains("  Current ACC value: 0x003 (dec: 3)")
                .contains("Executed line 3, instr. 0x001: ADD 0x010")
                .contains("Comment: None")
                .contains("  Current ACC value: 0x006 (dec: 6)");
        assertThat(prompts.get()).isEqualTo(2);
    }

    @Test
    void abortingStepModeEndsExecution() throws Exception {
        continueStepping = false;

        int exitCode = cmd.execute("run", "-s", write(PROGRAM).toString());

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_ABORTED);
        assertThat(out.toString()).contains("### Execution interrupted.");
        assertThat(prompts.get()).isEqualTo(1);
    }

    @Test
    void stepLimitStopsEndlessProgram() throws Exception {
        int exitCode = cmd.execute("run", "--max-steps", "50", resource("endless_loop.asm").toString());

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_STEP_LIMIT);
        assertThat(out.toString()).contains("### Step limit of 50 reached without halting.");
        assertThat(out.toString()).contains("Warning: program contains no STOP instruction");
    }

    @Test
    void assemblyErrorsNameTheLine() throws Exception {
        int exitCode = cmd.execute("run", resource("syntax_error.asm").toString());

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_ASSEMBLY_ERROR);
        assertThat(err.toString())
                .contains("Line 3: unrecognized instruction")
                .contains("   MUL 0x100");
        assertThat(out.toString()).doesNotContain("### Running the program");
    }

    @Test
    void reportsEndOfInstructions() throws Exception {
        int exitCode = cmd.execute("run", write("LOAD 0x0\nADD 0x0\n").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("### Reached end of instructions.");
    }

    @Test
    void reportsJumpOutsideProgram() throws Exception {
        int exitCode = cmd.execute("run", write("LOAD 0x0\nJUMP 0x5\n").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("### Invalid program counter 0x005: the program has 2 instructions.");
    }

    @Test
    void assembleCommandPrintsJsonListing() throws Exception {
        int exitCode = cmd.execute("assemble", "-f", write(PROGRAM).toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("\"instruction\": \"LOAD 0x010\"")
                .contains("\"instruction\": \"STOP\"")
                .contains("\"0x010\": \"0x003\"");
    }

    @Test
    void assembleCommandReportsErrors() throws Exception {
        int exitCode = cmd.execute("assemble", "-f", resource("syntax_error.asm").toString());

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_ASSEMBLY_ERROR);
        assertThat(err.toString()).contains("MUL 0x100");
    }
}
