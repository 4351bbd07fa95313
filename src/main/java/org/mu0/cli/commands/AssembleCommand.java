package org.mu0.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.mu0.assembler.Assembler;
import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.ProgramArtifact;
import org.mu0.cli.CommandLineInterface;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "assemble", mixinStandardHelpOptions = true,
        description = "Assembles a MU0 source file and prints the program listing and memory image as JSON.")
public class AssembleCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the MU0 source file.")
    private File file;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();

        final ProgramArtifact artifact;
        try {
            artifact = new Assembler().assemble(file.toPath());
        } catch (AssemblyException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return RunCommand.EXIT_ASSEMBLY_ERROR;
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(AssemblyListing.of(artifact)));
        out.flush();
        return 0;
    }
}
