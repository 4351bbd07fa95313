package org.mu0.cli.commands;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * A {@link StepPrompt} that waits for ENTER on the system terminal.
 * The terminal is opened on first use.
 */
public class TerminalStepPrompt implements StepPrompt, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TerminalStepPrompt.class);
    private static final String PROMPT = "Press ENTER for next instruction";

    private Terminal terminal;
    private LineReader reader;

    @Override
    public boolean awaitNext() {
        try {
            lineReader().readLine(PROMPT);
            return true;
        } catch (UserInterruptException | EndOfFileException e) {
            LOG.debug("Step prompt ended by user: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    @Override
    public void close() throws IOException {
        if (terminal != null) {
            terminal.close();
        }
    }

    private LineReader lineReader() {
        if (reader == null) {
            try {
                terminal = TerminalBuilder.builder().system(true).build();
            } catch (IOException e) {
                LOG.debug("System terminal unavailable, falling back to a dumb terminal", e);
                try {
                    terminal = TerminalBuilder.builder().dumb(true).build();
                } catch (IOException fallback) {
                    throw new UncheckedIOException("Cannot open a terminal for step mode", fallback);
                }
            }
            reader = LineReaderBuilder.builder().terminal(terminal).build();
        }
        return reader;
    }
}
