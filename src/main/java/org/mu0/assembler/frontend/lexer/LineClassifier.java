package org.mu0.assembler.frontend.lexer;

import org.mu0.assembler.api.AssemblerErrorCode;
import org.mu0.assembler.api.AssemblyException;
import org.mu0.assembler.api.SourceInfo;
import org.mu0.assembler.frontend.encoding.HexLiteralEncoder;
import org.mu0.runtime.isa.Instruction;
import org.mu0.runtime.isa.Opcode;
import org.mu0.runtime.model.MemoryAddress;

import java.util.Optional;

/**
 * Turns single source lines into {@link ClassifiedLine}s.
 * <p>
 * A {@code ;} starts a comment that runs to the end of the line. What remains is split on
 * whitespace; the first token decides the line's shape. Classification is a pure function of
 * one line, so a classifier carries no state between calls.
 */
public class LineClassifier {

    /** The mnemonic of the data directive. */
    public static final String DATA_DIRECTIVE = "INI";

    private static final char COMMENT_START = ';';

    /**
     * Classifies one line.
     *
     * @param line The raw line.
     * @return The classification.
     * @throws AssemblyException if the line has no recognized shape or a literal is invalid.
     */
    public ClassifiedLine classify(SourceLine line) throws AssemblyException {
        String text = line.text();
        int commentStart = text.indexOf(COMMENT_START);
        String code = (commentStart >= 0 ? text.substring(0, commentStart) : text).strip();

        if (code.isEmpty()) {
            return commentStart >= 0 ? new ClassifiedLine.Comment(line) : new ClassifiedLine.Blank(line);
        }

        String[] tokens = code.split("\\s+");
        SourceInfo sourceInfo = line.toSourceInfo();

        if (DATA_DIRECTIVE.equals(tokens[0])) {
            requireOperandCount(tokens, 2, sourceInfo);
            int address = HexLiteralEncoder.decodeAddress(tokens[1], sourceInfo);
            int value = HexLiteralEncoder.decodeValue(tokens[2], sourceInfo);
            return new ClassifiedLine.Data(line, MemoryAddress.of(address), value);
        }

        Optional<Opcode> opcode = Opcode.fromMnemonic(tokens[0]);
        if (opcode.isEmpty()) {
            throw new AssemblyException(AssemblerErrorCode.SYNTAX_ERROR,
                    "unknown mnemonic '" + tokens[0] + "'", sourceInfo);
        }

        Opcode op = opcode.get();
        if (!op.hasOperand()) {
            requireOperandCount(tokens, 0, sourceInfo);
            return new ClassifiedLine.InstructionLine(line, Instruction.stop(sourceInfo));
        }
        requireOperandCount(tokens, 1, sourceInfo);
        int operand = HexLiteralEncoder.decodeAddress(tokens[1], sourceInfo);
        return new ClassifiedLine.InstructionLine(line, Instruction.of(op, operand, sourceInfo));
    }

    private static void requireOperandCount(String[] tokens, int expected, SourceInfo sourceInfo) throws AssemblyException {
        int actual = tokens.length - 1;
        if (actual != expected) {
            throw new AssemblyException(AssemblerErrorCode.SYNTAX_ERROR,
                    String.format("%s expects %d operand(s) but got %d", tokens[0], expected, actual), sourceInfo);
        }
    }
}
